package com.example.emotion.session;

public class SessionNotTrackingException extends EmotionSessionException {

    public SessionNotTrackingException(String sessionId) {
        super(sessionId, "会话 " + sessionId + " 已停止，不能继续处理帧");
    }
}
