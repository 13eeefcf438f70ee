package com.example.emotion.session;

public class SessionAlreadyActiveException extends EmotionSessionException {

    public SessionAlreadyActiveException(String sessionId) {
        super(sessionId, "会话 " + sessionId + " 已在情绪跟踪中，请先停止");
    }
}
