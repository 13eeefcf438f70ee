package com.example.emotion.session;

public class SessionNotFoundException extends EmotionSessionException {

    public SessionNotFoundException(String sessionId) {
        super(sessionId, "会话 " + sessionId + " 未开始情绪跟踪");
    }
}
