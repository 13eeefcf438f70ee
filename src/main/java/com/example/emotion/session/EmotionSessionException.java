package com.example.emotion.session;

/**
 * 会话管理误用（调用顺序错误），与无人脸、模型故障不同，调用方必须处理
 */
public abstract class EmotionSessionException extends RuntimeException {

    private final String sessionId;

    protected EmotionSessionException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
