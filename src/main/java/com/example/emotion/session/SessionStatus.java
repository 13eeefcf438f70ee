package com.example.emotion.session;

/**
 * 会话状态。未注册的会话即 Uninitialized。
 */
public enum SessionStatus {
    TRACKING,
    STOPPED
}
