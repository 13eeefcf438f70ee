package com.example.emotion.session;

import com.example.emotion.config.EmotionAnalysisProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 会话状态注册表，每个会话ID同一时刻至多一个 {@link SessionState}
 * <p>
 * 重复开始策略：会话处于 TRACKING 时拒绝；已 STOPPED 的会话被新状态替换。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionRegistry {

    private final EmotionAnalysisProperties properties;
    private final ConcurrentMap<String, SessionState> sessions = new ConcurrentHashMap<>();

    /**
     * @throws SessionAlreadyActiveException 会话已在跟踪中
     */
    public SessionState start(String sessionId) {
        requireId(sessionId);
        SessionState state = sessions.compute(sessionId, (id, existing) -> {
            if (existing != null && existing.isTracking()) {
                throw new SessionAlreadyActiveException(id);
            }
            if (existing != null) {
                log.info("会话 {} 已停止，使用新的状态替换", id);
            }
            return new SessionState(id, properties);
        });
        log.info("✓ 会话 {} 开始情绪跟踪", sessionId);
        return state;
    }

    /**
     * @throws SessionNotFoundException 会话不存在
     */
    public SessionState require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Optional<SessionState> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * 丢弃会话状态（包括时间缓冲）
     */
    public boolean discard(String sessionId) {
        boolean removed = sessionId != null && sessions.remove(sessionId) != null;
        if (removed) {
            log.info("会话 {} 状态已释放", sessionId);
        }
        return removed;
    }

    public long activeCount() {
        return sessions.values().stream().filter(SessionState::isTracking).count();
    }

    public int size() {
        return sessions.size();
    }

    private static void requireId(String sessionId) {
        if (sessionId == null || sessionId.trim().isEmpty()) {
            throw new IllegalArgumentException("会话ID不能为空");
        }
    }
}
