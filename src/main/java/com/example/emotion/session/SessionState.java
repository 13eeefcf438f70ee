package com.example.emotion.session;

import com.example.emotion.analysis.TemporalSignalBuffers;
import com.example.emotion.config.EmotionAnalysisProperties;
import com.example.emotion.dto.FrameAnalysis;
import com.example.emotion.util.BoundedHistory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 单个会话的全部可变状态：只追加的帧序列和微表情时间缓冲
 * <p>
 * 单写者结构。处理帧时调用方需持有本对象的监视器锁，保证同一会话同一时刻只有一帧在处理；
 * 不同会话之间没有共享可变状态。
 */
public class SessionState {

    private final String sessionId;
    private final LocalDateTime startedAt;
    private final TemporalSignalBuffers buffers;
    private final List<FrameAnalysis> frames = new ArrayList<>();
    private final BoundedHistory<FrameAnalysis> recentAnalyses;

    private SessionStatus status = SessionStatus.TRACKING;
    private LocalDateTime stoppedAt;
    private int framesReceived;

    public SessionState(String sessionId, EmotionAnalysisProperties properties) {
        this.sessionId = sessionId;
        this.startedAt = LocalDateTime.now();
        this.buffers = new TemporalSignalBuffers(properties.getBlinkWindow(), properties.getSignalHistory());
        this.recentAnalyses = new BoundedHistory<>(properties.getRecentAnalyses());
    }

    public String getSessionId() {
        return sessionId;
    }

    public LocalDateTime getStartedAt() {
        return startedAt;
    }

    /**
     * 仅在持有本对象锁时使用
     */
    public TemporalSignalBuffers getBuffers() {
        return buffers;
    }

    public synchronized SessionStatus getStatus() {
        return status;
    }

    public synchronized boolean isTracking() {
        return status == SessionStatus.TRACKING;
    }

    public synchronized LocalDateTime getStoppedAt() {
        return stoppedAt;
    }

    /**
     * 记录一帧结果；检测到人脸的帧才进入汇总序列
     */
    public synchronized void record(FrameAnalysis analysis) {
        framesReceived++;
        if (analysis.isFaceDetected()) {
            frames.add(analysis);
            recentAnalyses.add(analysis);
        }
    }

    public synchronized void stop() {
        if (status == SessionStatus.TRACKING) {
            status = SessionStatus.STOPPED;
            stoppedAt = LocalDateTime.now();
        }
    }

    public synchronized int getFramesReceived() {
        return framesReceived;
    }

    public synchronized int getFramesAnalyzed() {
        return frames.size();
    }

    /**
     * 检测到人脸的帧，按追加顺序
     */
    public synchronized List<FrameAnalysis> frames() {
        return Collections.unmodifiableList(new ArrayList<>(frames));
    }

    public synchronized List<FrameAnalysis> recentAnalyses() {
        return recentAnalyses.snapshot();
    }
}
