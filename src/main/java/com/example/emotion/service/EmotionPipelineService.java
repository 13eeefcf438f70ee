package com.example.emotion.service;

import com.example.emotion.dto.FrameAnalysis;
import com.example.emotion.dto.FrameImage;
import com.example.emotion.dto.SessionSummary;
import com.example.emotion.session.SessionState;

import java.util.List;
import java.util.Optional;

/**
 * 会话级情绪分析管线
 */
public interface EmotionPipelineService {

    /**
     * 开始跟踪会话
     *
     * @throws com.example.emotion.session.SessionAlreadyActiveException 会话已在跟踪中
     */
    SessionState startSession(String sessionId);

    /**
     * 处理一帧：关键点 → 分类器 → 微表情 → 融合，同一会话的帧串行执行
     *
     * @param timestamp 会话相对时间（秒），为null时按 已收帧数 / fps 推算
     * @throws com.example.emotion.session.SessionNotFoundException    会话不存在
     * @throws com.example.emotion.session.SessionNotTrackingException 会话已停止
     */
    FrameAnalysis processFrame(String sessionId, FrameImage image, Double timestamp);

    /**
     * 计算当前会话汇总，尚无人脸帧时为空
     */
    Optional<SessionSummary> summarize(String sessionId);

    /**
     * 停止跟踪并返回最终汇总；状态保留为 STOPPED，直到 {@link #discardSession}
     */
    Optional<SessionSummary> stopSession(String sessionId);

    /**
     * 释放会话状态
     */
    boolean discardSession(String sessionId);

    /**
     * 最近的人脸帧分析结果，从旧到新
     */
    List<FrameAnalysis> recentAnalyses(String sessionId);

    /**
     * 用一次性会话分析单帧，不保留任何状态
     */
    FrameAnalysis analyzeSingleFrame(FrameImage image);

    /**
     * 会话已收到的帧数（包括无人脸帧）
     */
    int framesReceived(String sessionId);

    long activeSessionCount();
}
