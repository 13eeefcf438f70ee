package com.example.emotion.dto;

import com.example.emotion.classifier.Emotion;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 会话级汇总，每次按需从帧序列计算，不缓存
 */
@Value
@Builder
public class SessionSummary {

    @JsonProperty("session_id")
    String sessionId;

    @JsonProperty("started_at")
    LocalDateTime startedAt;

    /** 最大帧时间戳（会话相对时间） */
    @JsonProperty("duration_seconds")
    double durationSeconds;

    /** 检测到人脸的帧数 */
    @JsonProperty("total_frames_analyzed")
    int totalFramesAnalyzed;

    /** 收到的全部帧数，包括无人脸帧 */
    @JsonProperty("frame_count")
    int frameCount;

    /** 各主导情绪所占帧比例，总和为1 */
    @JsonProperty("emotion_distribution")
    Map<String, Double> emotionDistribution;

    @JsonProperty("avg_stress_score")
    double avgStressScore;

    @JsonProperty("avg_anxiety_score")
    double avgAnxietyScore;

    @JsonProperty("avg_engagement_score")
    double avgEngagementScore;

    @JsonProperty("predominant_emotion")
    Emotion predominantEmotion;
}
