package com.example.emotion.entity;

import lombok.Data;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Table("emotion_summaries")
public class EmotionSummaryRecord {
    @Id
    private Long id;

    @Column("session_id")
    private String sessionId;

    @Column("started_at")
    private LocalDateTime startedAt;

    @Column("stopped_at")
    private LocalDateTime stoppedAt;

    @Column("duration_seconds")
    private BigDecimal durationSeconds;

    @Column("total_frames_analyzed")
    private Integer totalFramesAnalyzed;

    @Column("frame_count")
    private Integer frameCount;

    @Column("avg_stress_score")
    private BigDecimal avgStressScore;

    @Column("avg_anxiety_score")
    private BigDecimal avgAnxietyScore;

    @Column("avg_engagement_score")
    private BigDecimal avgEngagementScore;

    @Column("predominant_emotion")
    private String predominantEmotion;

    @Column("emotion_distribution")
    private String emotionDistribution; // JSON格式

    @Column("created_at")
    private LocalDateTime createdAt;
}
