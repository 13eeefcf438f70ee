package com.example.emotion.dto;

import com.example.emotion.analysis.MicroSignal;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 单帧融合分析结果，创建后不可变
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FrameAnalysis {

    /** 会话内相对时间（秒），按调用方给定值保存 */
    @JsonProperty("timestamp")
    double timestamp;

    @JsonProperty("face_detected")
    boolean faceDetected;

    @JsonProperty("emotion_analysis")
    EmotionAnalysis emotionAnalysis;

    /** 只包含已触发的指标 */
    @JsonProperty("micro_expressions")
    Map<String, MicroSignal> microExpressions;

    @JsonProperty("composite_scores")
    CompositeScores compositeScores;

    @JsonProperty("clinical_insights")
    ClinicalInsights clinicalInsights;

    @JsonProperty("error")
    String error;

    public static FrameAnalysis noFace(double timestamp) {
        return FrameAnalysis.builder()
                .timestamp(timestamp)
                .faceDetected(false)
                .error("No face detected")
                .build();
    }
}
