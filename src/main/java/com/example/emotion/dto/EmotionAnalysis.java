package com.example.emotion.dto;

import com.example.emotion.classifier.Emotion;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * 融合后的情绪判断
 */
@Value
@Builder
public class EmotionAnalysis {

    /** 经过几何信号升级规则调整后的主导情绪 */
    @JsonProperty("dominant_emotion")
    Emotion dominantEmotion;

    /** 分类器与几何信号的加权置信度 */
    @JsonProperty("confidence")
    double confidence;

    /** 分类器原始概率分布，分类器未检出人脸时为空 */
    @JsonProperty("emotion_probabilities")
    Map<String, Double> emotionProbabilities;
}
