package com.example.emotion.dto;

import com.example.emotion.classifier.Emotion;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 供人工参考的提示信息，不构成诊断
 */
@Value
@Builder
public class ClinicalInsights {

    @JsonProperty("primary_state")
    Emotion primaryState;

    @JsonProperty("stress_level")
    StressLevel stressLevel;

    @JsonProperty("anxiety_indicators")
    List<String> anxietyIndicators;

    @JsonProperty("positive_indicators")
    List<String> positiveIndicators;
}
