package com.example.emotion.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * 综合评分，均位于[0,1]
 */
@Value
@Builder
public class CompositeScores {

    @JsonProperty("stress_score")
    double stressScore;

    @JsonProperty("anxiety_score")
    double anxietyScore;

    @JsonProperty("engagement_score")
    double engagementScore;

    @JsonProperty("overall_confidence")
    double overallConfidence;
}
