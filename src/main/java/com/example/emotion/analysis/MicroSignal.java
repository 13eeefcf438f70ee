package com.example.emotion.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

/**
 * 单个微表情指标的结果，强度和置信度始终位于[0,1]
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MicroSignal {

    private static final MicroSignal NONE = new MicroSignal(false, 0.0, 0.0, null, null);

    @JsonProperty("detected")
    boolean detected;

    @JsonProperty("intensity")
    double intensity;

    @JsonProperty("confidence")
    double confidence;

    /** 仅频率类指标（眨眼）有值 */
    @JsonProperty("rate_per_minute")
    Double ratePerMinute;

    /** 仅微笑指标有值 */
    @JsonProperty("type")
    SmileType smileType;

    @Builder
    private MicroSignal(boolean detected, double intensity, double confidence,
                        Double ratePerMinute, SmileType smileType) {
        this.detected = detected;
        this.intensity = ScoreMath.clamp01(intensity);
        this.confidence = ScoreMath.clamp01(confidence);
        if (ratePerMinute == null) {
            this.ratePerMinute = null;
        } else {
            this.ratePerMinute = Double.isNaN(ratePerMinute) ? 0.0 : Math.max(0.0, ratePerMinute);
        }
        this.smileType = smileType;
    }

    public static MicroSignal of(boolean detected, double intensity, double confidence) {
        return new MicroSignal(detected, intensity, confidence, null, null);
    }

    /** 未检测、强度和置信度为0 */
    public static MicroSignal none() {
        return NONE;
    }
}
