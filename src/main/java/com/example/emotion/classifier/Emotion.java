package com.example.emotion.classifier;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 情绪标签。前七个为分类器词表，STRESSED / ANXIOUS 只由融合规则产生。
 */
public enum Emotion {
    ANGRY("angry"),
    DISGUST("disgust"),
    FEAR("fear"),
    HAPPY("happy"),
    SAD("sad"),
    SURPRISE("surprise"),
    NEUTRAL("neutral"),
    STRESSED("stressed"),
    ANXIOUS("anxious");

    /** 分类器输出词表 */
    public static final List<Emotion> CLASSIFIER_VOCABULARY = Collections.unmodifiableList(
            Arrays.asList(ANGRY, DISGUST, FEAR, HAPPY, SAD, SURPRISE, NEUTRAL));

    private final String label;

    Emotion(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    public boolean isClassifierLabel() {
        return CLASSIFIER_VOCABULARY.contains(this);
    }

    public static Emotion fromLabel(String label) {
        for (Emotion emotion : values()) {
            if (emotion.label.equalsIgnoreCase(label)) {
                return emotion;
            }
        }
        throw new IllegalArgumentException("未知情绪标签: " + label);
    }
}
