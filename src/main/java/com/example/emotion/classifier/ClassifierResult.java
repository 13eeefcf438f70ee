package com.example.emotion.classifier;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 分类器输出：主导情绪、置信度和完整概率分布，只能经 {@link #fromProbabilities} 校验后创建
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ClassifierResult {

    Emotion dominantEmotion;
    double confidence;
    Map<Emotion, Double> probabilities;

    /**
     * 由概率分布构造，主导情绪取最大概率项（并列时取词表中靠前者）
     */
    public static ClassifierResult fromProbabilities(Map<Emotion, Double> probabilities) {
        if (probabilities == null || probabilities.isEmpty()) {
            throw new IllegalArgumentException("概率分布不能为空");
        }
        EnumMap<Emotion, Double> copy = new EnumMap<>(Emotion.class);
        Emotion dominant = null;
        double best = Double.NEGATIVE_INFINITY;
        for (Emotion emotion : Emotion.CLASSIFIER_VOCABULARY) {
            Double value = probabilities.get(emotion);
            if (value == null) {
                continue;
            }
            if (!Double.isFinite(value) || value < 0) {
                throw new IllegalArgumentException(emotion.getLabel() + " 的概率无效: " + value);
            }
            copy.put(emotion, value);
            if (value > best) {
                best = value;
                dominant = emotion;
            }
        }
        for (Emotion emotion : probabilities.keySet()) {
            if (!emotion.isClassifierLabel()) {
                throw new IllegalArgumentException("分类器不能输出派生情绪: " + emotion.getLabel());
            }
        }
        return new ClassifierResult(dominant, Math.min(best, 1.0), Collections.unmodifiableMap(copy));
    }
}
