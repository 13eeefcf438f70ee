package com.example.emotion.classifier;

import com.example.emotion.dto.FrameImage;

import java.util.Optional;

/**
 * 模型未配置或加载失败时使用
 */
public class UnavailableEmotionClassifier implements EmotionClassifier {

    private final String reason;

    public UnavailableEmotionClassifier(String reason) {
        this.reason = reason;
    }

    @Override
    public Optional<ClassifierResult> classify(FrameImage image) {
        return Optional.empty();
    }

    @Override
    public String getName() {
        return "unavailable(" + reason + ")";
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
