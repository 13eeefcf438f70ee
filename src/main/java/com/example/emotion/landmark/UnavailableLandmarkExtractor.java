package com.example.emotion.landmark;

import com.example.emotion.dto.FrameImage;

import java.util.Optional;

/**
 * 模型未配置或加载失败时使用，始终报告无人脸
 */
public class UnavailableLandmarkExtractor implements LandmarkExtractor {

    private final String reason;

    public UnavailableLandmarkExtractor(String reason) {
        this.reason = reason;
    }

    @Override
    public Optional<LandmarkSet> extract(FrameImage image) {
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
