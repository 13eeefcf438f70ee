package com.example.emotion.landmark;

import com.example.emotion.dto.FrameImage;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * 吞掉后端异常的装饰器：模型故障按"未检测到人脸"处理，单帧失败不会中断会话
 */
@Slf4j
public class GuardedLandmarkExtractor implements LandmarkExtractor {

    private final LandmarkExtractor delegate;

    public GuardedLandmarkExtractor(LandmarkExtractor delegate) {
        this.delegate = delegate;
    }

    @Override
    public Optional<LandmarkSet> extract(FrameImage image) {
        try {
            Optional<LandmarkSet> landmarks = delegate.extract(image);
            return landmarks != null ? landmarks : Optional.empty();
        } catch (RuntimeException | LinkageError e) {
            log.warn("关键点后端 {} 处理失败，按无人脸处理: {}", delegate.getName(), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public boolean isAvailable() {
        return delegate.isAvailable();
    }
}
