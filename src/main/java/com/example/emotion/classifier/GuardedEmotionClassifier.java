package com.example.emotion.classifier;

import com.example.emotion.dto.FrameImage;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * 后端异常按"无分类结果"处理并记录日志，不向上传播
 */
@Slf4j
public class GuardedEmotionClassifier implements EmotionClassifier {

    private final EmotionClassifier delegate;

    public GuardedEmotionClassifier(EmotionClassifier delegate) {
        this.delegate = delegate;
    }

    @Override
    public Optional<ClassifierResult> classify(FrameImage image) {
        try {
            Optional<ClassifierResult> result = delegate.classify(image);
            return result != null ? result : Optional.empty();
        } catch (RuntimeException | LinkageError e) {
            log.warn("情绪分类后端 {} 处理失败，忽略本帧分类: {}", delegate.getName(), e.getMessage());
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
