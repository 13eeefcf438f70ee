package com.example.emotion.classifier;

import com.example.emotion.dto.FrameImage;

import java.util.Optional;

/**
 * 情绪分类模型适配器。与关键点模型各自检测人脸，两者结果不保证一致。
 */
public interface EmotionClassifier {

    /**
     * @return 分类器自身未找到人脸时返回 {@code Optional.empty()}
     */
    Optional<ClassifierResult> classify(FrameImage image);

    String getName();

    boolean isAvailable();
}
