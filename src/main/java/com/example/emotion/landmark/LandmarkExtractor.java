package com.example.emotion.landmark;

import com.example.emotion.dto.FrameImage;

import java.util.Optional;

/**
 * 关键点模型适配器
 */
public interface LandmarkExtractor {

    /**
     * 提取一帧中单张人脸的关键点
     *
     * @param image BGR帧
     * @return 未检测到人脸时返回 {@code Optional.empty()}，这是常见情况而非错误
     */
    Optional<LandmarkSet> extract(FrameImage image);

    /** 后端名称，用于日志和状态接口 */
    String getName();

    /** 模型资源是否已加载 */
    boolean isAvailable();
}
