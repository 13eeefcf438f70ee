package com.example.emotion.config;

import com.example.emotion.classifier.EmotionClassifier;
import com.example.emotion.classifier.GuardedEmotionClassifier;
import com.example.emotion.classifier.OpenCvDnnEmotionClassifier;
import com.example.emotion.classifier.UnavailableEmotionClassifier;
import com.example.emotion.landmark.GuardedLandmarkExtractor;
import com.example.emotion.landmark.LandmarkExtractor;
import com.example.emotion.landmark.OpenCvLandmarkExtractor;
import com.example.emotion.landmark.UnavailableLandmarkExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 模型适配器装配和启动检查
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class ModelConfiguration {

    private static final String DISABLED = "emotion.models.enabled=false";

    private final ModelProperties modelProperties;

    @Bean
    public LandmarkExtractor landmarkExtractor() {
        if (!modelProperties.isEnabled()) {
            return new UnavailableLandmarkExtractor(DISABLED);
        }
        try {
            return new GuardedLandmarkExtractor(new OpenCvLandmarkExtractor(
                    modelProperties.getCascadePath(), modelProperties.getFacemarkModelPath(),
                    modelProperties.getPoolSize()));
        } catch (RuntimeException | LinkageError e) {
            log.error("❌ 关键点模型加载失败: {}", e.getMessage(), e);
            return new UnavailableLandmarkExtractor(e.getMessage());
        }
    }

    @Bean
    public EmotionClassifier emotionClassifier() {
        if (!modelProperties.isEnabled()) {
            return new UnavailableEmotionClassifier(DISABLED);
        }
        try {
            return new GuardedEmotionClassifier(new OpenCvDnnEmotionClassifier(
                    modelProperties.getCascadePath(), modelProperties.getClassifierModelPath(),
                    modelProperties.getPoolSize()));
        } catch (RuntimeException | LinkageError e) {
            log.error("❌ 情绪分类模型加载失败: {}", e.getMessage(), e);
            return new UnavailableEmotionClassifier(e.getMessage());
        }
    }

    /**
     * 启动时报告模型可用性
     */
    @Bean
    public CommandLineRunner modelAvailabilityCheck(LandmarkExtractor landmarkExtractor,
                                                    EmotionClassifier emotionClassifier,
                                                    EmotionAnalysisProperties analysisProperties) {
        return args -> {
            log.info("初始化情绪分析管线, 目标帧率: {}fps", analysisProperties.getFps());
            log.info("关键点后端: {} ({})", landmarkExtractor.getName(),
                    landmarkExtractor.isAvailable() ? "可用" : "不可用");
            log.info("情绪分类后端: {} ({})", emotionClassifier.getName(),
                    emotionClassifier.isAvailable() ? "可用" : "不可用");

            if (landmarkExtractor.isAvailable()) {
                log.info("✅ 情绪分析管线初始化完成");
            } else {
                log.warn("🔄 关键点模型不可用，所有帧都将报告为未检测到人脸");
            }
        };
    }
}
