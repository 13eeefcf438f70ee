package com.example.emotion.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import javax.annotation.PostConstruct;

/**
 * 情绪分析管线参数
 * <p>
 * 阈值与融合权重均未经标注数据校准，全部作为可配置项暴露。
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "emotion.analysis")
public class EmotionAnalysisProperties {

    private static final double WEIGHT_TOLERANCE = 1e-6;

    /** 目标帧率，用于眨眼频率外推 */
    private double fps = 7.0;

    /** 眨眼环形缓冲区容量（帧） */
    private int blinkWindow = 30;

    /** 最近几何信号快照容量（帧） */
    private int signalHistory = 10;

    /** 每个会话保留的最近分析结果数量 */
    private int recentAnalyses = 10;

    private Thresholds thresholds = new Thresholds();

    private Fusion fusion = new Fusion();

    @PostConstruct
    public void validate() {
        if (fps <= 0) {
            throw new IllegalStateException("emotion.analysis.fps 必须大于0: " + fps);
        }
        if (blinkWindow <= 0 || signalHistory <= 0 || recentAnalyses <= 0) {
            throw new IllegalStateException(String.format(
                    "缓冲区容量必须大于0: blinkWindow=%d, signalHistory=%d, recentAnalyses=%d",
                    blinkWindow, signalHistory, recentAnalyses));
        }
        checkPositive("thresholds.eyebrow-raise-range", thresholds.getEyebrowRaiseRange());
        checkPositive("thresholds.lip-press", thresholds.getLipPress());
        checkPositive("thresholds.blink-rate-saturation", thresholds.getBlinkRateSaturation());
        checkPositive("thresholds.eye-widening-range", thresholds.getEyeWideningRange());
        checkPositive("thresholds.jaw-tension-range", thresholds.getJawTensionRange());
        checkPositive("thresholds.smile-full-lift-pixels", thresholds.getSmileFullLiftPixels());
        checkPositive("fusion.blink-rate-normalizer", fusion.getBlinkRateNormalizer());
        checkWeights("stress", fusion.getStressLipPressWeight(), fusion.getStressJawTensionWeight(),
                fusion.getStressBlinkRateWeight());
        checkWeights("anxiety", fusion.getAnxietyEyeWideningWeight(), fusion.getAnxietyEyebrowRaiseWeight(),
                fusion.getAnxietyLipPressWeight());
        if (fusion.getClassifierWeight() < 0 || fusion.getClassifierWeight() > 1) {
            throw new IllegalStateException("分类器权重必须位于[0,1]: " + fusion.getClassifierWeight());
        }
    }

    private void checkPositive(String name, double value) {
        if (!(value > 0)) {
            throw new IllegalStateException("emotion.analysis." + name + " 必须大于0: " + value);
        }
    }

    private void checkWeights(String score, double... weights) {
        double sum = 0;
        for (double weight : weights) {
            if (weight < 0) {
                throw new IllegalStateException(score + " 权重不能为负: " + weight);
            }
            sum += weight;
        }
        if (Math.abs(sum - 1.0) > WEIGHT_TOLERANCE) {
            throw new IllegalStateException(score + " 权重之和必须为1，当前为 " + sum);
        }
    }

    /**
     * 微表情几何阈值
     */
    @Data
    public static class Thresholds {
        /** 眉眼距离 / 脸高 */
        private double eyebrowRaise = 0.08;
        /** 超过阈值后强度线性增长到1所需的跨度 */
        private double eyebrowRaiseRange = 0.04;
        private double eyebrowRaiseConfidence = 0.85;

        /** 唇间距 / 嘴宽 */
        private double lipPress = 0.08;
        private double lipPressConfidence = 0.80;

        /** EAR低于该值视为眨眼 */
        private double blinkEar = 0.2;
        /** 每分钟眨眼次数超过该值视为升高 */
        private double elevatedBlinkRate = 25.0;
        /** 眨眼强度饱和点（次/分钟） */
        private double blinkRateSaturation = 50.0;
        private double blinkRateConfidence = 0.70;

        private double baselineEar = 0.25;
        private double wideEyeEar = 0.35;
        private double eyeWideningRange = 0.15;
        private double eyeWideningConfidence = 0.88;

        /** 下颌高 / 下颌宽 */
        private double jawTensionRatio = 0.65;
        private double jawTensionRange = 0.15;
        private double jawTensionConfidence = 0.75;

        /** 嘴角上扬像素 */
        private double smileLiftPixels = 2.0;
        private double smileFullLiftPixels = 10.0;
        private double microSmileConfidence = 0.82;
    }

    /**
     * 分类器与几何信号融合参数
     */
    @Data
    public static class Fusion {
        private double stressLipPressWeight = 0.3;
        private double stressJawTensionWeight = 0.3;
        private double stressBlinkRateWeight = 0.4;
        /** 眨眼频率归一化上限（次/分钟） */
        private double blinkRateNormalizer = 50.0;

        private double anxietyEyeWideningWeight = 0.4;
        private double anxietyEyebrowRaiseWeight = 0.3;
        private double anxietyLipPressWeight = 0.3;

        private double engagementBaseline = 0.7;
        private double engagementSmileBoost = 0.15;
        private double engagementEyebrowBoost = 0.15;
        private double highEngagement = 0.8;

        private double highStress = 0.7;
        private double highAnxiety = 0.7;

        private double classifierWeight = 0.6;
        /** 分类器未检出人脸时使用的置信度 */
        private double defaultClassifierConfidence = 0.5;
        /** 没有任何微表情触发时的几何置信度 */
        private double fallbackMicroConfidence = 0.5;

        private double stressModerateBand = 0.3;
        private double stressElevatedBand = 0.7;
    }
}
