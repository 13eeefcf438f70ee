package com.example.emotion.analysis;

import com.example.emotion.classifier.ClassifierResult;
import com.example.emotion.classifier.Emotion;
import com.example.emotion.config.EmotionAnalysisProperties;
import com.example.emotion.dto.ClinicalInsights;
import com.example.emotion.dto.CompositeScores;
import com.example.emotion.dto.EmotionAnalysis;
import com.example.emotion.dto.FrameAnalysis;
import com.example.emotion.dto.StressLevel;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 分类器输出与几何微表情的融合
 * <p>
 * 无状态，同一输入总是得到同一结果。
 */
@Component
@RequiredArgsConstructor
public class FusionEngine {

    static final String LIP_PRESS_INDICATOR = "lip_press";
    static final String ELEVATED_BLINK_RATE_INDICATOR = "elevated_blink_rate";
    static final String JAW_TENSION_INDICATOR = "jaw_tension";
    static final String MICRO_SMILE_INDICATOR = "micro_smile";
    static final String EYEBROW_RAISE_INDICATOR = "eyebrow_raise_interest";
    static final String HIGH_ENGAGEMENT_INDICATOR = "high_engagement";

    private final EmotionAnalysisProperties properties;

    /**
     * 融合一帧结果
     *
     * @param timestamp  会话相对时间
     * @param classifier 分类器结果，分类器未检出人脸时为null
     * @param signals    微表情分析结果，不可用的指标按零值处理
     */
    public FrameAnalysis fuse(double timestamp, ClassifierResult classifier, Map<SignalType, SignalResult> signals) {
        EmotionAnalysisProperties.Fusion f = properties.getFusion();
        Map<SignalType, MicroSignal> micro = resolve(signals);

        Emotion baseEmotion = classifier != null ? classifier.getDominantEmotion() : Emotion.NEUTRAL;
        double baseConfidence = classifier != null ? classifier.getConfidence() : f.getDefaultClassifierConfidence();

        double stress = stressScore(micro);
        double anxiety = anxietyScore(micro);
        double engagement = engagementScore(micro);
        Emotion adjusted = adjustEmotion(baseEmotion, stress, anxiety);
        double confidence = combinedConfidence(baseConfidence, micro);

        return FrameAnalysis.builder()
                .timestamp(timestamp)
                .faceDetected(true)
                .emotionAnalysis(EmotionAnalysis.builder()
                        .dominantEmotion(adjusted)
                        .confidence(confidence)
                        .emotionProbabilities(probabilities(classifier))
                        .build())
                .microExpressions(detectedOnly(micro))
                .compositeScores(CompositeScores.builder()
                        .stressScore(stress)
                        .anxietyScore(anxiety)
                        .engagementScore(engagement)
                        .overallConfidence(confidence)
                        .build())
                .clinicalInsights(insights(adjusted, stress, engagement, micro))
                .build();
    }

    /**
     * 抿唇、下颌紧张和归一化眨眼频率的加权和
     */
    double stressScore(Map<SignalType, MicroSignal> micro) {
        EmotionAnalysisProperties.Fusion f = properties.getFusion();
        MicroSignal blink = micro.get(SignalType.BLINK_RATE);
        double blinkRate = blink.getRatePerMinute() != null ? blink.getRatePerMinute() : 0.0;
        double normalizedBlinkRate = ScoreMath.clamp01(blinkRate / f.getBlinkRateNormalizer());

        return ScoreMath.clamp01(
                micro.get(SignalType.LIP_PRESS).getIntensity() * f.getStressLipPressWeight()
                        + micro.get(SignalType.JAW_TENSION).getIntensity() * f.getStressJawTensionWeight()
                        + normalizedBlinkRate * f.getStressBlinkRateWeight());
    }

    /**
     * 睁眼、扬眉和抿唇的加权和
     */
    double anxietyScore(Map<SignalType, MicroSignal> micro) {
        EmotionAnalysisProperties.Fusion f = properties.getFusion();
        return ScoreMath.clamp01(
                micro.get(SignalType.EYE_WIDENING).getIntensity() * f.getAnxietyEyeWideningWeight()
                        + micro.get(SignalType.EYEBROW_RAISE).getIntensity() * f.getAnxietyEyebrowRaiseWeight()
                        + micro.get(SignalType.LIP_PRESS).getIntensity() * f.getAnxietyLipPressWeight());
    }

    double engagementScore(Map<SignalType, MicroSignal> micro) {
        EmotionAnalysisProperties.Fusion f = properties.getFusion();
        double engagement = f.getEngagementBaseline();
        if (micro.get(SignalType.MICRO_SMILE).isDetected()) {
            engagement += f.getEngagementSmileBoost();
        }
        if (micro.get(SignalType.EYEBROW_RAISE).isDetected()) {
            engagement += f.getEngagementEyebrowBoost();
        }
        return ScoreMath.clamp01(engagement);
    }

    /**
     * 几何信号只能把平淡的分类结果升级：
     * 高压力 + neutral → stressed；高焦虑 + sad/neutral → anxious。其余情况信任分类器。
     */
    Emotion adjustEmotion(Emotion base, double stress, double anxiety) {
        EmotionAnalysisProperties.Fusion f = properties.getFusion();
        Emotion adjusted = base;
        if (stress > f.getHighStress() && adjusted == Emotion.NEUTRAL) {
            adjusted = Emotion.STRESSED;
        }
        if (anxiety > f.getHighAnxiety() && (adjusted == Emotion.SAD || adjusted == Emotion.NEUTRAL)) {
            adjusted = Emotion.ANXIOUS;
        }
        return adjusted;
    }

    double combinedConfidence(double classifierConfidence, Map<SignalType, MicroSignal> micro) {
        EmotionAnalysisProperties.Fusion f = properties.getFusion();
        double sum = 0;
        int fired = 0;
        for (MicroSignal signal : micro.values()) {
            if (signal.isDetected()) {
                sum += signal.getConfidence();
                fired++;
            }
        }
        double microConfidence = fired > 0 ? sum / fired : f.getFallbackMicroConfidence();
        return ScoreMath.clamp01(f.getClassifierWeight() * classifierConfidence
                + (1 - f.getClassifierWeight()) * microConfidence);
    }

    private ClinicalInsights insights(Emotion state, double stress, double engagement,
                                      Map<SignalType, MicroSignal> micro) {
        EmotionAnalysisProperties.Fusion f = properties.getFusion();

        List<String> anxietyIndicators = new ArrayList<>();
        if (micro.get(SignalType.LIP_PRESS).isDetected()) {
            anxietyIndicators.add(LIP_PRESS_INDICATOR);
        }
        if (micro.get(SignalType.BLINK_RATE).isDetected()) {
            anxietyIndicators.add(ELEVATED_BLINK_RATE_INDICATOR);
        }
        if (micro.get(SignalType.JAW_TENSION).isDetected()) {
            anxietyIndicators.add(JAW_TENSION_INDICATOR);
        }

        List<String> positiveIndicators = new ArrayList<>();
        if (micro.get(SignalType.MICRO_SMILE).isDetected()) {
            positiveIndicators.add(MICRO_SMILE_INDICATOR);
        }
        if (micro.get(SignalType.EYEBROW_RAISE).isDetected()) {
            positiveIndicators.add(EYEBROW_RAISE_INDICATOR);
        }
        if (engagement > f.getHighEngagement()) {
            positiveIndicators.add(HIGH_ENGAGEMENT_INDICATOR);
        }

        return ClinicalInsights.builder()
                .primaryState(state)
                .stressLevel(StressLevel.of(stress, f.getStressModerateBand(), f.getStressElevatedBand()))
                .anxietyIndicators(Collections.unmodifiableList(anxietyIndicators))
                .positiveIndicators(Collections.unmodifiableList(positiveIndicators))
                .build();
    }

    private static Map<SignalType, MicroSignal> resolve(Map<SignalType, SignalResult> signals) {
        Map<SignalType, MicroSignal> micro = new EnumMap<>(SignalType.class);
        for (SignalType type : SignalType.values()) {
            SignalResult result = signals != null ? signals.get(type) : null;
            micro.put(type, result != null ? result.orNone() : MicroSignal.none());
        }
        return micro;
    }

    private static Map<String, MicroSignal> detectedOnly(Map<SignalType, MicroSignal> micro) {
        Map<String, MicroSignal> detected = new LinkedHashMap<>();
        micro.forEach((type, signal) -> {
            if (signal.isDetected()) {
                detected.put(type.getKey(), signal);
            }
        });
        return Collections.unmodifiableMap(detected);
    }

    private static Map<String, Double> probabilities(ClassifierResult classifier) {
        if (classifier == null) {
            return Collections.emptyMap();
        }
        Map<String, Double> probabilities = new LinkedHashMap<>();
        classifier.getProbabilities().forEach((emotion, p) -> probabilities.put(emotion.getLabel(), p));
        return Collections.unmodifiableMap(probabilities);
    }
}
