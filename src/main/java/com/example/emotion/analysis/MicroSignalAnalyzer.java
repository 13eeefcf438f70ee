package com.example.emotion.analysis;

import com.example.emotion.config.EmotionAnalysisProperties;
import com.example.emotion.landmark.FacePoint;
import com.example.emotion.landmark.LandmarkPoint;
import com.example.emotion.landmark.LandmarkSet;
import com.example.emotion.landmark.MissingLandmarkException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * 基于关键点几何的微表情分析
 * <p>
 * 每个指标都是相对于面部参考距离（脸高、嘴宽、眼宽、下颌宽）归一化的比值，
 * 与拍摄距离和脸部大小无关。关键点缺失或几何退化时返回 {@link SignalResult#unavailable}，不抛异常。
 * 眨眼频率依赖会话的 {@link TemporalSignalBuffers}，调用方需保证同一会话串行调用。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MicroSignalAnalyzer {

    private static final double SECONDS_PER_MINUTE = 60.0;

    private final EmotionAnalysisProperties properties;

    /**
     * 分析一帧关键点，并更新会话的时间缓冲
     *
     * @return 六个指标全部有结果（可用或不可用）
     */
    public Map<SignalType, SignalResult> analyze(LandmarkSet landmarks, TemporalSignalBuffers buffers, double timestamp) {
        Map<SignalType, SignalResult> signals = new EnumMap<>(SignalType.class);

        signals.put(SignalType.EYEBROW_RAISE, detectEyebrowRaise(landmarks));
        signals.put(SignalType.LIP_PRESS, detectLipPress(landmarks));

        Double ear = null;
        String earFailure = null;
        try {
            ear = eyeAspectRatio(landmarks);
        } catch (MissingLandmarkException | DegenerateGeometryException e) {
            earFailure = e.getMessage();
        }
        signals.put(SignalType.BLINK_RATE,
                ear != null ? calculateBlinkRate(ear, buffers) : SignalResult.unavailable(earFailure));
        signals.put(SignalType.EYE_WIDENING,
                ear != null ? detectEyeWidening(ear) : SignalResult.unavailable(earFailure));

        signals.put(SignalType.JAW_TENSION, detectJawTension(landmarks));
        signals.put(SignalType.MICRO_SMILE, detectMicroSmile(landmarks));

        buffers.recordSnapshot(snapshot(timestamp, ear, signals));

        if (log.isDebugEnabled()) {
            signals.forEach((type, result) -> {
                if (!result.isAvailable()) {
                    log.debug("{}s 指标 {} 不可用: {}", timestamp, type.getKey(), result.getReason());
                }
            });
        }
        return signals;
    }

    /**
     * 眉眼距离 / 脸高（按关键点方案校准），超过阈值后强度线性增长
     */
    SignalResult detectEyebrowRaise(LandmarkSet landmarks) {
        EmotionAnalysisProperties.Thresholds t = properties.getThresholds();
        try {
            double faceHeight = requirePositive(
                    distance(landmarks, FacePoint.FOREHEAD_TOP, FacePoint.CHIN), "脸高");
            double left = distance(landmarks, FacePoint.LEFT_BROW_TOP, FacePoint.LEFT_EYE_TOP);
            double right = distance(landmarks, FacePoint.RIGHT_BROW_TOP, FacePoint.RIGHT_EYE_TOP);
            double normalized = (left + right) / 2 / faceHeight * landmarks.getScheme().getBrowRatioScale();

            boolean detected = normalized > t.getEyebrowRaise();
            double intensity = detected ? (normalized - t.getEyebrowRaise()) / t.getEyebrowRaiseRange() : 0.0;
            return SignalResult.ok(MicroSignal.of(detected, intensity, t.getEyebrowRaiseConfidence()));
        } catch (MissingLandmarkException | DegenerateGeometryException e) {
            return SignalResult.unavailable(e.getMessage());
        }
    }

    /**
     * 唇间距 / 嘴宽，低于阈值视为抿唇，间距越小强度越高
     */
    SignalResult detectLipPress(LandmarkSet landmarks) {
        EmotionAnalysisProperties.Thresholds t = properties.getThresholds();
        try {
            double mouthWidth = requirePositive(
                    distance(landmarks, FacePoint.MOUTH_LEFT_CORNER, FacePoint.MOUTH_RIGHT_CORNER), "嘴宽");
            double gap = distance(landmarks, FacePoint.UPPER_LIP_INNER, FacePoint.LOWER_LIP_INNER);
            double normalized = gap / mouthWidth;

            boolean detected = normalized < t.getLipPress();
            double intensity = (t.getLipPress() - normalized) / t.getLipPress();
            return SignalResult.ok(MicroSignal.of(detected, intensity, t.getLipPressConfidence()));
        } catch (MissingLandmarkException | DegenerateGeometryException e) {
            return SignalResult.unavailable(e.getMessage());
        }
    }

    /**
     * EAR低于阈值计为一次眨眼事件，写入环形窗口后按帧率外推为每分钟次数
     */
    SignalResult calculateBlinkRate(double ear, TemporalSignalBuffers buffers) {
        EmotionAnalysisProperties.Thresholds t = properties.getThresholds();
        buffers.recordBlink(ear < t.getBlinkEar());

        double rate = extrapolateBlinkRate(buffers.blinkCount(), buffers.blinkSamples(), properties.getFps());
        return SignalResult.ok(MicroSignal.builder()
                .detected(rate > t.getElevatedBlinkRate())
                .intensity(rate / t.getBlinkRateSaturation())
                .confidence(t.getBlinkRateConfidence())
                .ratePerMinute(rate)
                .build());
    }

    /**
     * EAR高于阈值视为睁大眼睛，强度取相对基线EAR的偏离
     */
    SignalResult detectEyeWidening(double ear) {
        EmotionAnalysisProperties.Thresholds t = properties.getThresholds();
        double intensity = ear > t.getBaselineEar() ? (ear - t.getBaselineEar()) / t.getEyeWideningRange() : 0.0;
        return SignalResult.ok(MicroSignal.of(ear > t.getWideEyeEar(), intensity, t.getEyeWideningConfidence()));
    }

    /**
     * 下颌高 / 下颌宽（按关键点方案校准），比值越低咬合越紧
     */
    SignalResult detectJawTension(LandmarkSet landmarks) {
        EmotionAnalysisProperties.Thresholds t = properties.getThresholds();
        try {
            LandmarkPoint leftJaw = landmarks.point(FacePoint.LEFT_JAW);
            LandmarkPoint rightJaw = landmarks.point(FacePoint.RIGHT_JAW);
            double jawWidth = requirePositive(leftJaw.distanceTo(rightJaw), "下颌宽");
            double jawHeight = landmarks.point(FacePoint.CHIN).distanceTo(leftJaw.midpoint(rightJaw));
            double ratio = jawHeight / jawWidth * landmarks.getScheme().getJawRatioScale();

            boolean detected = ratio < t.getJawTensionRatio();
            double intensity = (t.getJawTensionRatio() - ratio) / t.getJawTensionRange();
            return SignalResult.ok(MicroSignal.of(detected, intensity, t.getJawTensionConfidence()));
        } catch (MissingLandmarkException | DegenerateGeometryException e) {
            return SignalResult.unavailable(e.getMessage());
        }
    }

    /**
     * 嘴角相对上唇中点的上扬像素数。
     * 真假笑区分需要多帧眼角对比，当前未实现，检测到的一律报告为 SOCIAL。
     */
    SignalResult detectMicroSmile(LandmarkSet landmarks) {
        EmotionAnalysisProperties.Thresholds t = properties.getThresholds();
        try {
            double cornersY = (landmarks.point(FacePoint.MOUTH_LEFT_CORNER).getY()
                    + landmarks.point(FacePoint.MOUTH_RIGHT_CORNER).getY()) / 2;
            double lift = landmarks.point(FacePoint.UPPER_LIP_CENTER).getY() - cornersY;

            boolean detected = lift > t.getSmileLiftPixels();
            return SignalResult.ok(MicroSignal.builder()
                    .detected(detected)
                    .intensity(lift > 0 ? lift / t.getSmileFullLiftPixels() : 0.0)
                    .confidence(t.getMicroSmileConfidence())
                    .smileType(detected ? SmileType.SOCIAL : SmileType.NONE)
                    .build());
        } catch (MissingLandmarkException e) {
            return SignalResult.unavailable(e.getMessage());
        }
    }

    /**
     * 左眼六点EAR：(|p2-p6| + |p3-p5|) / (2|p1-p4|)
     */
    double eyeAspectRatio(LandmarkSet landmarks) {
        double v1 = distance(landmarks, FacePoint.LEFT_EYE_UPPER_OUTER, FacePoint.LEFT_EYE_LOWER_OUTER);
        double v2 = distance(landmarks, FacePoint.LEFT_EYE_UPPER_INNER, FacePoint.LEFT_EYE_LOWER_INNER);
        double h = requirePositive(distance(landmarks, FacePoint.LEFT_EYE_OUTER, FacePoint.LEFT_EYE_INNER), "眼宽");
        return (v1 + v2) / (2.0 * h);
    }

    /**
     * 窗口内眨眼占比 × 帧率 × 60
     */
    public static double extrapolateBlinkRate(int blinks, int samples, double fps) {
        if (samples <= 0) {
            return 0.0;
        }
        return (double) blinks / samples * fps * SECONDS_PER_MINUTE;
    }

    private static double distance(LandmarkSet landmarks, FacePoint from, FacePoint to) {
        return landmarks.point(from).distanceTo(landmarks.point(to));
    }

    private static double requirePositive(double value, String what) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new DegenerateGeometryException(what + "为零或无效: " + value);
        }
        return value;
    }

    private static SignalSnapshot snapshot(double timestamp, Double ear, Map<SignalType, SignalResult> signals) {
        Map<SignalType, Double> intensities = new EnumMap<>(SignalType.class);
        signals.forEach((type, result) -> {
            if (result.isAvailable()) {
                intensities.put(type, result.getSignal().getIntensity());
            }
        });
        return new SignalSnapshot(timestamp, ear, Collections.unmodifiableMap(intensities));
    }
}
