package com.example.emotion.session;

import com.example.emotion.classifier.Emotion;
import com.example.emotion.dto.CompositeScores;
import com.example.emotion.dto.FrameAnalysis;
import com.example.emotion.dto.SessionSummary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 从会话帧序列计算汇总
 */
public final class SessionSummarizer {

    private SessionSummarizer() {
    }

    /**
     * @return 还没有检测到人脸的帧时返回 {@code Optional.empty()}
     */
    public static Optional<SessionSummary> summarize(SessionState state) {
        List<FrameAnalysis> frames;
        int framesReceived;
        synchronized (state) {
            frames = state.frames();
            framesReceived = state.getFramesReceived();
        }
        if (frames.isEmpty()) {
            return Optional.empty();
        }

        // 保持首次出现顺序，众数并列时取先出现者
        Map<Emotion, Integer> counts = new LinkedHashMap<>();
        double totalStress = 0;
        double totalAnxiety = 0;
        double totalEngagement = 0;
        double duration = 0;

        for (FrameAnalysis frame : frames) {
            counts.merge(frame.getEmotionAnalysis().getDominantEmotion(), 1, Integer::sum);
            CompositeScores scores = frame.getCompositeScores();
            totalStress += scores.getStressScore();
            totalAnxiety += scores.getAnxietyScore();
            totalEngagement += scores.getEngagementScore();
            duration = Math.max(duration, frame.getTimestamp());
        }

        int total = frames.size();
        Map<String, Double> distribution = new LinkedHashMap<>();
        Emotion predominant = null;
        int best = 0;
        for (Map.Entry<Emotion, Integer> entry : counts.entrySet()) {
            distribution.put(entry.getKey().getLabel(), entry.getValue() / (double) total);
            if (entry.getValue() > best) {
                best = entry.getValue();
                predominant = entry.getKey();
            }
        }

        return Optional.of(SessionSummary.builder()
                .sessionId(state.getSessionId())
                .startedAt(state.getStartedAt())
                .durationSeconds(duration)
                .totalFramesAnalyzed(total)
                .frameCount(framesReceived)
                .emotionDistribution(Collections.unmodifiableMap(distribution))
                .avgStressScore(totalStress / total)
                .avgAnxietyScore(totalAnxiety / total)
                .avgEngagementScore(totalEngagement / total)
                .predominantEmotion(predominant)
                .build());
    }
}
