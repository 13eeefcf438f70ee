package com.example.emotion.service.impl;

import com.example.emotion.analysis.FusionEngine;
import com.example.emotion.analysis.MicroSignalAnalyzer;
import com.example.emotion.analysis.SignalResult;
import com.example.emotion.analysis.SignalType;
import com.example.emotion.classifier.ClassifierResult;
import com.example.emotion.classifier.EmotionClassifier;
import com.example.emotion.config.EmotionAnalysisProperties;
import com.example.emotion.dto.CompositeScores;
import com.example.emotion.dto.FrameAnalysis;
import com.example.emotion.dto.FrameImage;
import com.example.emotion.dto.SessionSummary;
import com.example.emotion.landmark.LandmarkExtractor;
import com.example.emotion.landmark.LandmarkSet;
import com.example.emotion.service.EmotionPipelineService;
import com.example.emotion.session.SessionNotTrackingException;
import com.example.emotion.session.SessionRegistry;
import com.example.emotion.session.SessionState;
import com.example.emotion.session.SessionSummarizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class EmotionPipelineServiceImpl implements EmotionPipelineService {

    private final SessionRegistry registry;
    private final LandmarkExtractor landmarkExtractor;
    private final EmotionClassifier emotionClassifier;
    private final MicroSignalAnalyzer microSignalAnalyzer;
    private final FusionEngine fusionEngine;
    private final EmotionAnalysisProperties properties;

    @Override
    public SessionState startSession(String sessionId) {
        return registry.start(sessionId);
    }

    @Override
    public FrameAnalysis processFrame(String sessionId, FrameImage image, Double timestamp) {
        if (image == null) {
            throw new IllegalArgumentException("帧图像不能为空");
        }
        SessionState state = registry.require(sessionId);

        // 每个会话同一时刻只处理一帧，停止操作会等待当前帧结束
        synchronized (state) {
            if (!state.isTracking()) {
                throw new SessionNotTrackingException(sessionId);
            }
            double ts = timestamp != null ? timestamp : state.getFramesReceived() / properties.getFps();
            FrameAnalysis analysis = analyze(state, image, ts);
            state.record(analysis);
            report(sessionId, analysis);
            return analysis;
        }
    }

    @Override
    public Optional<SessionSummary> summarize(String sessionId) {
        return SessionSummarizer.summarize(registry.require(sessionId));
    }

    @Override
    public Optional<SessionSummary> stopSession(String sessionId) {
        SessionState state = registry.require(sessionId);
        state.stop();
        Optional<SessionSummary> summary = SessionSummarizer.summarize(state);
        log.info("会话 {} 停止跟踪，收到 {} 帧，其中 {} 帧检测到人脸",
                sessionId, state.getFramesReceived(), state.getFramesAnalyzed());
        return summary;
    }

    @Override
    public boolean discardSession(String sessionId) {
        return registry.discard(sessionId);
    }

    @Override
    public List<FrameAnalysis> recentAnalyses(String sessionId) {
        return registry.require(sessionId).recentAnalyses();
    }

    @Override
    public FrameAnalysis analyzeSingleFrame(FrameImage image) {
        if (image == null) {
            throw new IllegalArgumentException("帧图像不能为空");
        }
        SessionState scratch = new SessionState("single-" + UUID.randomUUID(), properties);
        synchronized (scratch) {
            return analyze(scratch, image, 0.0);
        }
    }

    @Override
    public int framesReceived(String sessionId) {
        return registry.require(sessionId).getFramesReceived();
    }

    @Override
    public long activeSessionCount() {
        return registry.activeCount();
    }

    private FrameAnalysis analyze(SessionState state, FrameImage image, double timestamp) {
        Optional<LandmarkSet> landmarks = landmarkExtractor.extract(image);
        if (!landmarks.isPresent()) {
            return FrameAnalysis.noFace(timestamp);
        }

        // 分类器自己找不到人脸时按中性处理，几何信号仍然有效
        ClassifierResult classification = emotionClassifier.classify(image).orElse(null);
        Map<SignalType, SignalResult> signals =
                microSignalAnalyzer.analyze(landmarks.get(), state.getBuffers(), timestamp);
        return fusionEngine.fuse(timestamp, classification, signals);
    }

    private void report(String sessionId, FrameAnalysis analysis) {
        if (!analysis.isFaceDetected()) {
            log.debug("会话 {} {}s 未检测到人脸", sessionId, analysis.getTimestamp());
            return;
        }
        CompositeScores scores = analysis.getCompositeScores();
        EmotionAnalysisProperties.Fusion fusion = properties.getFusion();
        if (scores.getStressScore() > fusion.getHighStress()) {
            log.info("⚠ 会话 {} 在 {}s 检测到高压力: {}", sessionId,
                    analysis.getTimestamp(), String.format("%.2f", scores.getStressScore()));
        }
        if (scores.getAnxietyScore() > fusion.getHighAnxiety()) {
            log.info("⚠ 会话 {} 在 {}s 检测到高焦虑: {}", sessionId,
                    analysis.getTimestamp(), String.format("%.2f", scores.getAnxietyScore()));
        }
        if (log.isDebugEnabled()) {
            log.debug("会话 {} {}s 情绪: {} ({}), 压力: {}, 焦虑: {}", sessionId, analysis.getTimestamp(),
                    analysis.getEmotionAnalysis().getDominantEmotion().getLabel(),
                    String.format("%.2f", analysis.getEmotionAnalysis().getConfidence()),
                    String.format("%.2f", scores.getStressScore()),
                    String.format("%.2f", scores.getAnxietyScore()));
        }
    }
}
