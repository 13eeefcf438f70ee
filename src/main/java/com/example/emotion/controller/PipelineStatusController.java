package com.example.emotion.controller;

import com.example.emotion.classifier.EmotionClassifier;
import com.example.emotion.config.EmotionAnalysisProperties;
import com.example.emotion.landmark.LandmarkExtractor;
import com.example.emotion.service.EmotionPipelineService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/emotion")
@RequiredArgsConstructor
public class PipelineStatusController {

    private final LandmarkExtractor landmarkExtractor;
    private final EmotionClassifier emotionClassifier;
    private final EmotionPipelineService pipelineService;
    private final EmotionAnalysisProperties properties;

    /**
     * 管线状态：模型可用性、活跃会话数和主要参数
     */
    @GetMapping("/status")
    public Mono<ResponseEntity<Map<String, Object>>> getPipelineStatus() {
        return Mono.fromCallable(() -> {
            Map<String, Object> status = new HashMap<>();
            status.put("status", landmarkExtractor.isAvailable() ? "RUNNING" : "DEGRADED");
            status.put("timestamp", LocalDateTime.now().toString());

            Map<String, Object> models = new HashMap<>();
            models.put("landmarks", backend(landmarkExtractor.getName(), landmarkExtractor.isAvailable()));
            models.put("classifier", backend(emotionClassifier.getName(), emotionClassifier.isAvailable()));
            status.put("models", models);

            status.put("active_sessions", pipelineService.activeSessionCount());

            Map<String, Object> config = new HashMap<>();
            config.put("fps", properties.getFps());
            config.put("blink_window", properties.getBlinkWindow());
            config.put("signal_history", properties.getSignalHistory());
            config.put("recent_analyses", properties.getRecentAnalyses());
            status.put("config", config);

            return ResponseEntity.ok(status);
        });
    }

    private static Map<String, Object> backend(String name, boolean available) {
        Map<String, Object> backend = new HashMap<>();
        backend.put("name", name);
        backend.put("available", available);
        return backend;
    }
}
