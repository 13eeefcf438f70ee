package com.example.emotion.controller;

import com.example.emotion.config.EmotionAnalysisProperties;
import com.example.emotion.dto.FrameRequest;
import com.example.emotion.dto.SessionSummary;
import com.example.emotion.dto.VideoAnalysisRequest;
import com.example.emotion.service.EmotionPipelineService;
import com.example.emotion.service.EmotionRecordService;
import com.example.emotion.service.VideoEmotionAnalysisService;
import com.example.emotion.session.SessionAlreadyActiveException;
import com.example.emotion.session.SessionNotFoundException;
import com.example.emotion.session.SessionNotTrackingException;
import com.example.emotion.util.FrameImageDecoder;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.function.Tuples;

import javax.validation.Valid;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api/emotion")
@RequiredArgsConstructor
public class EmotionTrackingController {

    private final EmotionPipelineService pipelineService;
    private final VideoEmotionAnalysisService videoAnalysisService;
    private final EmotionRecordService recordService;
    private final EmotionAnalysisProperties properties;

    /**
     * 开始会话情绪跟踪
     */
    @PostMapping("/session/{sessionId}/start")
    public Mono<ResponseEntity<Map<String, Object>>> startTracking(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> {
                    pipelineService.startSession(sessionId);
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("message", "Emotion tracking started");
                    response.put("session_id", sessionId);
                    response.put("fps", properties.getFps());
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(this::errorResponse);
    }

    /**
     * 处理一帧摄像头画面
     */
    @PostMapping("/session/{sessionId}/frame")
    public Mono<ResponseEntity<Map<String, Object>>> processFrame(@PathVariable String sessionId,
                                                                  @Valid @RequestBody FrameRequest request) {
        return Mono.fromCallable(() -> pipelineService.processFrame(
                        sessionId, FrameImageDecoder.decode(request.getFrame()), request.getTimestamp()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("result", result);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(this::errorResponse);
    }

    /**
     * 当前会话汇总
     */
    @GetMapping("/session/{sessionId}/summary")
    public Mono<ResponseEntity<Map<String, Object>>> getSummary(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> {
                    Optional<SessionSummary> summary = pipelineService.summarize(sessionId);
                    Map<String, Object> response = new HashMap<>();
                    if (!summary.isPresent()) {
                        response.put("success", false);
                        response.put("error", "No emotion data available for this session");
                        return ResponseEntity.badRequest().body(response);
                    }
                    response.put("success", true);
                    response.put("summary", summary.get());
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(this::errorResponse);
    }

    /**
     * 停止跟踪：返回最终汇总，保存后释放会话状态
     */
    @PostMapping("/session/{sessionId}/stop")
    public Mono<ResponseEntity<Map<String, Object>>> stopTracking(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> {
                    int totalFrames = pipelineService.framesReceived(sessionId);
                    return Tuples.of(pipelineService.stopSession(sessionId), totalFrames);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(stopped -> {
                    Optional<SessionSummary> summary = stopped.getT1();
                    Mono<?> persisted = summary.isPresent()
                            ? recordService.saveSummary(summary.get(), LocalDateTime.now())
                            : Mono.empty();
                    return persisted.then(Mono.just(stopped));
                })
                .map(stopped -> {
                    pipelineService.discardSession(sessionId);
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("message", "Emotion tracking stopped");
                    response.put("summary", stopped.getT1().orElse(null));
                    response.put("total_frames", stopped.getT2());
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(this::errorResponse);
    }

    /**
     * 最近的分析结果
     */
    @GetMapping("/session/{sessionId}/recent")
    public Mono<ResponseEntity<Map<String, Object>>> getRecentAnalyses(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("session_id", sessionId);
                    response.put("recent", pipelineService.recentAnalyses(sessionId));
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(this::errorResponse);
    }

    /**
     * 已保存的历史汇总
     */
    @GetMapping("/session/{sessionId}/history")
    public Mono<ResponseEntity<Map<String, Object>>> getHistory(@PathVariable String sessionId) {
        return recordService.findBySessionId(sessionId)
                .collectList()
                .map(records -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("session_id", sessionId);
                    response.put("records", records);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(this::errorResponse);
    }

    /**
     * 单帧分析，不创建会话
     */
    @PostMapping("/analyze")
    public Mono<ResponseEntity<Map<String, Object>>> analyzeFrame(@Valid @RequestBody FrameRequest request) {
        return Mono.fromCallable(() -> pipelineService.analyzeSingleFrame(FrameImageDecoder.decode(request.getFrame())))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", true);
                    response.put("result", result);
                    return ResponseEntity.ok(response);
                })
                .onErrorResume(this::errorResponse);
    }

    /**
     * 视频文件情绪分析
     */
    @PostMapping("/video/analyze")
    public Mono<ResponseEntity<Map<String, Object>>> analyzeVideo(@Valid @RequestBody VideoAnalysisRequest request) {
        return videoAnalysisService.analyzeVideo(request)
                .map(result -> {
                    Map<String, Object> response = new HashMap<>();
                    response.put("success", result.isSuccess());
                    response.put("result", result);
                    return result.isSuccess()
                            ? ResponseEntity.ok(response)
                            : ResponseEntity.badRequest().body(response);
                })
                .onErrorResume(this::errorResponse);
    }

    private Mono<ResponseEntity<Map<String, Object>>> errorResponse(Throwable ex) {
        HttpStatus status;
        if (ex instanceof SessionNotFoundException) {
            status = HttpStatus.NOT_FOUND;
        } else if (ex instanceof SessionAlreadyActiveException || ex instanceof SessionNotTrackingException) {
            status = HttpStatus.CONFLICT;
        } else if (ex instanceof IllegalArgumentException) {
            status = HttpStatus.BAD_REQUEST;
        } else {
            status = HttpStatus.INTERNAL_SERVER_ERROR;
        }

        if (status == HttpStatus.INTERNAL_SERVER_ERROR) {
            log.error("情绪分析请求失败: {}", ex.getMessage(), ex);
        } else {
            log.warn("情绪分析请求被拒绝: {}", ex.getMessage());
        }
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("success", false);
        errorResponse.put("error", ex.getMessage());
        return Mono.just(ResponseEntity.status(status).body(errorResponse));
    }
}
