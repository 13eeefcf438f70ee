package com.example.emotion.service;

import com.example.emotion.dto.SessionSummary;
import com.example.emotion.entity.EmotionSummaryRecord;
import com.example.emotion.repository.EmotionSummaryRecordRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDateTime;

/**
 * 会话汇总持久化。存储失败只记录日志，不影响停止流程
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmotionRecordService {

    private static final int SCORE_SCALE = 4;

    private final EmotionSummaryRecordRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * 保存会话汇总
     *
     * @return 保存后的记录；失败时为空
     */
    public Mono<EmotionSummaryRecord> saveSummary(SessionSummary summary, LocalDateTime stoppedAt) {
        return Mono.fromCallable(() -> toRecord(summary, stoppedAt))
                .flatMap(repository::save)
                .doOnSuccess(saved -> {
                    if (saved != null) {
                        log.info("会话 {} 的情绪汇总已保存, ID: {}", saved.getSessionId(), saved.getId());
                    }
                })
                .onErrorResume(ex -> {
                    log.warn("保存会话 {} 的情绪汇总失败: {}",
                            summary != null ? summary.getSessionId() : null, ex.getMessage());
                    return Mono.empty();
                });
    }

    public Flux<EmotionSummaryRecord> findBySessionId(String sessionId) {
        return repository.findBySessionIdOrderByCreatedAtDesc(sessionId);
    }

    private EmotionSummaryRecord toRecord(SessionSummary summary, LocalDateTime stoppedAt) {
        if (summary == null) {
            throw new IllegalArgumentException("会话汇总不能为空");
        }
        EmotionSummaryRecord record = new EmotionSummaryRecord();
        record.setSessionId(summary.getSessionId());
        record.setStartedAt(summary.getStartedAt());
        record.setStoppedAt(stoppedAt);
        record.setDurationSeconds(scale(summary.getDurationSeconds()));
        record.setTotalFramesAnalyzed(summary.getTotalFramesAnalyzed());
        record.setFrameCount(summary.getFrameCount());
        record.setAvgStressScore(scale(summary.getAvgStressScore()));
        record.setAvgAnxietyScore(scale(summary.getAvgAnxietyScore()));
        record.setAvgEngagementScore(scale(summary.getAvgEngagementScore()));
        record.setPredominantEmotion(summary.getPredominantEmotion() != null
                ? summary.getPredominantEmotion().getLabel() : null);
        record.setCreatedAt(LocalDateTime.now());

        try {
            record.setEmotionDistribution(objectMapper.writeValueAsString(summary.getEmotionDistribution()));
        } catch (JsonProcessingException e) {
            log.warn("情绪分布序列化失败", e);
            record.setEmotionDistribution("{}");
        }
        return record;
    }

    private static BigDecimal scale(double value) {
        return BigDecimal.valueOf(value).setScale(SCORE_SCALE, RoundingMode.HALF_UP);
    }
}
