package com.example.emotion.repository;

import com.example.emotion.entity.EmotionSummaryRecord;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface EmotionSummaryRecordRepository extends ReactiveCrudRepository<EmotionSummaryRecord, Long> {

    // 同一会话ID可能多次开始/停止
    Flux<EmotionSummaryRecord> findBySessionIdOrderByCreatedAtDesc(String sessionId);
}
