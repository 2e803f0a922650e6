package com.companionagent.orchestrator.repository;

import com.companionagent.orchestrator.model.CritiqueJobLog;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface CritiqueJobLogRepository extends ReactiveCrudRepository<CritiqueJobLog, Long> {

    Mono<CritiqueJobLog> findByTurnId(String turnId);

    Mono<Long> countByStatus(String status);

    /** Jobs interrupted by a restart, oldest first. */
    @Query("""
        SELECT * FROM critique_queue_log
        WHERE status IN ('queued', 'processing')
        ORDER BY created_at ASC, id ASC
        """)
    Flux<CritiqueJobLog> findUnfinished();

    @Modifying
    @Query("""
        DELETE FROM critique_queue_log
        WHERE status = :status
          AND completed_at < :cutoff
        """)
    Mono<Integer> deleteFinishedBefore(String status, LocalDateTime cutoff);
}
