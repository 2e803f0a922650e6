package com.companionagent.orchestrator.repository;

import com.companionagent.orchestrator.model.PendingCorrectionRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;

@Repository
public interface PendingCorrectionRepository extends ReactiveCrudRepository<PendingCorrectionRecord, Long> {

    /** Unprocessed corrections of a session, oldest first. */
    @Query("""
        SELECT * FROM pending_corrections
        WHERE session_id = :sessionId
          AND processed = FALSE
        ORDER BY created_at ASC, id ASC
        """)
    Flux<PendingCorrectionRecord> findPending(String sessionId);

    Flux<PendingCorrectionRecord> findByUserId(String userId);

    @Modifying
    @Query("UPDATE pending_corrections SET processed = TRUE WHERE id IN (:ids)")
    Mono<Integer> markProcessed(Collection<Long> ids);

    @Modifying
    @Query("UPDATE pending_corrections SET processed = TRUE WHERE session_id = :sessionId AND processed = FALSE")
    Mono<Integer> markAllProcessed(String sessionId);

    @Modifying
    @Query("DELETE FROM pending_corrections WHERE processed = TRUE AND created_at < :cutoff")
    Mono<Integer> deleteProcessedBefore(LocalDateTime cutoff);

    @Modifying
    @Query("DELETE FROM pending_corrections WHERE session_id = :sessionId")
    Mono<Integer> deleteBySessionId(String sessionId);
}
