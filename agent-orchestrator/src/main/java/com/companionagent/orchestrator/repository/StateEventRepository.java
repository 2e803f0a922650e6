package com.companionagent.orchestrator.repository;

import com.companionagent.orchestrator.model.StateEventRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface StateEventRepository extends ReactiveCrudRepository<StateEventRecord, Long> {

    /** Full log of a session in replay order. */
    Flux<StateEventRecord> findBySessionIdOrderBySequenceAsc(String sessionId);

    /** Highest sequence written for the session, 0 when the log is empty. */
    @Query("SELECT COALESCE(MAX(sequence), 0) FROM state_events WHERE session_id = :sessionId")
    Mono<Long> findMaxSequence(String sessionId);

    @Modifying
    @Query("DELETE FROM state_events WHERE session_id = :sessionId")
    Mono<Integer> deleteBySessionId(String sessionId);
}
