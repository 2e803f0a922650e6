package com.companionagent.orchestrator.repository;

import com.companionagent.orchestrator.model.SessionHintRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface SessionHintRepository extends ReactiveCrudRepository<SessionHintRecord, Long> {

    /** Latest hints of a session, newest first. */
    @Query("""
        SELECT * FROM session_critique_hints
        WHERE session_id = :sessionId
        ORDER BY created_at DESC, id DESC
        LIMIT :limit
        """)
    Flux<SessionHintRecord> findRecent(String sessionId, int limit);

    Mono<SessionHintRecord> findBySessionIdAndHintType(String sessionId, String hintType);

    @Modifying
    @Query("DELETE FROM session_critique_hints WHERE session_id = :sessionId")
    Mono<Integer> deleteBySessionId(String sessionId);
}
