package com.companionagent.orchestrator.repository;

import com.companionagent.orchestrator.model.UserHintRecord;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface UserHintRepository extends ReactiveCrudRepository<UserHintRecord, Long> {

    Mono<UserHintRecord> findByUserIdAndHintType(String userId, String hintType);

    /** Hints strong enough to inject, strongest and most frequent first. */
    @Query("""
        SELECT * FROM user_critique_hints
        WHERE user_id = :userId
          AND weight >= :minWeight
        ORDER BY weight DESC, occurrence_count DESC
        LIMIT :limit
        """)
    Flux<UserHintRecord> findInjectable(String userId, double minWeight, int limit);

    @Query("""
        SELECT * FROM user_critique_hints
        WHERE user_id = :userId
        ORDER BY occurrence_count DESC
        LIMIT :limit
        """)
    Flux<UserHintRecord> findMostFrequent(String userId, int limit);

    /** Candidates for decay: not reinforced since {@code cutoff}. */
    @Query("SELECT * FROM user_critique_hints WHERE last_seen < :cutoff")
    Flux<UserHintRecord> findSeenBefore(LocalDateTime cutoff);

    @Modifying
    @Query("DELETE FROM user_critique_hints WHERE weight < :threshold")
    Mono<Integer> deleteWeakerThan(double threshold);
}
