package com.companionagent.orchestrator.repository;

import com.companionagent.orchestrator.model.AgentTurnRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDate;
import java.time.LocalDateTime;

@Repository
public interface AgentTurnRepository extends ReactiveCrudRepository<AgentTurnRecord, Long> {

    /** Repair and critique figures of one identity version on one UTC day. */
    record DriftRow(LocalDate metricDay, String identityId, Integer identityVersion, Long totalTurns,
                    Long repairTurns, Double avgAttempts, Long failedCritiques, Double avgExecutionTimeMs) {}

    @Query("""
        SELECT * FROM agent_turns
        WHERE session_id = :sessionId
        ORDER BY created_at DESC
        LIMIT :limit
        """)
    Flux<AgentTurnRecord> findRecent(String sessionId, int limit);

    @Query("""
        SELECT CAST(created_at AS DATE)                                    AS metric_day,
               identity_id,
               identity_version,
               COUNT(*)                                                    AS total_turns,
               SUM(CASE WHEN attempts > 1 THEN 1 ELSE 0 END)               AS repair_turns,
               AVG(CAST(attempts AS DOUBLE PRECISION))                     AS avg_attempts,
               SUM(CASE WHEN critique_passed = FALSE THEN 1 ELSE 0 END)    AS failed_critiques,
               AVG(CAST(execution_time_ms AS DOUBLE PRECISION))            AS avg_execution_time_ms
        FROM agent_turns
        WHERE created_at >= :from
          AND created_at < :to
        GROUP BY CAST(created_at AS DATE), identity_id, identity_version
        ORDER BY metric_day DESC, identity_id, identity_version
        """)
    Flux<DriftRow> findDrift(LocalDateTime from, LocalDateTime to);

    @Query("""
        SELECT CAST(created_at AS DATE)                                    AS metric_day,
               identity_id,
               identity_version,
               COUNT(*)                                                    AS total_turns,
               SUM(CASE WHEN attempts > 1 THEN 1 ELSE 0 END)               AS repair_turns,
               AVG(CAST(attempts AS DOUBLE PRECISION))                     AS avg_attempts,
               SUM(CASE WHEN critique_passed = FALSE THEN 1 ELSE 0 END)    AS failed_critiques,
               AVG(CAST(execution_time_ms AS DOUBLE PRECISION))            AS avg_execution_time_ms
        FROM agent_turns
        WHERE created_at >= :from
          AND created_at < :to
          AND identity_id = :identityId
        GROUP BY CAST(created_at AS DATE), identity_id, identity_version
        ORDER BY metric_day DESC, identity_version
        """)
    Flux<DriftRow> findDriftForIdentity(LocalDateTime from, LocalDateTime to, String identityId);
}
