package com.companionagent.orchestrator.repository;

import com.companionagent.orchestrator.model.LlmCallRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.time.LocalDateTime;

@Repository
public interface LlmCallRepository extends ReactiveCrudRepository<LlmCallRecord, Long> {

    /** Per-node aggregate of one user's calls. */
    record NodeUsageRow(String nodeName, Long callCount, Long totalInput, Long totalOutput,
                        Double totalCost, Double avgDurationMs) {}

    @Query("""
        SELECT * FROM llm_calls
        WHERE turn_id = :turnId
        ORDER BY call_sequence ASC
        """)
    Flux<LlmCallRecord> findByTurnId(String turnId);

    /** Calls of the session's most recent turns, newest turn first. */
    @Query("""
        SELECT * FROM llm_calls
        WHERE session_id = :sessionId
          AND turn_id IN (
            SELECT turn_id FROM agent_turns
            WHERE session_id = :sessionId
            ORDER BY created_at DESC
            LIMIT :limit)
        ORDER BY created_at DESC, call_sequence ASC
        """)
    Flux<LlmCallRecord> findForRecentTurns(String sessionId, int limit);

    @Query("""
        SELECT node_name,
               COUNT(*)                                 AS call_count,
               SUM(input_tokens)                        AS total_input,
               SUM(output_tokens)                       AS total_output,
               SUM(estimated_cost)                      AS total_cost,
               AVG(CAST(duration_ms AS DOUBLE PRECISION)) AS avg_duration_ms
        FROM llm_calls
        WHERE user_id = :userId
          AND created_at >= :since
        GROUP BY node_name
        ORDER BY node_name
        """)
    Flux<NodeUsageRow> sumByNodeSince(String userId, LocalDateTime since);
}
