package com.companionagent.orchestrator.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One completed model call of a turn.
 *
 * nodeName: lower-case pipeline node ({@code plan}, {@code draft}, {@code critique}, {@code repair})
 * estimatedCost: USD from the model's list price, 0 for unlisted models
 */
@Data
@NoArgsConstructor
@Table("llm_calls")
public class LlmCallRecord {

    @Id
    private Long id;

    private String turnId;

    private String sessionId;

    private String userId;

    private String nodeName;

    private Integer callSequence;

    private String provider;

    private String model;

    private Integer inputTokens;

    private Integer outputTokens;

    private Integer cacheTokens;

    private Double estimatedCost;

    private Long durationMs;

    private LocalDateTime createdAt;
}
