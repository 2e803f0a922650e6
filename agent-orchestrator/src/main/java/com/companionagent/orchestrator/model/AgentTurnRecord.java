package com.companionagent.orchestrator.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Observability log of one executed turn.
 *
 * critiqueIssues: JSON-serialised {@code List<String>}
 */
@Data
@NoArgsConstructor
@Table("agent_turns")
public class AgentTurnRecord {

    @Id
    private Long id;

    private String turnId;

    private String sessionId;

    private String userId;

    private String identityId;

    private Integer identityVersion;

    private String mode;

    private String route;

    private String userInput;

    private String plan;

    private String draft;

    private String finalOutput;

    private Boolean critiquePassed;

    private String critiqueIssues;

    private Integer attempts;

    private Integer inputTokens;

    private Integer outputTokens;

    private Integer cacheTokens;

    private Integer llmCallCount;

    private Double totalCost;

    private Long executionTimeMs;

    private LocalDateTime createdAt;
}
