package com.companionagent.orchestrator.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * issues: JSON-serialised {@code List<String>}
 */
@Data
@NoArgsConstructor
@Table("pending_corrections")
public class PendingCorrectionRecord {

    @Id
    private Long id;

    private String sessionId;

    private String userId;

    private String turnId;

    private String severity;

    private String issues;

    private String fixInstructions;

    private String originalResponse;

    private Boolean processed;

    private LocalDateTime createdAt;
}
