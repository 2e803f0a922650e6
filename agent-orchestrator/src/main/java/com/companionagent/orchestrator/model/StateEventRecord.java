package com.companionagent.orchestrator.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * One row of a session's append-only event log. Rows are inserted, never updated.
 * {@code (session_id, sequence)} is unique; replay reads them ordered by {@code sequence}.
 */
@Data
@NoArgsConstructor
@Table("state_events")
public class StateEventRecord {

    @Id
    private Long id;

    private String sessionId;

    private String turnId;

    /** Wire name of {@code StateEventType}. */
    private String eventType;

    /** {@code null} for interaction events and for cleared fields. */
    private String eventValue;

    private Long sequence;

    private LocalDateTime createdAt;
}
