package com.companionagent.orchestrator.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Durable record of one critique job, unique per turn.
 *
 * <p>Status moves {@code queued → processing → completed | failed}. Rows still queued or
 * processing at startup are dispatched again.
 *
 * payload: JSON-serialised {@code CritiqueJob}
 * result: JSON summary of the outcome, or {@code {"error": ...}} on failure
 * hintsWritten: hints of this turn were already reinforced by an earlier attempt
 */
@Data
@NoArgsConstructor
@Table("critique_queue_log")
public class CritiqueJobLog {

    public static final String QUEUED     = "queued";
    public static final String PROCESSING = "processing";
    public static final String COMPLETED  = "completed";
    public static final String FAILED     = "failed";

    @Id
    private Long id;

    private String turnId;

    private String sessionId;

    private String userId;

    private String status;

    private String payload;

    private String result;

    private Integer attempts;

    private Boolean hintsWritten;

    private Long processingTimeMs;

    private LocalDateTime createdAt;

    private LocalDateTime completedAt;
}
