package com.companionagent.orchestrator.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Cross-session hint for one user. {@code (user_id, hint_type)} is unique; repeated critique
 * findings bump {@code occurrenceCount} and {@code weight} (capped at 2.0) on the same row.
 */
@Data
@NoArgsConstructor
@Table("user_critique_hints")
public class UserHintRecord {

    @Id
    private Long id;

    private String userId;

    private String hintType;

    private String hintText;

    private Double weight;

    private Integer occurrenceCount;

    private LocalDateTime lastSeen;

    private LocalDateTime createdAt;
}
