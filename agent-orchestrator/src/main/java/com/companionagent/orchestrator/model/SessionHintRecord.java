package com.companionagent.orchestrator.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("session_critique_hints")
public class SessionHintRecord {

    @Id
    private Long id;

    private String sessionId;

    private String hintType;

    private String hintText;

    private Double weight;

    private LocalDateTime createdAt;
}
