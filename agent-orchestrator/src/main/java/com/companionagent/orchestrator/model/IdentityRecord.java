package com.companionagent.orchestrator.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Stored identity version. {@code (identity_id, version)} is unique and rows are never
 * updated: a changed document is a new version.
 *
 * policy: JSON-serialised {@code IdentityProfile}
 */
@Data
@NoArgsConstructor
@Table("identities")
public class IdentityRecord {

    @Id
    private Long id;

    private String identityId;

    private Integer version;

    private String policy;

    private LocalDateTime createdAt;
}
