package com.companionagent.orchestrator.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/** Identity version a session was started with; at most one per session. */
@Data
@NoArgsConstructor
@Table("identity_pins")
public class IdentityPin {

    @Id
    private Long id;

    private String sessionId;

    private String identityId;

    private Integer identityVersion;

    private LocalDateTime pinnedAt;
}
