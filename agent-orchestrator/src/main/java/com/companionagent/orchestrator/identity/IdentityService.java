package com.companionagent.orchestrator.identity;

import com.companionagent.common.identity.IdentityProfile;
import com.companionagent.orchestrator.model.IdentityPin;
import com.companionagent.orchestrator.model.IdentityRecord;
import com.companionagent.orchestrator.repository.IdentityPinRepository;
import com.companionagent.orchestrator.repository.IdentityRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Identity versions and their per-session pins.
 *
 * <p>Versions are append-only: persisting an {@code id@version} that already exists is a
 * no-op. A session is pinned to one version on its first turn and keeps it for its whole
 * life, so later edits to the seed document only affect new sessions.
 */
@Service
public class IdentityService {

    private static final Logger log = LoggerFactory.getLogger(IdentityService.class);

    private final IdentityRepository identityRepository;
    private final IdentityPinRepository pinRepository;
    private final ObjectMapper objectMapper;
    private final Mono<IdentityProfile> defaultIdentity;

    public IdentityService(IdentityRepository identityRepository,
                           IdentityPinRepository pinRepository,
                           ObjectMapper objectMapper,
                           @Value("${identity.default-path:identity/default-identity.json}") String defaultPath) {
        this.identityRepository = identityRepository;
        this.pinRepository      = pinRepository;
        this.objectMapper       = objectMapper;
        this.defaultIdentity    = Mono.fromCallable(() -> readClasspathIdentity(defaultPath)).cache();
    }

    /**
     * Pinned identity of the session; on the first turn the seed identity is persisted
     * (if new) and pinned. A concurrent pin for the same session wins and is returned.
     */
    public Mono<IdentityProfile> ensureSessionIdentity(String sessionId) {
        return getSessionIdentity(sessionId)
            .switchIfEmpty(Mono.defer(() -> defaultIdentity
                .flatMap(identity -> persistIdentity(identity)
                    .then(pin(sessionId, identity))
                    .then(getSessionIdentity(sessionId))
                    .defaultIfEmpty(identity))
                .doOnNext(identity -> log.info("[Identity] Pinned session identity. sessionId={} identity={}",
                                               sessionId, identity.ref()))));
    }

    public Mono<IdentityProfile> getSessionIdentity(String sessionId) {
        return pinRepository.findBySessionId(sessionId)
            .flatMap(pin -> getIdentity(pin.getIdentityId(), pin.getIdentityVersion()));
    }

    /** Exact stored version, or empty. */
    public Mono<IdentityProfile> getIdentity(String identityId, int version) {
        return identityRepository.findByIdentityIdAndVersion(identityId, version)
            .map(this::toProfile);
    }

    /** Stores {@code identity} unless that exact version exists already. */
    public Mono<Void> persistIdentity(IdentityProfile identity) {
        return identityRepository.findByIdentityIdAndVersion(identity.id(), identity.version())
            .hasElement()
            .flatMap(exists -> {
                if (exists) return Mono.<Void>empty();
                IdentityRecord record = new IdentityRecord();
                record.setIdentityId(identity.id());
                record.setVersion(identity.version());
                record.setPolicy(toJson(identity));
                record.setCreatedAt(LocalDateTime.now(ZoneOffset.UTC));
                return identityRepository.save(record)
                    .doOnNext(r -> log.info("[Identity] Persisted identity={}", identity.ref()))
                    .onErrorResume(DataIntegrityViolationException.class, e -> {
                        log.debug("[Identity] Version stored concurrently. identity={}", identity.ref());
                        return Mono.empty();
                    })
                    .then();
            });
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private Mono<Void> pin(String sessionId, IdentityProfile identity) {
        IdentityPin pin = new IdentityPin();
        pin.setSessionId(sessionId);
        pin.setIdentityId(identity.id());
        pin.setIdentityVersion(identity.version());
        pin.setPinnedAt(LocalDateTime.now(ZoneOffset.UTC));
        return pinRepository.save(pin)
            .onErrorResume(DataIntegrityViolationException.class, e -> {
                log.debug("[Identity] Session pinned concurrently. sessionId={}", sessionId);
                return Mono.empty();
            })
            .then();
    }

    IdentityProfile readClasspathIdentity(String path) {
        try (InputStream in = new ClassPathResource(path).getInputStream()) {
            IdentityProfile identity = objectMapper.readValue(in, IdentityProfile.class);
            log.info("[Identity] Loaded seed identity={} path={}", identity.ref(), path);
            return identity;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read identity document " + path, e);
        }
    }

    private IdentityProfile toProfile(IdentityRecord record) {
        try {
            return objectMapper.readValue(record.getPolicy(), IdentityProfile.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored identity is unreadable: "
                + record.getIdentityId() + "@" + record.getVersion(), e);
        }
    }

    private String toJson(IdentityProfile identity) {
        try {
            return objectMapper.writeValueAsString(identity);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise identity " + identity.ref(), e);
        }
    }
}
