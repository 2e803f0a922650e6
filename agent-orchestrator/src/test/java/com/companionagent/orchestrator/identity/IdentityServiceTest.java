package com.companionagent.orchestrator.identity;

import com.companionagent.common.identity.IdentityProfile;
import com.companionagent.orchestrator.TestStates;
import com.companionagent.orchestrator.model.IdentityPin;
import com.companionagent.orchestrator.model.IdentityRecord;
import com.companionagent.orchestrator.repository.IdentityPinRepository;
import com.companionagent.orchestrator.repository.IdentityRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import static com.companionagent.orchestrator.TestStates.MAPPER;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class IdentityServiceTest {

    private IdentityRepository identityRepository;
    private IdentityPinRepository pinRepository;
    private IdentityService service;

    private final IdentityProfile seed = TestStates.identity();

    @BeforeEach
    void setUp() {
        identityRepository = mock(IdentityRepository.class);
        pinRepository      = mock(IdentityPinRepository.class);
        service = new IdentityService(identityRepository, pinRepository, MAPPER, "identity/default-identity.json");
    }

    private IdentityRecord stored(IdentityProfile identity) throws Exception {
        IdentityRecord record = new IdentityRecord();
        record.setIdentityId(identity.id());
        record.setVersion(identity.version());
        record.setPolicy(MAPPER.writeValueAsString(identity));
        return record;
    }

    private IdentityPin pin(String sessionId, int version) {
        IdentityPin pin = new IdentityPin();
        pin.setSessionId(sessionId);
        pin.setIdentityId(seed.id());
        pin.setIdentityVersion(version);
        return pin;
    }

    // ── ensureSessionIdentity() ────────────────────────────────────────────

    @Nested
    @DisplayName("ensureSessionIdentity()")
    class EnsureTests {

        @Test
        @DisplayName("first turn persists the seed version and pins the session")
        void firstTurn() throws Exception {
            when(pinRepository.findBySessionId("s1"))
                .thenReturn(Mono.empty(), Mono.just(pin("s1", seed.version())));
            when(identityRepository.findByIdentityIdAndVersion(seed.id(), seed.version()))
                .thenReturn(Mono.empty(), Mono.just(stored(seed)));
            when(identityRepository.save(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
            when(pinRepository.save(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));

            StepVerifier.create(service.ensureSessionIdentity("s1"))
                .assertNext(identity -> assertEquals(seed.ref(), identity.ref()))
                .verifyComplete();

            ArgumentCaptor<IdentityPin> pinned = ArgumentCaptor.forClass(IdentityPin.class);
            verify(pinRepository).save(pinned.capture());
            assertEquals("s1", pinned.getValue().getSessionId());
            assertEquals(seed.version(), pinned.getValue().getIdentityVersion());
            verify(identityRepository).save(any());
        }

        @Test
        @DisplayName("pinned session keeps its stored version and writes nothing")
        void alreadyPinned() throws Exception {
            IdentityProfile older = new IdentityProfile(seed.id(), 0, seed.traits(), seed.sharedSpine(),
                seed.modes(), seed.modeSwitching(), seed.norms(), seed.styleGuidelines(), seed.complianceRubric(),
                seed.toolGating(), seed.delegation(), seed.capabilities());
            when(pinRepository.findBySessionId("s1")).thenReturn(Mono.just(pin("s1", 0)));
            when(identityRepository.findByIdentityIdAndVersion(seed.id(), 0)).thenReturn(Mono.just(stored(older)));

            StepVerifier.create(service.ensureSessionIdentity("s1"))
                .assertNext(identity -> assertEquals(0, identity.version()))
                .verifyComplete();

            verify(pinRepository, never()).save(any());
            verify(identityRepository, never()).save(any());
        }

        @Test
        @DisplayName("concurrent pin for the same session is tolerated")
        void concurrentPin() throws Exception {
            when(pinRepository.findBySessionId("s1"))
                .thenReturn(Mono.empty(), Mono.just(pin("s1", seed.version())));
            when(identityRepository.findByIdentityIdAndVersion(seed.id(), seed.version()))
                .thenReturn(Mono.just(stored(seed)));
            when(pinRepository.save(any())).thenReturn(Mono.error(new DataIntegrityViolationException("dup")));

            StepVerifier.create(service.ensureSessionIdentity("s1"))
                .assertNext(identity -> assertEquals(seed.ref(), identity.ref()))
                .verifyComplete();

            verify(identityRepository, never()).save(any());
        }
    }

    @Test
    @DisplayName("persisting an existing version is a no-op")
    void persistExisting() throws Exception {
        when(identityRepository.findByIdentityIdAndVersion(seed.id(), seed.version()))
            .thenReturn(Mono.just(stored(seed)));

        StepVerifier.create(service.persistIdentity(seed)).verifyComplete();

        verify(identityRepository, never()).save(any());
    }
}
