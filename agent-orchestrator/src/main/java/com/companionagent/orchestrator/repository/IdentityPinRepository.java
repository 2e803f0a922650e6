package com.companionagent.orchestrator.repository;

import com.companionagent.orchestrator.model.IdentityPin;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface IdentityPinRepository extends ReactiveCrudRepository<IdentityPin, Long> {

    Mono<IdentityPin> findBySessionId(String sessionId);
}
