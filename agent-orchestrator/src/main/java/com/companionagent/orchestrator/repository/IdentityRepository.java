package com.companionagent.orchestrator.repository;

import com.companionagent.orchestrator.model.IdentityRecord;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface IdentityRepository extends ReactiveCrudRepository<IdentityRecord, Long> {

    Mono<IdentityRecord> findByIdentityIdAndVersion(String identityId, Integer version);
}
