package com.companionagent.orchestrator.state;

import com.companionagent.common.model.AgentView;
import com.companionagent.common.model.StateEvent;
import com.companionagent.common.model.StateEventType;
import com.companionagent.common.state.AgentViewReducer;
import com.companionagent.orchestrator.model.StateEventRecord;
import com.companionagent.orchestrator.repository.StateEventRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Append-only per-session event log and the {@link AgentView} derived from it.
 *
 * <p>The view is always a full replay of the log; nothing incremental is persisted.
 * Appends for one session must not run concurrently: the caller serialises turns of a
 * session, and the unique {@code (session_id, sequence)} constraint rejects a violation.
 */
@Service
public class EventLogService {

    private static final Logger log = LoggerFactory.getLogger(EventLogService.class);

    private final StateEventRepository repository;

    public EventLogService(StateEventRepository repository) {
        this.repository = repository;
    }

    public Flux<StateEvent> events(String sessionId) {
        return repository.findBySessionIdOrderBySequenceAsc(sessionId).map(EventLogService::toEvent);
    }

    /** Replays the whole log; an empty log gives {@link AgentView#empty()}. */
    public Mono<AgentView> snapshot(String sessionId) {
        return events(sessionId).collectList().map(AgentViewReducer::replay);
    }

    /**
     * Appends {@code pending} after the current tail with consecutive sequence numbers,
     * preserving list order.
     *
     * @return the events as stored
     */
    public Mono<List<StateEvent>> append(String sessionId, List<StateEvent> pending) {
        if (pending.isEmpty()) return Mono.just(List.of());

        return repository.findMaxSequence(sessionId)
            .defaultIfEmpty(0L)
            .flatMapMany(tail -> Flux.range(0, pending.size())
                .map(i -> pending.get(i).atSequence(tail + 1 + i)))
            .concatMap(event -> repository.save(toRecord(event)).thenReturn(event))
            .collectList()
            .doOnNext(stored -> log.debug("[EventLog] appended sessionId={} count={} lastSequence={}",
                sessionId, stored.size(), stored.get(stored.size() - 1).sequence()));
    }

    public Mono<Integer> clear(String sessionId) {
        return repository.deleteBySessionId(sessionId)
            .doOnNext(n -> log.info("[EventLog] cleared sessionId={} deleted={}", sessionId, n));
    }

    // ── mapping ─────────────────────────────────────────────────────────────

    static StateEventRecord toRecord(StateEvent event) {
        StateEventRecord record = new StateEventRecord();
        record.setSessionId(event.sessionId());
        record.setTurnId(event.turnId());
        record.setEventType(event.type().wire());
        record.setEventValue(event.payload());
        record.setSequence(event.sequence());
        record.setCreatedAt(LocalDateTime.ofInstant(event.timestamp(), ZoneOffset.UTC));
        return record;
    }

    static StateEvent toEvent(StateEventRecord record) {
        return new StateEvent(
            record.getSessionId(),
            record.getTurnId(),
            StateEventType.fromWire(record.getEventType()),
            record.getEventValue(),
            record.getSequence(),
            record.getCreatedAt().toInstant(ZoneOffset.UTC));
    }
}
