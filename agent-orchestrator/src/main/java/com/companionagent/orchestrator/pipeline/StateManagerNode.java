package com.companionagent.orchestrator.pipeline;

import com.companionagent.common.model.AgentView;
import com.companionagent.common.model.PipelineState;
import com.companionagent.common.model.StateEvent;
import com.companionagent.common.state.EventDeriver;
import com.companionagent.orchestrator.memory.MemoryContextClient;
import com.companionagent.orchestrator.state.EventLogService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * First node of every turn: folds the new message into the session's event log, recomputes
 * the {@link AgentView} and attaches the memory blocks for this turn.
 *
 * <p>Never fails the turn. Any error returns the input state unchanged.
 */
@Component
public class StateManagerNode {

    private static final Logger log = LoggerFactory.getLogger(StateManagerNode.class);

    private final EventLogService eventLog;
    private final MemoryContextClient memoryClient;

    public StateManagerNode(EventLogService eventLog, MemoryContextClient memoryClient) {
        this.eventLog     = eventLog;
        this.memoryClient = memoryClient;
    }

    public Mono<PipelineState> advance(PipelineState state, String userId) {
        String sessionId = state.sessionId();
        Mono<AgentView> current = state.agentView() != null
            ? Mono.just(state.agentView())
            : eventLog.snapshot(sessionId);

        return current
            .flatMap(view -> {
                List<StateEvent> derived = EventDeriver.derive(sessionId, state.turnId(), state.userInput(), view);
                return eventLog.append(sessionId, derived)
                    .doOnNext(stored -> log.debug("[StateManager] events={} sessionId={} turnId={}",
                        stored.stream().map(e -> e.type().wire()).toList(), sessionId, state.turnId()));
            })
            .then(eventLog.snapshot(sessionId))
            .flatMap(view -> memoryClient.getContext(userId, state.userInput(), sessionId, view)
                .map(memory -> state
                    .withAgentView(view)
                    .withRelevantMemories(memory.orderedBlocks())))
            .onErrorResume(e -> {
                log.error("[StateManager] State recompute failed, continuing with previous view. "
                          + "sessionId={} turnId={} reason={}", sessionId, state.turnId(), e.getMessage());
                return Mono.just(state);
            });
    }
}
