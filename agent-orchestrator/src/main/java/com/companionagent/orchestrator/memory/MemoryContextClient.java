package com.companionagent.orchestrator.memory;

import com.companionagent.common.model.AgentView;
import com.companionagent.common.model.MemoryContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Client of the external memory provider. Returns pre-ranked text blocks for one turn.
 *
 * <p>Disabled or failing lookups answer {@link MemoryContext#empty()}; memory never blocks a turn.
 */
@Component
public class MemoryContextClient {

    private static final Logger log = LoggerFactory.getLogger(MemoryContextClient.class);

    private final WebClient memoryClient;

    @Value("${memory.enabled:false}")
    private boolean enabled;

    @Value("${memory.timeout-ms:3000}")
    private long timeoutMs;

    public MemoryContextClient(WebClient memoryClient) {
        this.memoryClient = memoryClient;
    }

    public Mono<MemoryContext> getContext(String userId, String query, String sessionId, AgentView view) {
        if (!enabled) {
            return Mono.just(MemoryContext.empty());
        }

        Map<String, Object> body = new HashMap<>();
        body.put("userId", userId);
        body.put("sessionId", sessionId);
        body.put("query", query);
        body.put("agentView", view == null ? AgentView.empty() : view);

        return memoryClient.post()
            .uri("/api/v1/memory/context")
            .bodyValue(body)
            .retrieve()
            .bodyToMono(MemoryContext.class)
            .timeout(Duration.ofMillis(timeoutMs))
            .defaultIfEmpty(MemoryContext.empty())
            .onErrorResume(e -> {
                log.warn("[Memory] Context lookup failed, continuing without memories. sessionId={} reason={}",
                         sessionId, e.getMessage());
                return Mono.just(MemoryContext.empty());
            });
    }
}
