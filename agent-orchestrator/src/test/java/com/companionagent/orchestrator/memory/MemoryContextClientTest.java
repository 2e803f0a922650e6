package com.companionagent.orchestrator.memory;

import com.companionagent.common.model.AgentView;
import com.companionagent.common.model.MemoryContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MemoryContextClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private MemoryContextClient client(boolean enabled, HttpStatus status, String body) {
        WebClient webClient = WebClient.builder()
            .baseUrl("http://memory.test")
            .exchangeFunction(request -> {
                requests.add(request);
                return Mono.just(ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(body)
                    .build());
            })
            .build();
        MemoryContextClient client = new MemoryContextClient(webClient);
        ReflectionTestUtils.setField(client, "enabled", enabled);
        ReflectionTestUtils.setField(client, "timeoutMs", 1000L);
        return client;
    }

    @Test
    @DisplayName("disabled memory answers empty without a request")
    void disabled() {
        StepVerifier.create(client(false, HttpStatus.OK, "{}").getContext("u1", "hi", "s1", AgentView.empty()))
            .expectNext(MemoryContext.empty())
            .verifyComplete();
        assertTrue(requests.isEmpty());
    }

    @Test
    @DisplayName("provider blocks are returned as-is")
    void blocks() {
        String body = """
            {"facts": "[Facts]\\n- likes tea", "recent_actions": null, "conversations": "we talked about tea"}""";

        StepVerifier.create(client(true, HttpStatus.OK, body).getContext("u1", "tea?", "s1", null))
            .assertNext(ctx -> {
                assertEquals("[Facts]\n- likes tea", ctx.facts());
                assertEquals(2, ctx.orderedBlocks().size());
                assertTrue(ctx.orderedBlocks().get(1).startsWith("[Relevant Past Conversations]"));
            })
            .verifyComplete();
        assertEquals("/api/v1/memory/context", requests.get(0).url().getPath());
    }

    @Test
    @DisplayName("provider failure degrades to an empty context")
    void failure() {
        StepVerifier.create(client(true, HttpStatus.INTERNAL_SERVER_ERROR, "{}").getContext("u1", "hi", "s1", null))
            .expectNext(MemoryContext.empty())
            .verifyComplete();
    }
}
