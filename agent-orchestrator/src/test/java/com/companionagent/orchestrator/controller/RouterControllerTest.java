package com.companionagent.orchestrator.controller;

import com.companionagent.common.model.IntentClass;
import com.companionagent.orchestrator.router.ClassifierCache;
import com.companionagent.orchestrator.router.RouterService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.mockito.Mockito.mock;

class RouterControllerTest {

    @Test
    @DisplayName("cache endpoint reports the live entry count")
    void cacheSize() {
        ClassifierCache cache = new ClassifierCache();
        cache.put("hello there", IntentClass.CHAT);
        cache.put("what is rust", IntentClass.CHAT);
        WebTestClient client = WebTestClient.bindToController(
            new RouterController(mock(RouterService.class), cache)).build();

        client.get().uri("/api/v1/router/cache").exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.entries").isEqualTo(2);
    }
}
