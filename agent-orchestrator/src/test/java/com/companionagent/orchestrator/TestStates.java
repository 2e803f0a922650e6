package com.companionagent.orchestrator;

import com.companionagent.common.identity.IdentityProfile;
import com.companionagent.common.model.AgentMode;
import com.companionagent.common.model.PipelineState;
import com.companionagent.common.model.Route;
import com.companionagent.orchestrator.completion.CompletionResult;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/** Shared fixtures: the bundled seed identity and fresh pipeline states. */
public final class TestStates {

    public static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());

    private static IdentityProfile identity;

    private TestStates() {}

    public static synchronized IdentityProfile identity() {
        if (identity == null) {
            try (InputStream in = TestStates.class.getResourceAsStream("/identity/default-identity.json")) {
                identity = MAPPER.readValue(in, IdentityProfile.class);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }
        return identity;
    }

    public static PipelineState state(String message, AgentMode mode) {
        return state(message, mode, Route.NANO);
    }

    public static PipelineState state(String message, AgentMode mode, Route route) {
        return PipelineState.initial("session-1", "turn-1", message, mode, identity(), route, null, null);
    }

    public static CompletionResult reply(String content) {
        return new CompletionResult(content, 10, 5, 0, "test-model", "test");
    }
}
