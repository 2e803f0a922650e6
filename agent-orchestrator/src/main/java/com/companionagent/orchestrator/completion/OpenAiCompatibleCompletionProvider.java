package com.companionagent.orchestrator.completion;

import com.companionagent.common.exception.PipelineException;
import com.companionagent.common.exception.PipelineException.FailureKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Provider for any endpoint speaking the OpenAI chat-completions protocol (Groq, OpenAI).
 * One instance per configured endpoint; the instances are declared as beans in
 * {@link CompletionProviderConfig}.
 */
public class OpenAiCompatibleCompletionProvider implements CompletionProvider {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleCompletionProvider.class);

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
        new ParameterizedTypeReference<>() {};

    private static final String STREAM_END = "[DONE]";

    private final String name;
    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final long timeoutMs;

    public OpenAiCompatibleCompletionProvider(String name, WebClient.Builder builder,
                                              ObjectMapper objectMapper, String baseUrl,
                                              String apiKey, long timeoutMs) {
        this.name         = name;
        this.objectMapper = objectMapper;
        this.apiKey       = apiKey;
        this.timeoutMs    = timeoutMs;
        this.client       = builder
            .baseUrl(baseUrl)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Mono<CompletionResult> complete(CompletionRequest request) {
        if (!isConfigured()) {
            log.warn("[{}] No API key configured. model={}", name, request.model());
            return Mono.error(new PipelineException(name, FailureKind.PROVIDER_FAILURE, "API key not configured"));
        }

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody(request, false)))
            .flatMap(bodyJson ->
                client.post()
                    .uri("/chat/completions")
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(timeoutMs))
            )
            .map(response -> parseResponse(response, request.model()))
            .onErrorMap(e -> !(e instanceof PipelineException),
                e -> new PipelineException(name, FailureKind.PROVIDER_FAILURE, e.getMessage(), e));
    }

    @Override
    public Flux<CompletionChunk> stream(CompletionRequest request) {
        if (!isConfigured()) {
            log.warn("[{}] No API key configured for stream. model={}", name, request.model());
            return Flux.error(new PipelineException(name, FailureKind.PROVIDER_FAILURE, "API key not configured"));
        }

        return Flux.defer(() -> {
            AtomicInteger inputTokens  = new AtomicInteger();
            AtomicInteger outputTokens = new AtomicInteger();
            AtomicInteger cacheTokens  = new AtomicInteger();
            StringBuilder content      = new StringBuilder();

            Flux<CompletionChunk> deltas = Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody(request, true)))
                .flatMapMany(bodyJson ->
                    client.post()
                        .uri("/chat/completions")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                        .accept(MediaType.TEXT_EVENT_STREAM)
                        .bodyValue(bodyJson)
                        .retrieve()
                        .bodyToFlux(SSE_TYPE)
                )
                .timeout(Duration.ofMillis(timeoutMs))
                .takeUntil(event -> STREAM_END.equals(event.data()))
                .concatMap(event -> {
                    JsonNode data = readTree(event.data());
                    if (data == null) return Flux.<CompletionChunk>empty();
                    JsonNode usage = data.path("usage");
                    if (usage.isObject()) {
                        inputTokens.set(usage.path("prompt_tokens").asInt(0));
                        outputTokens.set(usage.path("completion_tokens").asInt(0));
                        cacheTokens.set(usage.path("prompt_tokens_details").path("cached_tokens").asInt(0));
                    }
                    JsonNode choices = data.path("choices");
                    if (choices.isArray() && !choices.isEmpty()) {
                        String text = choices.get(0).path("delta").path("content").asText("");
                        if (!text.isEmpty()) {
                            content.append(text);
                            return Flux.just(CompletionChunk.delta(text));
                        }
                    }
                    return Flux.<CompletionChunk>empty();
                });

            return deltas.concatWith(Mono.fromCallable(() -> CompletionChunk.done(new CompletionResult(
                content.toString(), inputTokens.get(), outputTokens.get(), cacheTokens.get(),
                request.model(), name))));
        })
        .onErrorMap(e -> !(e instanceof PipelineException),
            e -> new PipelineException(name, FailureKind.PROVIDER_FAILURE, e.getMessage(), e));
    }

    // ── request / response mapping ───────────────────────────────────────────

    private Map<String, Object> requestBody(CompletionRequest request, boolean stream) {
        List<Map<String, String>> messages = new ArrayList<>();
        if (request.system() != null && !request.system().isBlank()) {
            messages.add(Map.of("role", "system", "content", request.system()));
        }
        request.messages().forEach(m -> messages.add(Map.of("role", m.role(), "content", m.content())));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", request.model());
        body.put("messages", messages);
        body.put("temperature", request.temperature());
        body.put("max_tokens", request.maxTokens());
        if (stream) {
            body.put("stream", true);
            body.put("stream_options", Map.of("include_usage", true));
        }
        return body;
    }

    private CompletionResult parseResponse(String response, String model) {
        try {
            JsonNode root = objectMapper.readTree(response);
            String text = root.path("choices").path(0).path("message").path("content").asText("");
            JsonNode usage = root.path("usage");
            return new CompletionResult(
                text,
                usage.path("prompt_tokens").asInt(0),
                usage.path("completion_tokens").asInt(0),
                usage.path("prompt_tokens_details").path("cached_tokens").asInt(0),
                root.path("model").asText(model),
                name);
        } catch (Exception e) {
            throw new PipelineException(name, FailureKind.PROVIDER_FAILURE,
                "Failed to extract text from chat completion response", e);
        }
    }

    private JsonNode readTree(String data) {
        if (data == null || data.isBlank() || STREAM_END.equals(data)) return null;
        try {
            return objectMapper.readTree(data);
        } catch (Exception e) {
            log.debug("[{}] Skipping unparseable stream event: {}", name, data);
            return null;
        }
    }
}
