package com.companionagent.orchestrator.completion;

import com.companionagent.common.exception.PipelineException;
import com.companionagent.common.exception.PipelineException.FailureKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Anthropic Messages API provider.
 *
 * <p>The request body is assembled as a plain map and serialised with the shared
 * {@link ObjectMapper}; the reply is read as a JSON tree. Streaming uses the same endpoint
 * with {@code "stream": true} and consumes the server-sent events, emitting one
 * {@link CompletionChunk#delta} per {@code content_block_delta} and a terminal summary.
 *
 * <p>A missing API key is reported as a {@link PipelineException}; callers fall back.
 */
@Component
public class AnthropicCompletionProvider implements CompletionProvider {

    private static final Logger log = LoggerFactory.getLogger(AnthropicCompletionProvider.class);

    public static final String NAME = "anthropic";

    private static final ParameterizedTypeReference<ServerSentEvent<String>> SSE_TYPE =
        new ParameterizedTypeReference<>() {};

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;

    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${anthropic.timeout-ms:30000}")
    private long timeoutMs = 30_000;

    public AnthropicCompletionProvider(WebClient.Builder builder, ObjectMapper objectMapper,
                                       @Value("${anthropic.base-url:https://api.anthropic.com}") String baseUrl) {
        this.anthropicClient = builder
            .baseUrl(baseUrl)
            .defaultHeader("anthropic-version", "2023-06-01")
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.objectMapper = objectMapper;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isConfigured() {
        return anthropicApiKey != null && !anthropicApiKey.isBlank();
    }

    @Override
    public Mono<CompletionResult> complete(CompletionRequest request) {
        if (!isConfigured()) {
            log.warn("[Anthropic] No API key configured. model={}", request.model());
            return Mono.error(notConfigured());
        }

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody(request, false)))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", anthropicApiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofMillis(timeoutMs))
            )
            .map(response -> parseResponse(response, request.model()))
            .onErrorMap(e -> !(e instanceof PipelineException),
                e -> new PipelineException(NAME, FailureKind.PROVIDER_FAILURE, e.getMessage(), e));
    }

    @Override
    public Flux<CompletionChunk> stream(CompletionRequest request) {
        if (!isConfigured()) {
            log.warn("[Anthropic] No API key configured for stream. model={}", request.model());
            return Flux.error(notConfigured());
        }

        return Flux.defer(() -> {
            AtomicInteger inputTokens  = new AtomicInteger();
            AtomicInteger outputTokens = new AtomicInteger();
            AtomicInteger cacheTokens  = new AtomicInteger();
            StringBuilder content      = new StringBuilder();

            Flux<CompletionChunk> deltas = Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody(request, true)))
                .flatMapMany(bodyJson ->
                    anthropicClient.post()
                        .uri("/v1/messages")
                        .header("x-api-key", anthropicApiKey)
                        .accept(MediaType.TEXT_EVENT_STREAM)
                        .bodyValue(bodyJson)
                        .retrieve()
                        .bodyToFlux(SSE_TYPE)
                )
                .timeout(Duration.ofMillis(timeoutMs))
                .concatMap(event -> {
                    JsonNode data = readTree(event.data());
                    if (data == null) return Flux.<CompletionChunk>empty();
                    switch (data.path("type").asText()) {
                        case "message_start" -> {
                            JsonNode usage = data.path("message").path("usage");
                            inputTokens.set(usage.path("input_tokens").asInt(0));
                            cacheTokens.set(usage.path("cache_read_input_tokens").asInt(0));
                        }
                        case "content_block_delta" -> {
                            String text = data.path("delta").path("text").asText("");
                            if (!text.isEmpty()) {
                                content.append(text);
                                return Flux.just(CompletionChunk.delta(text));
                            }
                        }
                        case "message_delta" ->
                            outputTokens.set(data.path("usage").path("output_tokens").asInt(outputTokens.get()));
                        default -> { }
                    }
                    return Flux.<CompletionChunk>empty();
                });

            return deltas.concatWith(Mono.fromCallable(() -> CompletionChunk.done(new CompletionResult(
                content.toString(), inputTokens.get(), outputTokens.get(), cacheTokens.get(),
                request.model(), NAME))));
        })
        .onErrorMap(e -> !(e instanceof PipelineException),
            e -> new PipelineException(NAME, FailureKind.PROVIDER_FAILURE, e.getMessage(), e));
    }

    // ── request / response mapping ───────────────────────────────────────────

    private Map<String, Object> requestBody(CompletionRequest request, boolean stream) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", request.model());
        body.put("max_tokens", request.maxTokens());
        body.put("temperature", request.temperature());
        if (request.system() != null && !request.system().isBlank()) {
            body.put("system", request.system());
        }
        body.put("messages", request.messages().stream()
            .map(m -> Map.of("role", m.role(), "content", m.content()))
            .toList());
        if (stream) body.put("stream", true);
        return body;
    }

    private CompletionResult parseResponse(String response, String model) {
        try {
            JsonNode root = objectMapper.readTree(response);
            StringBuilder text = new StringBuilder();
            for (JsonNode block : root.path("content")) {
                if ("text".equals(block.path("type").asText("text"))) {
                    text.append(block.path("text").asText(""));
                }
            }
            JsonNode usage = root.path("usage");
            return new CompletionResult(
                text.toString(),
                usage.path("input_tokens").asInt(0),
                usage.path("output_tokens").asInt(0),
                usage.path("cache_read_input_tokens").asInt(0),
                root.path("model").asText(model),
                NAME);
        } catch (Exception e) {
            throw new PipelineException(NAME, FailureKind.PROVIDER_FAILURE,
                "Failed to extract text from Anthropic response", e);
        }
    }

    private JsonNode readTree(String data) {
        if (data == null || data.isBlank()) return null;
        try {
            return objectMapper.readTree(data);
        } catch (Exception e) {
            log.debug("[Anthropic] Skipping unparseable stream event: {}", data);
            return null;
        }
    }

    private static PipelineException notConfigured() {
        return new PipelineException(NAME, FailureKind.PROVIDER_FAILURE, "API key not configured");
    }
}
