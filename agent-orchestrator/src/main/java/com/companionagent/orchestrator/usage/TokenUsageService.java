package com.companionagent.orchestrator.usage;

import com.companionagent.orchestrator.model.LlmCallRecord;
import com.companionagent.orchestrator.repository.LlmCallRepository;
import com.companionagent.orchestrator.repository.LlmCallRepository.NodeUsageRow;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side of the {@code llm_calls} log: per-turn breakdowns, recent turns of a session
 * and today's usage of a user grouped by node. Rows are written by
 * {@link com.companionagent.orchestrator.state.TurnLogService}.
 */
@Service
public class TokenUsageService {

    private static final Logger log = LoggerFactory.getLogger(TokenUsageService.class);

    public record CallBreakdown(
        @JsonProperty("node")         String node,
        @JsonProperty("sequence")     int    sequence,
        @JsonProperty("provider")     String provider,
        @JsonProperty("model")        String model,
        @JsonProperty("inputTokens")  int    inputTokens,
        @JsonProperty("outputTokens") int    outputTokens,
        @JsonProperty("cacheTokens")  int    cacheTokens,
        @JsonProperty("cost")         double cost,
        @JsonProperty("durationMs")   long   durationMs
    ) {}

    public record TurnTokenSummary(
        @JsonProperty("turnId")            String              turnId,
        @JsonProperty("sessionId")         String              sessionId,
        @JsonProperty("totalInputTokens")  long                totalInputTokens,
        @JsonProperty("totalOutputTokens") long                totalOutputTokens,
        @JsonProperty("totalCacheTokens")  long                totalCacheTokens,
        @JsonProperty("totalTokens")       long                totalTokens,
        @JsonProperty("totalCost")         double              totalCost,
        @JsonProperty("llmCallCount")      int                 llmCallCount,
        @JsonProperty("callBreakdown")     List<CallBreakdown> callBreakdown,
        @JsonProperty("createdAt")         LocalDateTime       createdAt
    ) {}

    public record NodeUsage(
        @JsonProperty("callCount")     long   callCount,
        @JsonProperty("totalInput")    long   totalInput,
        @JsonProperty("totalOutput")   long   totalOutput,
        @JsonProperty("totalTokens")   long   totalTokens,
        @JsonProperty("totalCost")     double totalCost,
        @JsonProperty("avgDurationMs") long   avgDurationMs
    ) {}

    public record DailyTokenStats(
        @JsonProperty("day")    LocalDate              day,
        @JsonProperty("byNode") Map<String, NodeUsage> byNode,
        @JsonProperty("totals") NodeUsage              totals
    ) {}

    private final LlmCallRepository repository;

    public TokenUsageService(LlmCallRepository repository) {
        this.repository = repository;
    }

    /** Empty when the turn made no completed model call or is unknown. */
    public Mono<TurnTokenSummary> getTurnSummary(String turnId) {
        return repository.findByTurnId(turnId)
            .collectList()
            .filter(calls -> !calls.isEmpty())
            .map(TokenUsageService::summarise);
    }

    /** Summaries of the session's {@code limit} most recent turns, newest first. */
    public Flux<TurnTokenSummary> getSessionTurnStats(String sessionId, int limit) {
        return repository.findForRecentTurns(sessionId, limit)
            .collectList()
            .flatMapIterable(calls -> {
                Map<String, List<LlmCallRecord>> byTurn = new LinkedHashMap<>();
                for (LlmCallRecord call : calls) {
                    byTurn.computeIfAbsent(call.getTurnId(), k -> new ArrayList<>()).add(call);
                }
                return byTurn.values().stream().map(TokenUsageService::summarise).toList();
            });
    }

    /** Usage since the start of the current UTC day; the total cost is rounded to 4 decimals. */
    public Mono<DailyTokenStats> getDailyTurnStats(String userId) {
        LocalDate today = LocalDate.now(ZoneOffset.UTC);
        return repository.sumByNodeSince(userId, today.atStartOfDay())
            .collectList()
            .map(rows -> {
                Map<String, NodeUsage> byNode = new LinkedHashMap<>();
                long calls = 0, input = 0, output = 0;
                double cost = 0.0;
                for (NodeUsageRow row : rows) {
                    NodeUsage usage = toNodeUsage(row);
                    byNode.put(row.nodeName(), usage);
                    calls  += usage.callCount();
                    input  += usage.totalInput();
                    output += usage.totalOutput();
                    cost   += usage.totalCost();
                }
                NodeUsage totals = new NodeUsage(calls, input, output, input + output, round4(cost), 0);
                log.debug("[TokenUsage] Daily stats. userId={} calls={} cost={}", userId, calls, totals.totalCost());
                return new DailyTokenStats(today, byNode, totals);
            });
    }

    // ── mapping ─────────────────────────────────────────────────────────────

    static TurnTokenSummary summarise(List<LlmCallRecord> calls) {
        LlmCallRecord first = calls.get(0);
        long input = 0, output = 0, cache = 0;
        double cost = 0.0;
        List<CallBreakdown> breakdown = new ArrayList<>();
        for (LlmCallRecord c : calls) {
            input  += nz(c.getInputTokens());
            output += nz(c.getOutputTokens());
            cache  += nz(c.getCacheTokens());
            cost   += c.getEstimatedCost() == null ? 0.0 : c.getEstimatedCost();
            breakdown.add(new CallBreakdown(c.getNodeName(), nz(c.getCallSequence()), c.getProvider(), c.getModel(),
                nz(c.getInputTokens()), nz(c.getOutputTokens()), nz(c.getCacheTokens()),
                c.getEstimatedCost() == null ? 0.0 : c.getEstimatedCost(),
                c.getDurationMs() == null ? 0 : c.getDurationMs()));
        }
        return new TurnTokenSummary(first.getTurnId(), first.getSessionId(), input, output, cache,
            input + output, cost, calls.size(), breakdown, first.getCreatedAt());
    }

    private static NodeUsage toNodeUsage(NodeUsageRow row) {
        long input  = row.totalInput() == null ? 0 : row.totalInput();
        long output = row.totalOutput() == null ? 0 : row.totalOutput();
        return new NodeUsage(
            row.callCount() == null ? 0 : row.callCount(),
            input, output, input + output,
            row.totalCost() == null ? 0.0 : row.totalCost(),
            row.avgDurationMs() == null ? 0 : Math.round(row.avgDurationMs()));
    }

    private static int nz(Integer value) {
        return value == null ? 0 : value;
    }

    private static double round4(double value) {
        return Math.round(value * 10_000) / 10_000.0;
    }
}
