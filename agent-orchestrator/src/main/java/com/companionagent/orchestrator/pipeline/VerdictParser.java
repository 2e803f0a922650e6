package com.companionagent.orchestrator.pipeline;

import com.companionagent.common.exception.PipelineException;
import com.companionagent.common.exception.PipelineException.FailureKind;
import com.companionagent.common.model.SupervisorVerdict;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the judge's reply into a {@link SupervisorVerdict}.
 *
 * <p>The reply may carry text around the JSON; everything from the first {@code '{'} to the
 * last {@code '}'} is parsed. {@code approved} must be a boolean; {@code issues} and
 * {@code fix_instructions} default to empty.
 */
public final class VerdictParser {

    private static final Pattern JSON_BLOCK = Pattern.compile("\\{[\\s\\S]*\\}");

    private VerdictParser() {}

    /**
     * @throws PipelineException with {@link FailureKind#VERDICT_PARSE_FAILURE} when no valid
     *                           verdict can be read
     */
    public static SupervisorVerdict parse(String reply, ObjectMapper objectMapper) {
        Matcher m = JSON_BLOCK.matcher(reply == null ? "" : reply);
        if (!m.find()) {
            throw failure("No JSON found in response", null);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(m.group());
        } catch (Exception e) {
            throw failure("Invalid JSON: " + e.getMessage(), e);
        }

        JsonNode approved = root.path("approved");
        if (!approved.isBoolean()) {
            throw failure("Field 'approved' missing or not a boolean", null);
        }

        List<String> issues = new ArrayList<>();
        JsonNode issuesNode = root.path("issues");
        if (issuesNode.isArray()) {
            issuesNode.forEach(i -> {
                if (i.isTextual() && !i.asText().isBlank()) issues.add(i.asText());
            });
        } else if (!issuesNode.isMissingNode() && !issuesNode.isNull()) {
            throw failure("Field 'issues' is not an array", null);
        }

        return new SupervisorVerdict(approved.asBoolean(), issues, root.path("fix_instructions").asText(""));
    }

    private static PipelineException failure(String message, Throwable cause) {
        return cause == null
            ? new PipelineException("Supervisor", FailureKind.VERDICT_PARSE_FAILURE, message)
            : new PipelineException("Supervisor", FailureKind.VERDICT_PARSE_FAILURE, message, cause);
    }
}
