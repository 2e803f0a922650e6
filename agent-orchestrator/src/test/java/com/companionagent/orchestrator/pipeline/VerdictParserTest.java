package com.companionagent.orchestrator.pipeline;

import com.companionagent.common.exception.PipelineException;
import com.companionagent.common.exception.PipelineException.FailureKind;
import com.companionagent.common.model.SupervisorVerdict;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.companionagent.orchestrator.TestStates.MAPPER;
import static org.junit.jupiter.api.Assertions.*;

class VerdictParserTest {

    @Test
    @DisplayName("JSON surrounded by prose is extracted")
    void surroundingText() {
        SupervisorVerdict v = VerdictParser.parse(
            "Here is my verdict:\n{\"approved\": false, \"issues\": [\"too long\"], \"fix_instructions\": \"shorten\"}\nDone.",
            MAPPER);

        assertFalse(v.approved());
        assertEquals(List.of("too long"), v.issues());
        assertEquals("shorten", v.fixInstructions());
    }

    @Test
    @DisplayName("missing issues and fix instructions default to empty")
    void defaults() {
        SupervisorVerdict v = VerdictParser.parse("{\"approved\": true}", MAPPER);
        assertTrue(v.approved());
        assertTrue(v.issues().isEmpty());
        assertEquals("", v.fixInstructions());
    }

    @Test
    @DisplayName("reply without JSON is a verdict parse failure")
    void noJson() {
        PipelineException e = assertThrows(PipelineException.class,
            () -> VerdictParser.parse("Looks fine to me", MAPPER));
        assertEquals(FailureKind.VERDICT_PARSE_FAILURE, e.getKind());
    }

    @Test
    @DisplayName("approved as a string is rejected")
    void approvedNotBoolean() {
        assertThrows(PipelineException.class,
            () -> VerdictParser.parse("{\"approved\": \"yes\", \"issues\": []}", MAPPER));
    }

    @Test
    @DisplayName("issues that is not an array is rejected")
    void issuesNotArray() {
        assertThrows(PipelineException.class,
            () -> VerdictParser.parse("{\"approved\": false, \"issues\": \"too long\"}", MAPPER));
    }

    @Test
    @DisplayName("broken JSON is rejected")
    void brokenJson() {
        assertThrows(PipelineException.class,
            () -> VerdictParser.parse("{\"approved\": true,, }", MAPPER));
    }
}
