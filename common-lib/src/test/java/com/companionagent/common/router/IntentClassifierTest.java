package com.companionagent.common.router;

import com.companionagent.common.model.DecisionSource;
import com.companionagent.common.model.IntentClass;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntentClassifierTest {

    @Test
    @DisplayName("bare greeting → chat from the regex table at full confidence")
    void greeting() {
        IntentClassifier.Classification c = IntentClassifier.classify("hey");
        assertEquals(IntentClass.CHAT, c.intentClass());
        assertEquals(1.0, c.confidence(), 1e-9);
        assertEquals(DecisionSource.REGEX, c.source());
        assertTrue(c.matchedPatterns().stream().allMatch(p -> p.startsWith("chat:")));
        assertTrue(c.isConfident());
    }

    @Test
    @DisplayName("rewrite request → transform")
    void transform() {
        IntentClassifier.Classification c =
            IntentClassifier.classify("Rewrite this paragraph to sound friendlier");
        assertEquals(IntentClass.TRANSFORM, c.intentClass());
        assertEquals(DecisionSource.REGEX, c.source());
    }

    @Test
    @DisplayName("keyword and pattern tie → keyword source")
    void keywordWinsTie() {
        IntentClassifier.Classification c = IntentClassifier.classify("what is photosynthesis");
        assertEquals(IntentClass.FACTUAL, c.intentClass());
        assertEquals(0.9, c.confidence(), 1e-9);
        assertEquals(DecisionSource.KEYWORD, c.source());
    }

    @Test
    @DisplayName("short message without signal → chat at 0.7")
    void shortMessageRule() {
        IntentClassifier.Classification c = IntentClassifier.classify("zzz qqq");
        assertEquals(IntentClass.CHAT, c.intentClass());
        assertEquals(0.7, c.confidence(), 1e-9);
        assertEquals(List.of("short_message"), c.matchedPatterns());
    }

    @Test
    @DisplayName("long message without signal → factual at 0, not confident")
    void noSignal() {
        IntentClassifier.Classification c =
            IntentClassifier.classify("purple elephants dancing quietly under moonlight");
        assertEquals(IntentClass.FACTUAL, c.intentClass());
        assertEquals(0.0, c.confidence(), 1e-9);
        assertFalse(c.isConfident());
    }

    @Test
    @DisplayName("normalize() lower-cases, trims trailing punctuation and collapses spaces")
    void normalize() {
        assertEquals("hello there", IntentClassifier.normalize("  Hello    there!!  "));
    }

    @Test
    @DisplayName("keywords match on word boundaries only")
    void wordBoundary() {
        assertTrue(IntentClassifier.hasKeyword("i said hi to her", List.of("hi")));
        assertFalse(IntentClassifier.hasKeyword("this is high", List.of("hi")));
    }
}
