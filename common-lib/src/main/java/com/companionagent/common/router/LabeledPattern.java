package com.companionagent.common.router;

import java.util.regex.Pattern;

/**
 * A case-insensitive rule pattern with a label and a weight.
 * Label-only tables use weight 1.0; scoring tables use the weight.
 */
record LabeledPattern(Pattern pattern, String label, double weight) {

    static LabeledPattern of(String regex, String label) {
        return new LabeledPattern(compile(regex), label, 1.0);
    }

    static LabeledPattern weighted(String regex, double weight) {
        return new LabeledPattern(compile(regex), null, weight);
    }

    static Pattern compile(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    boolean matches(String text) {
        return pattern.matcher(text).find();
    }

    /** First 30 characters of the expression, used as a readable match tag. */
    String sourcePrefix() {
        String source = pattern.pattern();
        return source.length() > 30 ? source.substring(0, 30) : source;
    }
}
