package com.isengard.orchestrator.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Scrubs credentials and home-directory names from text and maps that
 * leave the server in a debug bundle.
 */
final class Redactor {

    static final String MASK = "***REDACTED***";

    private static final List<String> SENSITIVE_KEY_PARTS = List.of("token", "key", "secret", "password");

    private record Rule(Pattern pattern, String replacement) {}

    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("hf_[A-Za-z0-9]+"), "hf_" + MASK),
            new Rule(Pattern.compile("sk-[A-Za-z0-9]+"), "sk-" + MASK),
            new Rule(Pattern.compile("ghp_[A-Za-z0-9]+"), "ghp_" + MASK),
            new Rule(Pattern.compile("rpa_[A-Za-z0-9]+"), "rpa_" + MASK),
            new Rule(Pattern.compile("/Users/[^/]+/"), "/[HOME]/"),
            new Rule(Pattern.compile("/home/[^/]+/"), "/[HOME]/"),
            new Rule(Pattern.compile("(token|password|api_key)=[^&\\s]+"), "$1=***"),
            new Rule(Pattern.compile("\"(token|password|api_key)\"\\s*:\\s*\"[^\"]+\""), "\"$1\": \"***\"")
    );

    private Redactor() {}

    static String text(String input) {
        String out = input;
        for (Rule rule : RULES) {
            out = rule.pattern().matcher(out).replaceAll(rule.replacement());
        }
        return out;
    }

    /** Copy of {@code values} with every sensitive-looking key masked, recursively. */
    static Map<String, Object> map(Map<String, ?> values) {
        Map<String, Object> out = new LinkedHashMap<>();
        values.forEach((k, v) -> {
            if (isSensitive(k)) {
                out.put(k, MASK);
            } else if (v instanceof Map<?, ?> nested) {
                @SuppressWarnings("unchecked")
                Map<String, ?> typed = (Map<String, ?>) nested;
                out.put(k, map(typed));
            } else {
                out.put(k, v);
            }
        });
        return out;
    }

    static boolean isSensitive(String key) {
        String lower = key.toLowerCase(Locale.ROOT);
        return SENSITIVE_KEY_PARTS.stream().anyMatch(lower::contains);
    }
}
