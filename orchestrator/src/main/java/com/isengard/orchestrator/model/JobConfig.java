package com.isengard.orchestrator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of the parameters a job was submitted with
 * (resolution, steps, learning rate, preset, prompt, ...).
 *
 * Captured once at submission, after defaults are merged in, and never
 * mutated afterwards. Stored as a JSON column (see {@link JobConfigConverter}).
 */
public final class JobConfig {

    private final Map<String, Object> values;

    public JobConfig(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static JobConfig empty() {
        return new JobConfig(Map.of());
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public boolean has(String key) {
        return values.get(key) != null;
    }

    public Object get(String key) {
        return values.get(key);
    }

    public int intValue(String key, int fallback) {
        Object v = values.get(key);
        if (v instanceof Number n) return n.intValue();
        if (v instanceof String s && !s.isBlank()) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    public double doubleValue(String key, double fallback) {
        Object v = values.get(key);
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    public String stringValue(String key, String fallback) {
        Object v = values.get(key);
        return v == null ? fallback : v.toString();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof JobConfig other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "JobConfig" + values;
    }
}
