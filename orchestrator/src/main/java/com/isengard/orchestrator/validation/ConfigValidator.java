package com.isengard.orchestrator.validation;

import com.isengard.orchestrator.model.JobConfig;
import com.isengard.orchestrator.model.JobKind;
import com.isengard.orchestrator.validation.ValidationException.Violation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks a submitted config against the engine's capability metadata and
 * produces the immutable snapshot the job will carry.
 *
 * Rules:
 *   - unknown keys pass through untouched (forward compatibility);
 *   - unwired parameters are rejected (booleans only when set to true);
 *   - numbers must be in range, enum values must be one of the options;
 *   - missing parameters take the catalog default.
 * All violations are collected, not just the first.
 */
@Component
public class ConfigValidator {

    private final CapabilityCatalog catalog;

    public ConfigValidator(CapabilityCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * @return the submitted config merged over the defaults
     * @throws ValidationException if any parameter is unsupported or out of range
     */
    public JobConfig validate(JobKind kind, Map<String, Object> submitted) {
        if (kind == null) {
            throw new ValidationException("kind", "Job kind is required (training or generation)");
        }
        Map<String, Object> input = submitted == null ? Map.of() : submitted;
        EngineCapabilities caps = catalog.forKind(kind);
        List<Violation> violations = new ArrayList<>();

        for (ParameterSpec spec : caps.parameters()) {
            Object value = input.get(spec.name());
            if (value == null) {
                if (spec.required()) {
                    violations.add(new Violation(spec.name(), "Parameter '" + spec.name() + "' is required"));
                }
                continue;
            }
            if (!spec.wired()) {
                if (spec.type() != ParameterSpec.Type.BOOL || Boolean.TRUE.equals(value)) {
                    violations.add(new Violation(spec.name(), "Parameter '" + spec.name()
                            + "' not supported by " + caps.backend() + ": " + spec.reason()));
                }
                continue;
            }
            String problem = checkValue(spec, value);
            if (problem != null) violations.add(new Violation(spec.name(), problem));
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }

        Map<String, Object> merged = new LinkedHashMap<>();
        for (ParameterSpec spec : caps.parameters()) {
            if (spec.wired() && spec.defaultValue() != null) merged.put(spec.name(), spec.defaultValue());
        }
        merged.putAll(input);
        return new JobConfig(merged);
    }

    private static String checkValue(ParameterSpec spec, Object value) {
        String key = spec.name();
        return switch (spec.type()) {
            case INT -> {
                if (!(value instanceof Number n) || n.doubleValue() != Math.rint(n.doubleValue())) {
                    yield "Parameter '" + key + "' must be an integer";
                }
                yield range(key, n.doubleValue(), spec);
            }
            case FLOAT -> {
                if (!(value instanceof Number n)) yield "Parameter '" + key + "' must be a number";
                yield range(key, n.doubleValue(), spec);
            }
            case ENUM -> {
                String v = String.valueOf(value);
                boolean ok = spec.options().stream().anyMatch(o -> String.valueOf(o).equals(v));
                yield ok ? null
                        : "Parameter '" + key + "' value '" + v + "' not in allowed options: " + spec.options();
            }
            case BOOL -> value instanceof Boolean ? null : "Parameter '" + key + "' must be a boolean";
            case STRING -> {
                if (!(value instanceof String s)) yield "Parameter '" + key + "' must be a string";
                if (spec.required() && s.isBlank()) yield "Parameter '" + key + "' must not be blank";
                if (spec.max() != null && s.length() > spec.max().intValue()) {
                    yield "Parameter '" + key + "' is longer than " + spec.max() + " characters";
                }
                yield null;
            }
        };
    }

    private static String range(String key, double v, ParameterSpec spec) {
        if (spec.min() != null && v < spec.min().doubleValue()) {
            return "Parameter '" + key + "' value " + v + " is below minimum " + spec.min();
        }
        if (spec.max() != null && v > spec.max().doubleValue()) {
            return "Parameter '" + key + "' value " + v + " is above maximum " + spec.max();
        }
        return null;
    }
}
