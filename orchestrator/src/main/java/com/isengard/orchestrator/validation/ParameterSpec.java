package com.isengard.orchestrator.validation;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Locale;

/**
 * Schema of one engine parameter as advertised by GET /capabilities.
 *
 * @param wired  false when the backend does not honour the parameter; submitting it is rejected
 * @param reason why an unwired parameter is unavailable
 * @param max    for STRING, the maximum length
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ParameterSpec(
        String       name,
        Type         type,
        Number       min,
        Number       max,
        List<Object> options,
        Object       defaultValue,
        boolean      required,
        boolean      wired,
        String       reason
) {

    public enum Type {
        INT, FLOAT, ENUM, BOOL, STRING;

        @JsonValue
        public String wireName() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static ParameterSpec intRange(String name, int min, int max, Integer def) {
        return new ParameterSpec(name, Type.INT, min, max, null, def, false, true, null);
    }

    public static ParameterSpec floatRange(String name, double min, double max, Double def) {
        return new ParameterSpec(name, Type.FLOAT, min, max, null, def, false, true, null);
    }

    public static ParameterSpec oneOf(String name, List<Object> options, Object def) {
        return new ParameterSpec(name, Type.ENUM, null, null, options, def, false, true, null);
    }

    public static ParameterSpec text(String name, int maxLength, boolean required) {
        return new ParameterSpec(name, Type.STRING, null, maxLength, null, null, required, true, null);
    }

    public static ParameterSpec unwired(String name, Type type, String reason) {
        return new ParameterSpec(name, type, null, null, null, null, false, false, reason);
    }
}
