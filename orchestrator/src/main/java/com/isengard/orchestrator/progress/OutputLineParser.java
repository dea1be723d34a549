package com.isengard.orchestrator.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.isengard.orchestrator.events.GpuMetrics;
import org.springframework.stereotype.Component;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns raw engine output lines into {@link EngineLine}s.
 *
 * Recognised inputs:
 *   1. JSON objects, e.g. {"step": 500, "total_steps": 1000, "loss": 0.12}
 *   2. "Step 37/200" style log lines (the pattern the web UI also reads)
 *   3. tqdm bars, e.g. "flux_lora:  37%|███▋  | 370/1000 [01:23<02:10, 4.5it/s, lr: 1e-04 loss: 4.1e-01]"
 * Anything else is TEXT.
 *
 * Stateless and thread-safe.
 */
@Component
public class OutputLineParser {

    private static final Pattern STEP_PATTERN = Pattern.compile(
            "(?i)\\bstep\\s*[:#]?\\s*(\\d+)\\s*/\\s*(\\d+)");

    private static final Pattern TQDM_PATTERN = Pattern.compile(
            "\\|\\s*(\\d+)\\s*/\\s*(\\d+)\\s*\\[");

    private static final String NUMBER = "([-+]?[0-9]*\\.?[0-9]+(?:[eE][-+]?\\d+)?)";

    private static final Pattern LOSS_PATTERN = Pattern.compile("(?i)\\bloss\\s*[:=]\\s*" + NUMBER);
    private static final Pattern LR_PATTERN   = Pattern.compile("(?i)\\blr\\s*[:=]\\s*" + NUMBER);

    private final ObjectMapper json;

    public OutputLineParser(ObjectMapper json) {
        this.json = json;
    }

    public EngineLine parse(String raw) {
        String line = raw == null ? "" : raw.strip();
        if (line.startsWith("{") && line.endsWith("}")) {
            EngineLine structured = parseStructured(raw, line);
            if (structured != null) return structured;
        }
        return parseText(raw, line);
    }

    // ------------------------------------------------------------------
    // JSON feed
    // ------------------------------------------------------------------

    private EngineLine parseStructured(String raw, String line) {
        JsonNode node;
        try {
            node = json.readTree(line);
        } catch (JsonProcessingException e) {
            return null;   // looks like JSON but isn't; treat as text
        }
        if (node == null || !node.isObject()) return null;

        Integer    step       = intField(node, "step", "current_step");
        Integer    total      = intField(node, "total_steps", "steps_total");
        Double     loss       = doubleField(node, "loss");
        Double     lr         = doubleField(node, "lr", "learning_rate");
        String     message    = textField(node, "message");
        String     sample     = textField(node, "sample_path", "preview_path");
        String     checkpoint = textField(node, "checkpoint_path");
        GpuMetrics gpu        = gpu(node.get("gpu"));

        if (step == null && loss == null && gpu == null && sample == null && checkpoint == null) {
            return EngineLine.text(raw);
        }
        return new EngineLine(EngineLine.Kind.STRUCTURED, raw, step, total, loss, lr,
                message, gpu, sample, checkpoint);
    }

    private static GpuMetrics gpu(JsonNode node) {
        if (node == null || !node.isObject()) return null;
        return new GpuMetrics(
                doubleField(node, "utilization_pct", "utilization"),
                doubleField(node, "memory_used_gb", "memory_used"),
                doubleField(node, "memory_total_gb", "memory_total"),
                doubleField(node, "temperature_c", "temperature"),
                doubleField(node, "power_watts"));
    }

    private static Integer intField(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode v = node.get(name);
            if (v != null && v.isNumber()) return v.intValue();
            if (v != null && v.isTextual() && v.asText().matches("\\d+")) return Integer.parseInt(v.asText());
        }
        return null;
    }

    private static Double doubleField(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode v = node.get(name);
            if (v != null && v.isNumber()) return v.doubleValue();
        }
        return null;
    }

    private static String textField(JsonNode node, String... names) {
        for (String name : names) {
            JsonNode v = node.get(name);
            if (v != null && v.isTextual() && !v.asText().isBlank()) return v.asText();
        }
        return null;
    }

    // ------------------------------------------------------------------
    // Free text
    // ------------------------------------------------------------------

    private static EngineLine parseText(String raw, String line) {
        Matcher m = STEP_PATTERN.matcher(line);
        if (!m.find()) {
            m = TQDM_PATTERN.matcher(line);
            if (!m.find()) return EngineLine.text(raw);
        }
        int step  = Integer.parseInt(m.group(1));
        int total = Integer.parseInt(m.group(2));
        if (total <= 0 || step > total) return EngineLine.text(raw);
        return EngineLine.logStep(raw, step, total, number(LOSS_PATTERN, line), number(LR_PATTERN, line));
    }

    private static Double number(Pattern p, String line) {
        Matcher m = p.matcher(line);
        return m.find() ? Double.valueOf(m.group(1)) : null;
    }
}
