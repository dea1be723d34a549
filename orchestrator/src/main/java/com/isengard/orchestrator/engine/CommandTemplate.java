package com.isengard.orchestrator.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns a configured launcher template such as {@code python run.py {config}}
 * into argv. The template is split on whitespace before substitution, so a
 * substituted path containing spaces stays a single argument.
 */
final class CommandTemplate {

    private CommandTemplate() {}

    static List<String> render(String template, Map<String, String> tokens) {
        if (template == null || template.isBlank()) {
            throw new IllegalArgumentException("Engine command template is blank");
        }
        List<String> argv = new ArrayList<>();
        for (String part : template.trim().split("\\s+")) {
            String arg = part;
            for (Map.Entry<String, String> t : tokens.entrySet()) {
                arg = arg.replace("{" + t.getKey() + "}", t.getValue());
            }
            argv.add(arg);
        }
        return argv;
    }
}
