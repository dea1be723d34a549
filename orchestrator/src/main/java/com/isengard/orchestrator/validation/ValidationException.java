package com.isengard.orchestrator.validation;

import java.util.List;

/**
 * A submission was rejected before it reached the store or the queue.
 */
public class ValidationException extends RuntimeException {

    public record Violation(String field, String message) {}

    private final List<Violation> violations;

    public ValidationException(List<Violation> violations) {
        super(violations.isEmpty() ? "Invalid job config"
                : violations.get(0).message()
                  + (violations.size() > 1 ? " (+" + (violations.size() - 1) + " more)" : ""));
        this.violations = List.copyOf(violations);
    }

    public ValidationException(String field, String message) {
        this(List.of(new Violation(field, message)));
    }

    public List<Violation> getViolations() { return violations; }
}
