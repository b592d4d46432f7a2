package com.reliefx.orchestrator.pipeline;

import java.util.List;

/**
 * Malformed intake input. Rejected synchronously; nothing is written.
 */
public class ValidationException extends RuntimeException {

    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super("Invalid rescue request: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() { return violations; }
}
