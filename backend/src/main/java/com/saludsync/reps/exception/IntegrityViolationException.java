package com.saludsync.reps.exception;

import java.util.List;

/** Post-merge check failed; the run must be rolled back. */
public class IntegrityViolationException extends RuntimeException {

    private final List<String> violations;

    public IntegrityViolationException(List<String> violations) {
        super("Integrity check failed: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() { return violations; }
}
