package com.microsoft.capacityplanner.formulation;

import java.util.List;

/**
 * Raised when a demand schedule or pricing catalog is malformed.
 * Always recoverable by fixing the input; no model is built.
 */
public class InvalidPlanningInputException extends RuntimeException {

    private final List<String> violations;

    public InvalidPlanningInputException(List<String> violations) {
        super("Invalid planning input: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
