package com.microsoft.capacityplanner.solver;

/**
 * Solver implementations that can back {@link SolverAdapter}.
 */
public enum SolverKind {
    OJALGO("ojAlgo mixed-integer solver");

    private final String displayName;

    SolverKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
