package com.microsoft.capacityplanner.service;

/**
 * Outcome of a planning request as seen by callers.
 */
public enum PlanningStatus {
    OPTIMAL("Optimal plan found"),
    INFEASIBLE("No plan meets the demand"),
    UNBOUNDED("Cost has no finite minimum"),
    SOLVER_ERROR("Solver failed or timed out"),
    INVALID_INPUT("Schedule or catalog is malformed");

    private final String displayName;

    PlanningStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
