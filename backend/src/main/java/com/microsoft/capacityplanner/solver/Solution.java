package com.microsoft.capacityplanner.solver;

import com.microsoft.capacityplanner.formulation.VariableKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Flat result returned by a {@link SolverAdapter}.
 *
 * Objective value and assignment are present only for {@link SolutionStatus#OPTIMAL}.
 * When several assignments share the optimal objective, which one is returned
 * depends on the solver.
 *
 * @param status Outcome of the run
 * @param objectiveValue Objective at the returned assignment, or {@code null}
 * @param assignment Value per variable, or {@code null}
 * @param message Diagnostic text, never {@code null}
 */
public record Solution(
        SolutionStatus status,
        Double objectiveValue,
        Map<VariableKey, Double> assignment,
        String message
) {
    public Solution {
        Objects.requireNonNull(status, "status");
        if (status == SolutionStatus.OPTIMAL && (objectiveValue == null || assignment == null)) {
            throw new IllegalArgumentException("An optimal solution needs an objective value and an assignment");
        }
        if (status != SolutionStatus.OPTIMAL && (objectiveValue != null || assignment != null)) {
            throw new IllegalArgumentException("Only an optimal solution carries values, got " + status);
        }
        assignment = assignment == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(assignment));
        message = message == null ? "" : message;
    }

    public static Solution optimal(double objectiveValue, Map<VariableKey, Double> assignment) {
        return new Solution(SolutionStatus.OPTIMAL, objectiveValue, assignment, "Optimal solution found");
    }

    public static Solution infeasible(String message) {
        return new Solution(SolutionStatus.INFEASIBLE, null, null, message);
    }

    public static Solution unbounded(String message) {
        return new Solution(SolutionStatus.UNBOUNDED, null, null, message);
    }

    public static Solution error(String message) {
        return new Solution(SolutionStatus.ERROR, null, null, message);
    }

    public boolean isOptimal() {
        return status == SolutionStatus.OPTIMAL;
    }
}
