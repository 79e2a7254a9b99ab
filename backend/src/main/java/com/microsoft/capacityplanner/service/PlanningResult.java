package com.microsoft.capacityplanner.service;

import com.microsoft.capacityplanner.domain.model.ProvisioningPlan;
import com.microsoft.capacityplanner.solver.SolverKind;

import java.util.List;

/**
 * Result of a planning request.
 *
 * Total cost and plan are present only when the status is OPTIMAL.
 * Violations are filled only for INVALID_INPUT.
 */
public record PlanningResult(
        PlanningStatus status,
        Double totalCost,
        ProvisioningPlan plan,
        SolverKind solver,
        String message,
        List<String> violations
) {
    public PlanningResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    static PlanningResult optimal(double totalCost, ProvisioningPlan plan, SolverKind solver) {
        return new PlanningResult(PlanningStatus.OPTIMAL, totalCost, plan, solver,
                PlanningStatus.OPTIMAL.getDisplayName(), List.of());
    }

    static PlanningResult failed(PlanningStatus status, SolverKind solver, String message) {
        return new PlanningResult(status, null, null, solver, message, List.of());
    }

    static PlanningResult invalidInput(List<String> violations) {
        return new PlanningResult(PlanningStatus.INVALID_INPUT, null, null, null,
                PlanningStatus.INVALID_INPUT.getDisplayName(), violations);
    }

    public boolean isSuccess() {
        return status == PlanningStatus.OPTIMAL;
    }
}
