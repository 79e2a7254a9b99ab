package com.microsoft.capacityplanner.service;

import com.microsoft.capacityplanner.config.PlannerProperties;
import com.microsoft.capacityplanner.decoding.PlanDecoder;
import com.microsoft.capacityplanner.domain.model.DemandSchedule;
import com.microsoft.capacityplanner.domain.model.PricingCatalog;
import com.microsoft.capacityplanner.domain.model.ProvisioningPlan;
import com.microsoft.capacityplanner.formulation.InvalidPlanningInputException;
import com.microsoft.capacityplanner.formulation.ModelBuilder;
import com.microsoft.capacityplanner.formulation.PlanningModel;
import com.microsoft.capacityplanner.solver.Solution;
import com.microsoft.capacityplanner.solver.SolverAdapter;
import com.microsoft.capacityplanner.solver.SolverKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Plans reserved and on-demand capacity for a demand schedule.
 *
 * PIPELINE:
 * 1. Build the integer program (rejects malformed input)
 * 2. Solve it with the selected solver adapter (blocking, time limited)
 * 3. Decode the assignment into a provisioning plan
 *
 * Every expected outcome comes back as a {@link PlanningResult} status so
 * callers can tell bad input from an infeasible model from a solver failure.
 * Nothing is retried. A decode failure is a bug and propagates.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CapacityPlanningService {

    private final ModelBuilder modelBuilder;
    private final PlanDecoder planDecoder;
    private final Map<SolverKind, SolverAdapter> solverAdapters;
    private final PlannerProperties properties;

    /**
     * Plan against the configured default catalog.
     */
    public PlanningResult plan(DemandSchedule schedule) {
        return plan(schedule, defaultCatalog());
    }

    public PlanningResult plan(DemandSchedule schedule, PricingCatalog catalog) {
        return plan(schedule, catalog, properties.getSolver().getKind());
    }

    public PlanningResult plan(DemandSchedule schedule, PricingCatalog catalog, SolverKind solverKind) {
        SolverAdapter solver = solverAdapters.get(solverKind);
        if (solver == null) {
            return PlanningResult.failed(PlanningStatus.SOLVER_ERROR, solverKind,
                    "Solver not available: " + solverKind);
        }

        PlanningModel model;
        try {
            model = modelBuilder.build(schedule, catalog);
        } catch (InvalidPlanningInputException e) {
            log.warn("Rejected planning input: {}", e.getViolations());
            return PlanningResult.invalidInput(e.getViolations());
        }

        log.info("Solving {} with {}", model, solverKind);
        long started = System.nanoTime();
        Solution solution = solver.solve(model);
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        return switch (solution.status()) {
            case OPTIMAL -> {
                ProvisioningPlan plan = planDecoder.decode(model.getLayout(), solution);
                log.info("Optimal plan found in {} ms: cost={}, reservations={}",
                        elapsedMs, solution.objectiveValue(), plan.reservations());
                yield PlanningResult.optimal(solution.objectiveValue(), plan, solverKind);
            }
            case INFEASIBLE -> {
                // The on-demand option always covers non-negative demand
                log.warn("Model reported infeasible for {}; check the formulation: {}", model, solution.message());
                yield PlanningResult.failed(PlanningStatus.INFEASIBLE, solverKind, solution.message());
            }
            case UNBOUNDED -> {
                log.error("Model reported unbounded for {} although every cost is non-negative: {}",
                        model, solution.message());
                yield PlanningResult.failed(PlanningStatus.UNBOUNDED, solverKind, solution.message());
            }
            case ERROR -> {
                log.warn("Solver {} failed after {} ms: {}", solverKind, elapsedMs, solution.message());
                yield PlanningResult.failed(PlanningStatus.SOLVER_ERROR, solverKind, solution.message());
            }
        };
    }

    public PricingCatalog defaultCatalog() {
        return properties.getCatalog().toCatalog();
    }

    public double defaultHorizonDays() {
        return properties.getHorizonDays();
    }
}
