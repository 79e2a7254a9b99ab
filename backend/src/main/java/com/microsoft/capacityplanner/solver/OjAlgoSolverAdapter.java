package com.microsoft.capacityplanner.solver;

import com.microsoft.capacityplanner.config.PlannerProperties;
import com.microsoft.capacityplanner.formulation.Constraint;
import com.microsoft.capacityplanner.formulation.PlanningModel;
import com.microsoft.capacityplanner.formulation.VariableDomain;
import com.microsoft.capacityplanner.formulation.VariableKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.ojalgo.optimisation.Expression;
import org.ojalgo.optimisation.ExpressionsBasedModel;
import org.ojalgo.optimisation.Optimisation;
import org.ojalgo.optimisation.Variable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntToDoubleFunction;

/**
 * Solver adapter backed by the ojAlgo mixed-integer solver.
 *
 * Variables and constraints are registered under positional names
 * ({@code x0, x1, ...} and {@code c0, c1, ...}); the adapter keeps the
 * mapping back to {@link VariableKey} itself.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OjAlgoSolverAdapter implements SolverAdapter {

    private static final double FEASIBILITY_TOLERANCE = 1e-9;

    private final PlannerProperties properties;

    @Override
    public SolverKind getKind() {
        return SolverKind.OJALGO;
    }

    @Override
    public Solution solve(PlanningModel planningModel) {
        if (planningModel.getVariables().isEmpty()) {
            return Solution.optimal(0.0, Map.of());
        }
        if (allFixed(planningModel)) {
            return solveFixed(planningModel);
        }

        var model = new ExpressionsBasedModel();
        long timeLimitMs = properties.getSolver().getTimeLimit().toMillis();
        if (timeLimitMs > 0) {
            model.options.time_abort = timeLimitMs;
        }

        Map<VariableKey, Double> weights = planningModel.getObjective().expression().coefficients();
        List<VariableKey> keys = new ArrayList<>(planningModel.getVariableKeys());
        Map<VariableKey, Variable> variables = new HashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            VariableKey key = keys.get(i);
            VariableDomain domain = planningModel.getVariables().get(key);
            Variable variable = model.addVariable("x" + i)
                    .lower(domain.lowerBound())
                    .integer(domain.integer());
            domain.upper().ifPresent(upper -> variable.upper(upper));
            Double weight = weights.get(key);
            if (weight != null && weight != 0.0) {
                variable.weight(weight);
            }
            variables.put(key, variable);
        }

        List<Constraint> constraints = planningModel.getConstraints();
        for (int i = 0; i < constraints.size(); i++) {
            Constraint constraint = constraints.get(i);
            Expression expression = model.addExpression("c" + i);
            constraint.expression().coefficients()
                    .forEach((key, coefficient) -> expression.set(variables.get(key), coefficient));
            switch (constraint.relation()) {
                case GREATER_OR_EQUAL -> expression.lower(constraint.bound());
            }
        }

        Optimisation.Result result;
        try {
            result = model.minimise();
        } catch (RuntimeException e) {
            log.error("ojAlgo failed on {}", planningModel, e);
            return Solution.error("ojAlgo failure: " + e.getMessage());
        }

        log.debug("ojAlgo finished in state {} for {}", result.getState(), planningModel);
        return interpret(planningModel, keys, result.getState(), result::doubleValue);
    }

    /**
     * Translates the final ojAlgo state; {@code values} reads the i-th positional variable.
     */
    Solution interpret(PlanningModel planningModel, List<VariableKey> keys,
                       Optimisation.State state, IntToDoubleFunction values) {
        if (state.isOptimal()) {
            Map<VariableKey, Double> assignment = new LinkedHashMap<>();
            for (int i = 0; i < keys.size(); i++) {
                assignment.put(keys.get(i), values.applyAsDouble(i));
            }
            return Solution.optimal(planningModel.evaluateObjective(assignment), assignment);
        }
        if (state == Optimisation.State.INFEASIBLE) {
            return Solution.infeasible("ojAlgo found no feasible assignment");
        }
        if (state == Optimisation.State.UNBOUNDED) {
            return Solution.unbounded("ojAlgo reports an unbounded objective");
        }
        if (state.isFeasible()) {
            return Solution.error("ojAlgo stopped before proving optimality (state " + state
                    + ", time limit " + properties.getSolver().getTimeLimit() + ")");
        }
        return Solution.error("ojAlgo ended in state " + state);
    }

    private static boolean allFixed(PlanningModel planningModel) {
        return planningModel.getVariables().values().stream()
                .allMatch(domain -> domain.upper().isPresent() && domain.upper().getAsLong() == domain.lowerBound());
    }

    /**
     * Every domain holds a single value, so there is exactly one candidate assignment.
     */
    private static Solution solveFixed(PlanningModel planningModel) {
        Map<VariableKey, Double> assignment = new LinkedHashMap<>();
        planningModel.getVariables().forEach((key, domain) -> assignment.put(key, (double) domain.lowerBound()));
        if (!planningModel.violatedConstraints(assignment, FEASIBILITY_TOLERANCE).isEmpty()) {
            return Solution.infeasible("Fixed variables violate the constraints");
        }
        return Solution.optimal(planningModel.evaluateObjective(assignment), assignment);
    }
}
