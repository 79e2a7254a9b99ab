package com.microsoft.capacityplanner.formulation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable integer program for one planning request.
 *
 * Holds the variable domains (in declaration order), the objective, the
 * constraints and the {@link PlanLayout} the decoder needs. Solvers only read
 * domains, objective and constraints.
 *
 * Instances are created through {@link Builder}, which checks that every
 * variable is declared once and that expressions only reference declared
 * variables. A built model may be handed to another thread without copying.
 */
public final class PlanningModel {

    private final Map<VariableKey, VariableDomain> variables;
    private final Objective objective;
    private final List<Constraint> constraints;
    private final PlanLayout layout;

    private PlanningModel(Builder builder) {
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(builder.variables));
        this.objective = builder.objective;
        this.constraints = List.copyOf(builder.constraints);
        this.layout = builder.layout;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<VariableKey, VariableDomain> getVariables() {
        return variables;
    }

    public Set<VariableKey> getVariableKeys() {
        return variables.keySet();
    }

    public Objective getObjective() {
        return objective;
    }

    public List<Constraint> getConstraints() {
        return constraints;
    }

    public PlanLayout getLayout() {
        return layout;
    }

    /**
     * Objective value of an assignment. Missing variables count as zero.
     */
    public double evaluateObjective(Map<VariableKey, Double> assignment) {
        return objective.expression().evaluate(key -> assignment.getOrDefault(key, 0.0));
    }

    /**
     * Constraints violated by an assignment beyond the given tolerance.
     */
    public List<Constraint> violatedConstraints(Map<VariableKey, Double> assignment, double tolerance) {
        List<Constraint> violated = new ArrayList<>();
        for (Constraint constraint : constraints) {
            double value = constraint.expression().evaluate(key -> assignment.getOrDefault(key, 0.0));
            if (!constraint.relation().isSatisfied(value, constraint.bound(), tolerance)) {
                violated.add(constraint);
            }
        }
        return violated;
    }

    @Override
    public String toString() {
        return "PlanningModel{variables=" + variables.size()
                + ", constraints=" + constraints.size()
                + ", periods=" + layout.periodIds().size()
                + ", tiers=" + layout.tierIds().size() + "}";
    }

    /**
     * Accumulates variables and constraints into plain lists, then yields
     * an immutable {@link PlanningModel}. Not thread-safe; use one per build.
     */
    public static final class Builder {
        private final Map<VariableKey, VariableDomain> variables = new LinkedHashMap<>();
        private final List<Constraint> constraints = new ArrayList<>();
        private Objective objective;
        private PlanLayout layout;

        private Builder() {
        }

        public Builder variable(VariableKey key, VariableDomain domain) {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(domain, "domain");
            if (variables.putIfAbsent(key, domain) != null) {
                throw new IllegalStateException("Variable declared twice: " + key);
            }
            return this;
        }

        public Builder constraint(Constraint constraint) {
            Objects.requireNonNull(constraint, "constraint");
            requireDeclared(constraint.expression(), "constraint " + constraint.name());
            constraints.add(constraint);
            return this;
        }

        public Builder objective(Objective objective) {
            Objects.requireNonNull(objective, "objective");
            requireDeclared(objective.expression(), "objective");
            this.objective = objective;
            return this;
        }

        public Builder layout(PlanLayout layout) {
            this.layout = Objects.requireNonNull(layout, "layout");
            return this;
        }

        public PlanningModel build() {
            if (objective == null) {
                throw new IllegalStateException("Objective not set");
            }
            if (layout == null) {
                throw new IllegalStateException("Layout not set");
            }
            return new PlanningModel(this);
        }

        private void requireDeclared(LinearExpression expression, String owner) {
            for (LinearTerm term : expression.terms()) {
                if (!variables.containsKey(term.variable())) {
                    throw new IllegalStateException("Undeclared variable " + term.variable() + " in " + owner);
                }
            }
        }
    }
}
