package com.microsoft.capacityplanner.formulation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Sum of linear terms. Term order carries no meaning.
 */
public record LinearExpression(List<LinearTerm> terms) {

    public LinearExpression {
        terms = List.copyOf(terms);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Coefficients summed per variable, in first-occurrence order.
     */
    public Map<VariableKey, Double> coefficients() {
        Map<VariableKey, Double> merged = new LinkedHashMap<>();
        for (LinearTerm term : terms) {
            merged.merge(term.variable(), term.coefficient(), Double::sum);
        }
        return merged;
    }

    public double evaluate(ToDoubleFunction<VariableKey> values) {
        double total = 0.0;
        for (LinearTerm term : terms) {
            total += term.coefficient() * values.applyAsDouble(term.variable());
        }
        return total;
    }

    public static final class Builder {
        private final List<LinearTerm> terms = new ArrayList<>();

        private Builder() {
        }

        public Builder plus(double coefficient, VariableKey variable) {
            terms.add(new LinearTerm(coefficient, variable));
            return this;
        }

        public Builder plus(VariableKey variable) {
            return plus(1.0, variable);
        }

        public Builder minus(VariableKey variable) {
            return plus(-1.0, variable);
        }

        public LinearExpression build() {
            return new LinearExpression(terms);
        }
    }
}
