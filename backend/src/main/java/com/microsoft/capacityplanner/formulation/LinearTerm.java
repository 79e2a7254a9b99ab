package com.microsoft.capacityplanner.formulation;

import java.util.Objects;

/**
 * One {@code coefficient * variable} product of a linear expression.
 */
public record LinearTerm(double coefficient, VariableKey variable) {

    public LinearTerm {
        Objects.requireNonNull(variable, "variable");
        if (!Double.isFinite(coefficient)) {
            throw new IllegalArgumentException("Coefficient of " + variable + " is not finite: " + coefficient);
        }
    }
}
