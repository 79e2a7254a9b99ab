package com.microsoft.capacityplanner.formulation;

import java.util.Objects;

public record Objective(OptimizationDirection direction, LinearExpression expression) {

    public Objective {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(expression, "expression");
    }

    public static Objective minimize(LinearExpression expression) {
        return new Objective(OptimizationDirection.MINIMIZE, expression);
    }
}
