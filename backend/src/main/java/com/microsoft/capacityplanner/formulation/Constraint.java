package com.microsoft.capacityplanner.formulation;

import java.util.Objects;

/**
 * A named linear inequality {@code expression relation bound}.
 */
public record Constraint(
        String name,
        LinearExpression expression,
        Relation relation,
        double bound
) {
    public Constraint {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(relation, "relation");
        if (!Double.isFinite(bound)) {
            throw new IllegalArgumentException("Bound of constraint " + name + " is not finite: " + bound);
        }
    }

    public static Constraint atLeast(String name, LinearExpression expression, double bound) {
        return new Constraint(name, expression, Relation.GREATER_OR_EQUAL, bound);
    }
}
