package com.microsoft.capacityplanner.formulation;

/**
 * Relation between a constraint expression and its bound.
 * Capacity planning only needs lower bounds.
 */
public enum Relation {
    GREATER_OR_EQUAL(">=");

    private final String symbol;

    Relation(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    public boolean isSatisfied(double value, double bound, double tolerance) {
        return switch (this) {
            case GREATER_OR_EQUAL -> value >= bound - tolerance;
        };
    }
}
