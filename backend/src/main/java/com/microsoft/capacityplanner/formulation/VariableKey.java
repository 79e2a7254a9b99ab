package com.microsoft.capacityplanner.formulation;

import java.util.Objects;

/**
 * Structured identifier of a model variable.
 *
 * KEY SCHEME:
 * Both the model builder and the plan decoder create keys only through the
 * factory methods below, so they agree on identity by construction.
 * Equality is structural; keys are never rendered to text and parsed back.
 *
 * <ul>
 *   <li>{@link #onDemand(String)}: period only</li>
 *   <li>{@link #reserved(String, String)}: tier and period</li>
 *   <li>{@link #reservation(String)}: tier only</li>
 * </ul>
 */
public record VariableKey(
        VariableKind kind,
        String tierId,
        String periodId
) {
    public VariableKey {
        Objects.requireNonNull(kind, "kind");
        switch (kind) {
            case ON_DEMAND -> {
                requirePresent(periodId, "periodId", kind);
                requireAbsent(tierId, "tierId", kind);
            }
            case RESERVED -> {
                requirePresent(tierId, "tierId", kind);
                requirePresent(periodId, "periodId", kind);
            }
            case RESERVATION -> {
                requirePresent(tierId, "tierId", kind);
                requireAbsent(periodId, "periodId", kind);
            }
        }
    }

    public static VariableKey onDemand(String periodId) {
        return new VariableKey(VariableKind.ON_DEMAND, null, periodId);
    }

    public static VariableKey reserved(String tierId, String periodId) {
        return new VariableKey(VariableKind.RESERVED, tierId, periodId);
    }

    public static VariableKey reservation(String tierId) {
        return new VariableKey(VariableKind.RESERVATION, tierId, null);
    }

    /**
     * Label for logs and solver-side variable names. Not an identifier.
     */
    @Override
    public String toString() {
        return switch (kind) {
            case ON_DEMAND -> "onDemand[" + periodId + "]";
            case RESERVED -> "reserved[" + tierId + "," + periodId + "]";
            case RESERVATION -> "reservation[" + tierId + "]";
        };
    }

    private static void requirePresent(String value, String name, VariableKind kind) {
        if (value == null) {
            throw new IllegalArgumentException(name + " is required for " + kind);
        }
    }

    private static void requireAbsent(String value, String name, VariableKind kind) {
        if (value != null) {
            throw new IllegalArgumentException(name + " must be null for " + kind);
        }
    }
}
