package com.microsoft.capacityplanner.formulation;

import java.util.OptionalLong;

/**
 * Domain of a model variable: a non-negative integer, optionally bounded above.
 *
 * @param upperBound Inclusive upper bound, or {@code null} when unbounded
 */
public record VariableDomain(Long upperBound) {

    public VariableDomain {
        if (upperBound != null && upperBound < 0) {
            throw new IllegalArgumentException("Upper bound must be non-negative: " + upperBound);
        }
    }

    public static VariableDomain nonNegativeInteger() {
        return new VariableDomain(null);
    }

    public static VariableDomain nonNegativeInteger(long upperBound) {
        return new VariableDomain(upperBound);
    }

    public long lowerBound() {
        return 0L;
    }

    public boolean integer() {
        return true;
    }

    public OptionalLong upper() {
        return upperBound == null ? OptionalLong.empty() : OptionalLong.of(upperBound);
    }
}
