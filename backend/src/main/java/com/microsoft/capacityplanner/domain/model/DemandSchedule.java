package com.microsoft.capacityplanner.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Capacity demand over one repetition of the planning horizon.
 *
 * HORIZON:
 * The periods partition a horizon of {@code horizonDays} days that repeats
 * for the whole commitment term. Annual commitment costs are amortized
 * over that horizon, so a one-day horizon carries 1/365 of the yearly fee.
 */
public record DemandSchedule(
        List<Period> periods,
        double horizonDays
) {
    public static final double DEFAULT_HORIZON_DAYS = 1.0;

    public DemandSchedule {
        periods = periods == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(periods));
    }

    public DemandSchedule(List<Period> periods) {
        this(periods, DEFAULT_HORIZON_DAYS);
    }

    public double totalHours() {
        return periods.stream().mapToDouble(Period::durationHours).sum();
    }
}
