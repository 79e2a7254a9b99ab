package com.microsoft.capacityplanner.domain.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Decoded result of a planning run.
 *
 * Counts are copied from the solver assignment as-is. Integer solvers may
 * report values such as 12.999999999 for 13; callers that need whole
 * instance counts should round at presentation time.
 *
 * @param periods Allocation for each period, in schedule order
 * @param reservations Number of commitments to purchase per tier, in catalog order
 */
public record ProvisioningPlan(
        List<PeriodAllocation> periods,
        Map<String, Double> reservations
) {
    public ProvisioningPlan {
        periods = List.copyOf(periods);
        reservations = Collections.unmodifiableMap(new LinkedHashMap<>(reservations));
    }

    public double reservationCount(String tierId) {
        Double count = reservations.get(tierId);
        if (count == null) {
            throw new IllegalArgumentException("Unknown tier: " + tierId);
        }
        return count;
    }

    public PeriodAllocation allocation(String periodId) {
        return periods.stream()
                .filter(p -> p.periodId().equals(periodId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown period: " + periodId));
    }

    /**
     * Capacity allocated in one period.
     *
     * @param periodId Period identifier
     * @param onDemand On-demand instances running in the period
     * @param reserved Reserved instances running in the period, per tier
     */
    public record PeriodAllocation(
            String periodId,
            double onDemand,
            Map<String, Double> reserved
    ) {
        public PeriodAllocation {
            reserved = Collections.unmodifiableMap(new LinkedHashMap<>(reserved));
        }

        public double reservedTotal() {
            return reserved.values().stream().mapToDouble(Double::doubleValue).sum();
        }

        public double totalCapacity() {
            return onDemand + reservedTotal();
        }
    }
}
