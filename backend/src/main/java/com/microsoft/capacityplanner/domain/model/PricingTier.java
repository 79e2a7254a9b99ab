package com.microsoft.capacityplanner.domain.model;

/**
 * A prepaid commitment tier (reserved instance offering).
 *
 * The fixed cost is paid per reserved instance per year whether or not
 * the instance runs; the hourly cost is paid only while it runs.
 */
public record PricingTier(
        String id,
        double annualFixedCost,
        double hourlyCost
) {}
