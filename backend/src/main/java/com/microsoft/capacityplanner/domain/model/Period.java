package com.microsoft.capacityplanner.domain.model;

/**
 * A non-overlapping time window of the planning horizon.
 *
 * @param id Identifier, unique within a schedule
 * @param demand Required capacity in instances, may be fractional
 * @param durationHours Length of the window in hours
 */
public record Period(
        String id,
        double demand,
        double durationHours
) {}
