package com.microsoft.capacityplanner.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pricing options available to a planning request.
 *
 * The on-demand rate is always available and needs no commitment.
 * The tier list may be empty, in which case only on-demand capacity is planned.
 */
public record PricingCatalog(
        double onDemandRate,
        List<PricingTier> tiers
) {
    public PricingCatalog {
        tiers = tiers == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(tiers));
    }

    public static PricingCatalog onDemandOnly(double onDemandRate) {
        return new PricingCatalog(onDemandRate, List.of());
    }
}
