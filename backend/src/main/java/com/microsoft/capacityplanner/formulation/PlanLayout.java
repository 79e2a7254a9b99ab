package com.microsoft.capacityplanner.formulation;

import java.util.ArrayList;
import java.util.List;

/**
 * Periods and tiers a model was built over, in declaration order.
 *
 * Together with the {@link VariableKey} factories this is the naming scheme
 * shared by {@link ModelBuilder} and the plan decoder: every key the model
 * declares can be re-created from the layout.
 */
public record PlanLayout(
        List<String> periodIds,
        List<String> tierIds
) {
    public PlanLayout {
        periodIds = List.copyOf(periodIds);
        tierIds = List.copyOf(tierIds);
    }

    public List<VariableKey> expectedKeys() {
        List<VariableKey> keys = new ArrayList<>();
        periodIds.forEach(p -> keys.add(VariableKey.onDemand(p)));
        for (String tier : tierIds) {
            periodIds.forEach(p -> keys.add(VariableKey.reserved(tier, p)));
        }
        tierIds.forEach(t -> keys.add(VariableKey.reservation(t)));
        return keys;
    }
}
