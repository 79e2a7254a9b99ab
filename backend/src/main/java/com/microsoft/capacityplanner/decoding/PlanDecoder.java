package com.microsoft.capacityplanner.decoding;

import com.microsoft.capacityplanner.domain.model.ProvisioningPlan;
import com.microsoft.capacityplanner.formulation.PlanLayout;
import com.microsoft.capacityplanner.formulation.VariableKey;
import com.microsoft.capacityplanner.solver.Solution;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relabels a flat solver assignment into a {@link ProvisioningPlan}.
 *
 * Keys are re-created from the {@link PlanLayout} through the same
 * {@link VariableKey} factories the model builder used. Values are copied
 * unchanged. Extra variables in the assignment are ignored.
 */
@Component
public class PlanDecoder {

    public ProvisioningPlan decode(PlanLayout layout, Solution solution) {
        if (!solution.isOptimal()) {
            throw new PlanDecodeException("Cannot decode a " + solution.status() + " solution: " + solution.message());
        }
        Map<VariableKey, Double> assignment = solution.assignment();

        List<ProvisioningPlan.PeriodAllocation> periods = new ArrayList<>();
        for (String periodId : layout.periodIds()) {
            Map<String, Double> reserved = new LinkedHashMap<>();
            for (String tierId : layout.tierIds()) {
                reserved.put(tierId, valueOf(assignment, VariableKey.reserved(tierId, periodId)));
            }
            periods.add(new ProvisioningPlan.PeriodAllocation(
                    periodId,
                    valueOf(assignment, VariableKey.onDemand(periodId)),
                    reserved
            ));
        }

        Map<String, Double> reservations = new LinkedHashMap<>();
        for (String tierId : layout.tierIds()) {
            reservations.put(tierId, valueOf(assignment, VariableKey.reservation(tierId)));
        }

        return new ProvisioningPlan(periods, reservations);
    }

    private static double valueOf(Map<VariableKey, Double> assignment, VariableKey key) {
        Double value = assignment.get(key);
        if (value == null) {
            throw new PlanDecodeException("Solution has no value for " + key);
        }
        return value;
    }
}
