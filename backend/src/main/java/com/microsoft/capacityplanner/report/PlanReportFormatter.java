package com.microsoft.capacityplanner.report;

import com.microsoft.capacityplanner.domain.model.ProvisioningPlan;
import com.microsoft.capacityplanner.service.PlanningResult;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Map;

/**
 * Renders a planning result as a plain-text report.
 *
 * Counts are shown rounded to whole instances; the total cost keeps the
 * value reported by the solver. The layout is for people, not for parsing.
 */
@Component
public class PlanReportFormatter {

    public String format(PlanningResult result) {
        StringBuilder out = new StringBuilder();
        out.append("Status: ").append(result.status()).append(" (").append(result.message()).append(")\n");
        if (result.solver() != null) {
            out.append("Solver: ").append(result.solver().getDisplayName()).append('\n');
        }
        result.violations().forEach(v -> out.append("  - ").append(v).append('\n'));

        ProvisioningPlan plan = result.plan();
        if (plan == null) {
            return out.toString();
        }

        out.append(String.format(Locale.ROOT, "Total cost: %.2f\n", result.totalCost()));
        out.append("Reservations:\n");
        if (plan.reservations().isEmpty()) {
            out.append("  (none offered)\n");
        }
        plan.reservations().forEach((tier, count) ->
                out.append(String.format(Locale.ROOT, "  %-16s %6d\n", tier, instances(count))));

        out.append("Periods:\n");
        for (ProvisioningPlan.PeriodAllocation period : plan.periods()) {
            out.append(String.format(Locale.ROOT, "  %s: on-demand %d", period.periodId(),
                    instances(period.onDemand())));
            for (Map.Entry<String, Double> reserved : period.reserved().entrySet()) {
                out.append(String.format(Locale.ROOT, ", %s %d", reserved.getKey(), instances(reserved.getValue())));
            }
            out.append('\n');
        }
        return out.toString();
    }

    private static long instances(double count) {
        return Math.round(count);
    }
}
