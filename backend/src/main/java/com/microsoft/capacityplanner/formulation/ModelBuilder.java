package com.microsoft.capacityplanner.formulation;

import com.microsoft.capacityplanner.domain.model.DemandSchedule;
import com.microsoft.capacityplanner.domain.model.Period;
import com.microsoft.capacityplanner.domain.model.PricingCatalog;
import com.microsoft.capacityplanner.domain.model.PricingTier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Translates a demand schedule and a pricing catalog into an integer program.
 *
 * FORMULATION:
 * <pre>
 * minimize   sum_k amortized[k] * reservation[k]
 *          + sum_k,p hourly[k] * duration[p] * reserved[k,p]
 *          + sum_p onDemandRate * duration[p] * onDemand[p]
 *
 * subject to onDemand[p] + sum_k reserved[k,p] >= demand[p]     for every p
 *            reservation[k] - reserved[k,p]    >= 0             for every k, p
 *            all variables non-negative integers
 * </pre>
 * where {@code amortized[k] = annualFixedCost[k] * horizonDays / 365}.
 *
 * A reservation is a pool reused by every period, so the reservation
 * constraint is checked per period instead of summing usage over periods.
 *
 * UPPER BOUNDS:
 * Costs are non-negative, so no optimal plan needs more instances in a period
 * than {@code ceil(demand[p])}, nor more reservations than the peak. These
 * bounds are declared on the domains for solvers that search finite domains.
 *
 * The builder is stateless and thread-safe.
 */
@Component
@Slf4j
public class ModelBuilder {

    static final double DAYS_PER_YEAR = 365.0;

    public PlanningModel build(DemandSchedule schedule, PricingCatalog catalog) {
        validate(schedule, catalog);

        List<Period> periods = schedule.periods();
        List<PricingTier> tiers = catalog.tiers();
        double horizonHours = schedule.horizonDays() * 24.0;
        if (schedule.totalHours() > horizonHours + 1e-9) {
            log.warn("Periods cover {} hours but the horizon is only {} hours; periods may overlap",
                    schedule.totalHours(), horizonHours);
        }

        var builder = PlanningModel.builder()
                .layout(new PlanLayout(
                        periods.stream().map(Period::id).toList(),
                        tiers.stream().map(PricingTier::id).toList()
                ));

        long peak = 0L;
        for (Period period : periods) {
            long bound = instanceBound(period.demand());
            peak = Math.max(peak, bound);
            builder.variable(VariableKey.onDemand(period.id()), VariableDomain.nonNegativeInteger(bound));
        }
        for (PricingTier tier : tiers) {
            for (Period period : periods) {
                builder.variable(VariableKey.reserved(tier.id(), period.id()),
                        VariableDomain.nonNegativeInteger(instanceBound(period.demand())));
            }
        }
        for (PricingTier tier : tiers) {
            builder.variable(VariableKey.reservation(tier.id()), VariableDomain.nonNegativeInteger(peak));
        }

        builder.objective(Objective.minimize(objective(schedule, catalog)));

        // Capacity
        for (Period period : periods) {
            var supply = LinearExpression.builder().plus(VariableKey.onDemand(period.id()));
            for (PricingTier tier : tiers) {
                supply.plus(VariableKey.reserved(tier.id(), period.id()));
            }
            builder.constraint(Constraint.atLeast("capacity[" + period.id() + "]", supply.build(), period.demand()));
        }

        // Reservation pool
        for (PricingTier tier : tiers) {
            for (Period period : periods) {
                var headroom = LinearExpression.builder()
                        .plus(VariableKey.reservation(tier.id()))
                        .minus(VariableKey.reserved(tier.id(), period.id()))
                        .build();
                builder.constraint(Constraint.atLeast(
                        "reservation[" + tier.id() + "," + period.id() + "]", headroom, 0.0));
            }
        }

        PlanningModel model = builder.build();
        log.debug("Built {}", model);
        return model;
    }

    /**
     * Share of a yearly commitment fee charged to one repetition of the horizon.
     */
    public static double amortizedFixedCost(PricingTier tier, double horizonDays) {
        return tier.annualFixedCost() * horizonDays / DAYS_PER_YEAR;
    }

    private LinearExpression objective(DemandSchedule schedule, PricingCatalog catalog) {
        var cost = LinearExpression.builder();
        for (PricingTier tier : catalog.tiers()) {
            cost.plus(amortizedFixedCost(tier, schedule.horizonDays()), VariableKey.reservation(tier.id()));
        }
        for (PricingTier tier : catalog.tiers()) {
            for (Period period : schedule.periods()) {
                cost.plus(tier.hourlyCost() * period.durationHours(), VariableKey.reserved(tier.id(), period.id()));
            }
        }
        for (Period period : schedule.periods()) {
            cost.plus(catalog.onDemandRate() * period.durationHours(), VariableKey.onDemand(period.id()));
        }
        return cost.build();
    }

    private static long instanceBound(double demand) {
        return (long) Math.ceil(demand);
    }

    private void validate(DemandSchedule schedule, PricingCatalog catalog) {
        List<String> violations = new ArrayList<>();

        if (schedule == null) {
            violations.add("Demand schedule is required");
        } else {
            if (!Double.isFinite(schedule.horizonDays()) || schedule.horizonDays() <= 0) {
                violations.add("Horizon length must be a positive number of days: " + schedule.horizonDays());
            }
            Set<String> periodIds = new HashSet<>();
            for (int i = 0; i < schedule.periods().size(); i++) {
                Period period = schedule.periods().get(i);
                if (period == null) {
                    violations.add("Period #" + i + " is missing");
                    continue;
                }
                String label = describe("Period", period.id(), i);
                if (period.id() == null || period.id().isBlank()) {
                    violations.add(label + " has no identifier");
                } else if (!periodIds.add(period.id())) {
                    violations.add("Duplicate period identifier: " + period.id());
                }
                if (!Double.isFinite(period.demand()) || period.demand() < 0) {
                    violations.add(label + " demand must be a non-negative number: " + period.demand());
                }
                if (!Double.isFinite(period.durationHours()) || period.durationHours() <= 0) {
                    violations.add(label + " duration must be a positive number of hours: " + period.durationHours());
                }
            }
        }

        if (catalog == null) {
            violations.add("Pricing catalog is required");
        } else {
            if (!Double.isFinite(catalog.onDemandRate()) || catalog.onDemandRate() < 0) {
                violations.add("On-demand rate must be a non-negative number: " + catalog.onDemandRate());
            }
            Set<String> tierIds = new HashSet<>();
            for (int i = 0; i < catalog.tiers().size(); i++) {
                PricingTier tier = catalog.tiers().get(i);
                if (tier == null) {
                    violations.add("Tier #" + i + " is missing");
                    continue;
                }
                String label = describe("Tier", tier.id(), i);
                if (tier.id() == null || tier.id().isBlank()) {
                    violations.add(label + " has no identifier");
                } else if (!tierIds.add(tier.id())) {
                    violations.add("Duplicate tier identifier: " + tier.id());
                }
                if (!Double.isFinite(tier.annualFixedCost()) || tier.annualFixedCost() < 0) {
                    violations.add(label + " fixed cost must be a non-negative number: " + tier.annualFixedCost());
                }
                if (!Double.isFinite(tier.hourlyCost()) || tier.hourlyCost() < 0) {
                    violations.add(label + " hourly cost must be a non-negative number: " + tier.hourlyCost());
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new InvalidPlanningInputException(violations);
        }
    }

    private static String describe(String what, String id, int index) {
        return id == null || id.isBlank() ? what + " #" + index : what + " '" + id + "'";
    }
}
