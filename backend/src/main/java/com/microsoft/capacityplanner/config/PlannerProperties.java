package com.microsoft.capacityplanner.config;

import com.microsoft.capacityplanner.domain.model.PricingCatalog;
import com.microsoft.capacityplanner.domain.model.PricingTier;
import com.microsoft.capacityplanner.solver.SolverKind;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for capacity planning.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "planner")
public class PlannerProperties {

    /**
     * Horizon length in days used when a request does not give one.
     */
    private double horizonDays = 1.0;

    /**
     * Solver selection and limits.
     */
    private SolverSettings solver = new SolverSettings();

    /**
     * Catalog used when a request does not carry its own.
     */
    private CatalogSettings catalog = new CatalogSettings();

    @Data
    public static class SolverSettings {

        /**
         * Solver backing the planner.
         */
        private SolverKind kind = SolverKind.OJALGO;

        /**
         * Wall-clock limit of one solver run. Zero or negative disables the limit.
         */
        private Duration timeLimit = Duration.ofSeconds(30);
    }

    @Data
    public static class CatalogSettings {

        /**
         * On-demand price per instance-hour.
         */
        private double onDemandRate;

        /**
         * Commitment tiers, in display order.
         */
        private List<TierSettings> tiers = new ArrayList<>();

        public PricingCatalog toCatalog() {
            return new PricingCatalog(onDemandRate, tiers.stream()
                    .map(t -> new PricingTier(t.getId(), t.getAnnualFixedCost(), t.getHourlyCost()))
                    .toList());
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TierSettings {
        private String id;
        private double annualFixedCost;
        private double hourlyCost;
    }
}
