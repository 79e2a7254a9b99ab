package com.microsoft.capacityplanner.config;

import com.microsoft.capacityplanner.solver.SolverAdapter;
import com.microsoft.capacityplanner.solver.SolverKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Configuration for solver adapters.
 *
 * Every {@link SolverAdapter} bean is registered by kind. The planner uses
 * {@code planner.solver.kind} unless a request names another solver.
 */
@Configuration
@Slf4j
public class SolverConfig {

    @Bean
    public Map<SolverKind, SolverAdapter> solverAdapters(List<SolverAdapter> adapters,
                                                         PlannerProperties properties) {
        Map<SolverKind, SolverAdapter> byKind = adapters.stream()
                .collect(Collectors.toMap(
                        SolverAdapter::getKind,
                        Function.identity(),
                        (first, second) -> {
                            throw new IllegalStateException("Two solver adapters for " + first.getKind());
                        },
                        () -> new EnumMap<>(SolverKind.class)
                ));

        SolverKind configured = properties.getSolver().getKind();
        if (!byKind.containsKey(configured)) {
            throw new IllegalStateException("No solver adapter registered for " + configured);
        }
        log.info("Capacity planner solvers: {}, default {} (time limit {})",
                byKind.keySet(), configured, properties.getSolver().getTimeLimit());
        return byKind;
    }
}
