package com.microsoft.capacityplanner.api;

import com.microsoft.capacityplanner.domain.model.DemandSchedule;
import com.microsoft.capacityplanner.domain.model.Period;
import com.microsoft.capacityplanner.domain.model.PricingCatalog;
import com.microsoft.capacityplanner.domain.model.PricingTier;
import com.microsoft.capacityplanner.report.PlanReportFormatter;
import com.microsoft.capacityplanner.service.CapacityPlanningService;
import com.microsoft.capacityplanner.service.PlanningResult;
import com.microsoft.capacityplanner.service.PlanningStatus;
import com.microsoft.capacityplanner.solver.SolverKind;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for capacity reservation planning.
 *
 * STATUS MAPPING:
 * - OPTIMAL: 200
 * - INVALID_INPUT: 400
 * - INFEASIBLE: 422
 * - UNBOUNDED: 500 (invariant violation)
 * - SOLVER_ERROR: 503 (caller may retry)
 *
 * Numeric ranges are checked by the model builder, not by Bean Validation,
 * so every violation is reported in one response.
 */
@RestController
@RequestMapping("/api/plans")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Planning API", description = "Reserved versus on-demand capacity planning")
public class PlanningController {

    private final CapacityPlanningService planningService;
    private final PlanReportFormatter reportFormatter;

    @PostMapping
    @Operation(summary = "Plan capacity",
               description = "Computes the cheapest mix of reservations and on-demand capacity for a schedule")
    public ResponseEntity<PlanningResult> plan(@Valid @RequestBody PlanRequest request) {
        log.info("Planning request: periods={}, customCatalog={}",
                request.schedule().periods().size(), request.catalog() != null);

        PlanningResult result = execute(request);
        return ResponseEntity.status(httpStatus(result.status())).body(result);
    }

    @PostMapping(value = "/report", produces = MediaType.TEXT_PLAIN_VALUE)
    @Operation(summary = "Plan capacity as a text report")
    public ResponseEntity<String> report(@Valid @RequestBody PlanRequest request) {
        log.info("Planning report request: periods={}", request.schedule().periods().size());

        PlanningResult result = execute(request);
        return ResponseEntity.status(httpStatus(result.status()))
                .contentType(MediaType.TEXT_PLAIN)
                .body(reportFormatter.format(result));
    }

    @GetMapping("/catalog")
    @Operation(summary = "Get the default pricing catalog")
    public ResponseEntity<CatalogDto> defaultCatalog() {
        return ResponseEntity.ok(CatalogDto.from(planningService.defaultCatalog()));
    }

    private PlanningResult execute(PlanRequest request) {
        DemandSchedule schedule = request.schedule().toSchedule(planningService.defaultHorizonDays());
        PricingCatalog catalog = request.catalog() != null
                ? request.catalog().toCatalog()
                : planningService.defaultCatalog();

        if (request.solver() != null) {
            return planningService.plan(schedule, catalog, request.solver());
        }
        return planningService.plan(schedule, catalog);
    }

    static HttpStatus httpStatus(PlanningStatus status) {
        return switch (status) {
            case OPTIMAL -> HttpStatus.OK;
            case INVALID_INPUT -> HttpStatus.BAD_REQUEST;
            case INFEASIBLE -> HttpStatus.UNPROCESSABLE_ENTITY;
            case UNBOUNDED -> HttpStatus.INTERNAL_SERVER_ERROR;
            case SOLVER_ERROR -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }

    // DTOs

    public record PlanRequest(
            @NotNull @Valid ScheduleDto schedule,
            @Valid CatalogDto catalog,
            SolverKind solver // optional override of planner.solver.kind
    ) {}

    public record ScheduleDto(
            Double horizonDays,
            @NotNull List<@NotNull @Valid PeriodDto> periods
    ) {
        DemandSchedule toSchedule(double defaultHorizonDays) {
            return new DemandSchedule(
                    periods.stream()
                            .map(p -> new Period(p.id(), p.demand(), p.durationHours()))
                            .toList(),
                    horizonDays != null ? horizonDays : defaultHorizonDays
            );
        }
    }

    public record PeriodDto(
            @NotBlank String id,
            @NotNull Double demand,
            @NotNull Double durationHours
    ) {}

    public record CatalogDto(
            @NotNull Double onDemandRate,
            List<@NotNull @Valid TierDto> tiers
    ) {
        PricingCatalog toCatalog() {
            return new PricingCatalog(onDemandRate, tiers == null ? List.of() : tiers.stream()
                    .map(t -> new PricingTier(t.id(), t.annualFixedCost(), t.hourlyCost()))
                    .toList());
        }

        static CatalogDto from(PricingCatalog catalog) {
            return new CatalogDto(catalog.onDemandRate(), catalog.tiers().stream()
                    .map(t -> new TierDto(t.id(), t.annualFixedCost(), t.hourlyCost()))
                    .toList());
        }
    }

    public record TierDto(
            @NotBlank String id,
            @NotNull Double annualFixedCost,
            @NotNull Double hourlyCost
    ) {}
}
