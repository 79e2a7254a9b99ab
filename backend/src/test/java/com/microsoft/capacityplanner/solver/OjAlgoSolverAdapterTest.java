package com.microsoft.capacityplanner.solver;

import com.microsoft.capacityplanner.PlanningFixtures;
import com.microsoft.capacityplanner.config.PlannerProperties;
import com.microsoft.capacityplanner.decoding.PlanDecoder;
import com.microsoft.capacityplanner.domain.model.DemandSchedule;
import com.microsoft.capacityplanner.domain.model.Period;
import com.microsoft.capacityplanner.domain.model.PricingCatalog;
import com.microsoft.capacityplanner.domain.model.ProvisioningPlan;
import com.microsoft.capacityplanner.formulation.Constraint;
import com.microsoft.capacityplanner.formulation.LinearExpression;
import com.microsoft.capacityplanner.formulation.ModelBuilder;
import com.microsoft.capacityplanner.formulation.Objective;
import com.microsoft.capacityplanner.formulation.PlanLayout;
import com.microsoft.capacityplanner.formulation.PlanningModel;
import com.microsoft.capacityplanner.formulation.VariableDomain;
import com.microsoft.capacityplanner.formulation.VariableKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.ojalgo.optimisation.Optimisation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static com.microsoft.capacityplanner.PlanningFixtures.TOLERANCE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Planner properties checked end to end: model builder, ojAlgo, decoder.
 */
class OjAlgoSolverAdapterTest {

    private ModelBuilder modelBuilder;
    private PlanDecoder planDecoder;
    private OjAlgoSolverAdapter solver;

    @BeforeEach
    void setUp() {
        modelBuilder = new ModelBuilder();
        planDecoder = new PlanDecoder();
        solver = new OjAlgoSolverAdapter(new PlannerProperties());
    }

    private Solution solve(DemandSchedule schedule, PricingCatalog catalog) {
        return solver.solve(modelBuilder.build(schedule, catalog));
    }

    private ProvisioningPlan plan(DemandSchedule schedule, PricingCatalog catalog) {
        var model = modelBuilder.build(schedule, catalog);
        var solution = solver.solve(model);
        assertThat(solution.status()).isEqualTo(SolutionStatus.OPTIMAL);
        return planDecoder.decode(model.getLayout(), solution);
    }

    @Nested
    @DisplayName("Reference scenario")
    class ReferenceScenarioTests {

        @Test
        @DisplayName("Should find the optimal cost of the three-period day")
        void shouldMatchReferenceCost() {
            var solution = solve(PlanningFixtures.referenceSchedule(), PlanningFixtures.referenceCatalog());

            assertThat(solution.status()).isEqualTo(SolutionStatus.OPTIMAL);
            assertThat(solution.objectiveValue()).isCloseTo(PlanningFixtures.REFERENCE_COST, within(TOLERANCE));
            assertThat(solution.objectiveValue()).isCloseTo(289.92, within(0.005));
        }

        @Test
        @DisplayName("Should return a plan meeting capacity and reservation bounds")
        void shouldReturnValidPlan() {
            var schedule = PlanningFixtures.referenceSchedule();

            var plan = plan(schedule, PlanningFixtures.referenceCatalog());

            PlanningFixtures.assertPlanCoversDemand(plan, schedule);
        }
    }

    @Nested
    @DisplayName("Degenerate inputs")
    class DegenerateTests {

        @Test
        @DisplayName("Should buy nothing when demand is zero")
        void shouldPlanNothingForZeroDemand() {
            var schedule = PlanningFixtures.schedule(0, 0, 0);

            var model = modelBuilder.build(schedule, PlanningFixtures.referenceCatalog());
            var solution = solver.solve(model);

            assertThat(solution.status()).isEqualTo(SolutionStatus.OPTIMAL);
            assertThat(solution.objectiveValue()).isCloseTo(0.0, within(TOLERANCE));
            var plan = planDecoder.decode(model.getLayout(), solution);
            assertThat(plan.reservations().values()).allSatisfy(v -> assertThat(v).isCloseTo(0.0, within(TOLERANCE)));
            assertThat(plan.periods()).allSatisfy(p -> assertThat(p.totalCapacity()).isCloseTo(0.0, within(TOLERANCE)));
        }

        @Test
        @DisplayName("Should round demand up to whole on-demand instances without tiers")
        void shouldUseOnDemandOnly() {
            var schedule = new DemandSchedule(List.of(
                    new Period("a", 1.5, 8),
                    new Period("b", 0, 4),
                    new Period("c", 3, 12)
            ));
            var catalog = PricingCatalog.onDemandOnly(0.64);

            var model = modelBuilder.build(schedule, catalog);
            var solution = solver.solve(model);
            var plan = planDecoder.decode(model.getLayout(), solution);

            assertThat(plan.allocation("a").onDemand()).isCloseTo(2.0, within(TOLERANCE));
            assertThat(plan.allocation("b").onDemand()).isCloseTo(0.0, within(TOLERANCE));
            assertThat(plan.allocation("c").onDemand()).isCloseTo(3.0, within(TOLERANCE));
            assertThat(solution.objectiveValue()).isCloseTo(0.64 * (8 * 2 + 12 * 3), within(TOLERANCE));
        }

        @Test
        @DisplayName("Should solve a model without variables")
        void shouldSolveEmptyModel() {
            var solution = solve(new DemandSchedule(List.of()), PricingCatalog.onDemandOnly(1.0));

            assertThat(solution.status()).isEqualTo(SolutionStatus.OPTIMAL);
            assertThat(solution.objectiveValue()).isZero();
        }

        @Test
        @DisplayName("Should report infeasibility without an assignment")
        void shouldReportInfeasible() {
            VariableKey x = VariableKey.onDemand("p");
            var model = PlanningModel.builder()
                    .variable(x, VariableDomain.nonNegativeInteger(1))
                    .objective(Objective.minimize(LinearExpression.builder().plus(x).build()))
                    .constraint(Constraint.atLeast("impossible", LinearExpression.builder().plus(x).build(), 5))
                    .layout(new PlanLayout(List.of("p"), List.of()))
                    .build();

            var solution = solver.solve(model);

            assertThat(solution.status()).isNotEqualTo(SolutionStatus.OPTIMAL);
            assertThat(solution.assignment()).isNull();
            assertThat(solution.objectiveValue()).isNull();
        }
    }

    @Nested
    @DisplayName("Plan properties")
    class PropertyTests {

        @Test
        @DisplayName("Should never lower the optimal cost when one period's demand grows")
        void shouldBeMonotoneInDemand() {
            var catalog = PlanningFixtures.referenceCatalog();
            double[] base = {12.2, 25.1, 53.5};
            double baseCost = solve(PlanningFixtures.schedule(base), catalog).objectiveValue();

            for (int period = 0; period < base.length; period++) {
                for (double extra : new double[] {0.4, 3, 20}) {
                    double[] grown = base.clone();
                    grown[period] += extra;

                    double grownCost = solve(PlanningFixtures.schedule(grown), catalog).objectiveValue();

                    assertThat(grownCost)
                            .as("period %d grown by %s", period, extra)
                            .isGreaterThanOrEqualTo(baseCost - TOLERANCE);
                }
            }
        }

        @Test
        @DisplayName("Should satisfy capacity and pool bounds across varied schedules")
        void shouldCoverDemandForVariedSchedules() {
            List<double[]> schedules = new ArrayList<>();
            schedules.add(new double[] {0, 10, 0});
            schedules.add(new double[] {7.7, 7.7, 7.7, 7.7});
            schedules.add(new double[] {100, 1, 50});
            schedules.add(new double[] {0.1});

            for (double[] demands : schedules) {
                var schedule = PlanningFixtures.schedule(demands);

                var plan = plan(schedule, PlanningFixtures.referenceCatalog());

                PlanningFixtures.assertPlanCoversDemand(plan, schedule);
            }
        }

        @Test
        @DisplayName("Should prefer a cheap flat commitment for constant demand")
        void shouldReserveForSteadyDemand() {
            // Constant demand of 5 over 24 hours: heavy costs 4.27 + 3.07 per instance-day,
            // on-demand 15.36
            var schedule = new DemandSchedule(List.of(new Period("all-day", 5, 24)));

            var plan = plan(schedule, PlanningFixtures.referenceCatalog());

            assertThat(plan.reservationCount("heavy")).isCloseTo(5.0, within(TOLERANCE));
            assertThat(plan.allocation("all-day").onDemand()).isCloseTo(0.0, within(TOLERANCE));
        }
    }

    @Nested
    @DisplayName("Time limit")
    class TimeLimitTests {

        private PlanningModel model;
        private List<VariableKey> keys;
        private OjAlgoSolverAdapter limited;

        @BeforeEach
        void setUp() {
            var properties = new PlannerProperties();
            properties.getSolver().setTimeLimit(Duration.ofMillis(1));
            limited = new OjAlgoSolverAdapter(properties);
            model = modelBuilder.build(PlanningFixtures.referenceSchedule(), PlanningFixtures.referenceCatalog());
            keys = new ArrayList<>(model.getVariableKeys());
        }

        @Test
        @DisplayName("Should report a search stopped with only a feasible incumbent as an error")
        void shouldNotReportIncumbentAsOptimal() {
            var solution = limited.interpret(model, keys, Optimisation.State.FEASIBLE, i -> 54.0);

            assertThat(solution.status()).isEqualTo(SolutionStatus.ERROR);
            assertThat(solution.isOptimal()).isFalse();
            assertThat(solution.assignment()).isNull();
            assertThat(solution.objectiveValue()).isNull();
            assertThat(solution.message())
                    .contains("before proving optimality")
                    .contains("time limit PT0.001S");
        }

        @Test
        @DisplayName("Should report a failed run as an error")
        void shouldReportFailure() {
            var solution = limited.interpret(model, keys, Optimisation.State.FAILED, i -> 0.0);

            assertThat(solution.status()).isEqualTo(SolutionStatus.ERROR);
            assertThat(solution.assignment()).isNull();
            assertThat(solution.message()).contains("FAILED");
        }

        @Test
        @DisplayName("Should price a proven optimum from its assignment")
        void shouldEvaluateOptimalAssignment() {
            var solution = limited.interpret(model, keys, Optimisation.State.OPTIMAL, i -> 1.0);

            assertThat(solution.status()).isEqualTo(SolutionStatus.OPTIMAL);
            assertThat(solution.assignment()).containsOnlyKeys(keys);
            assertThat(solution.objectiveValue())
                    .isCloseTo(model.evaluateObjective(solution.assignment()), within(TOLERANCE));
        }

        @Test
        @DisplayName("Should never return a non-optimal assignment under a tight limit")
        void shouldHonorTightLimit() {
            var solution = limited.solve(model);

            if (solution.isOptimal()) {
                assertThat(solution.objectiveValue()).isCloseTo(PlanningFixtures.REFERENCE_COST, within(TOLERANCE));
            } else {
                assertThat(solution.status()).isEqualTo(SolutionStatus.ERROR);
                assertThat(solution.assignment()).isNull();
            }
        }
    }

    @Test
    @DisplayName("Should report the ojAlgo kind")
    void shouldReportKind() {
        assertThat(solver.getKind()).isEqualTo(SolverKind.OJALGO);
    }
}
