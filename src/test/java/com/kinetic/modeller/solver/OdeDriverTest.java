package com.kinetic.modeller.solver;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the fixed-step driver and the boundary policy.
 */
class OdeDriverTest {

    private static final OdeFunction ZERO = (t, y) -> 0.0;

    @Test
    void testInitialRowComesFirst() {
        OdeDriver driver = new OdeDriver(SolverMethod.RK4, List.of(ZERO), 0.0, new double[] {3.0},
                1.0, 2.0, null, null);

        List<double[]> rows = collect(driver);

        assertThat(rows).hasSize(3);
        assertThat(rows.get(0)).containsExactly(0.0, 3.0);
        assertThat(rows.get(1)).containsExactly(1.0, 3.0);
        assertThat(rows.get(2)).containsExactly(2.0, 3.0);
    }

    @Test
    void testStepCountIncludesEndTime() {
        OdeDriver driver = new OdeDriver(SolverMethod.EULER, List.of(ZERO), 0.0, new double[] {0.0},
                0.1, 1.0, null, null);

        assertThat(driver.stepCount()).isEqualTo(10);
        assertThat(collect(driver)).hasSize(11);
    }

    @Test
    void testEndTimeBeforeStartYieldsOnlyInitialRow() {
        OdeDriver driver = new OdeDriver(SolverMethod.EULER, List.of(ZERO), 5.0, new double[] {1.0},
                1.0, 0.0, null, null);

        assertThat(collect(driver)).hasSize(1);
    }

    @Test
    void testCallbackRunsBeforeBounds() {
        // the callback pushes values out of range, the bounds must pull them back
        StepCallback disturb = (t, y) -> {
            y[0] = -0.5;
            y[1] = 2e-3;
        };
        BoundaryPolicy bounds = BoundaryPolicy.uniform(2, new double[] {0.0, 0.0}, new double[] {1e-3, 1e-3});
        OdeDriver driver = new OdeDriver(SolverMethod.EULER, List.of(ZERO, ZERO), 0.0, new double[] {5e-4, 5e-4},
                1.0, 1.0, disturb, bounds);

        List<double[]> rows = collect(driver);

        assertThat(rows.get(1)).containsExactly(1.0, 0.0, 1e-3);
    }

    @Test
    void testBoundaryResetUsesResetValueNotThreshold() {
        BoundaryPolicy bounds = new BoundaryPolicy(
                new double[][] {{0.0, 0.5}, {0.0, 0.0}},
                new double[][] {{10.0, 2.0}, {10.0, 10.0}});
        double[] y = {-1.0, 11.0};

        bounds.apply(y);

        assertThat(y).containsExactly(0.5, 10.0);
    }

    @Test
    void testExponentialDecayAccuracy() {
        OdeFunction decay = (t, y) -> -0.5 * y[0];
        OdeDriver driver = new OdeDriver(SolverMethod.RK4, List.of(decay), 0.0, new double[] {1.0},
                0.1, 2.0, null, null);

        List<double[]> rows = collect(driver);
        double[] last = rows.get(rows.size() - 1);

        assertThat(last[0]).isCloseTo(2.0, within(1e-12));
        assertThat(last[1]).isCloseTo(Math.exp(-1.0), within(1e-6));
    }

    @Test
    void testHigherOrderIsMoreAccurate() {
        OdeFunction decay = (t, y) -> -y[0];
        double eulerError = Math.abs(finalValue(SolverMethod.EULER, decay) - Math.exp(-1.0));
        double heunError = Math.abs(finalValue(SolverMethod.HEUN, decay) - Math.exp(-1.0));
        double dp5Error = Math.abs(finalValue(SolverMethod.DP5, decay) - Math.exp(-1.0));

        assertThat(heunError).isLessThan(eulerError);
        assertThat(dp5Error).isLessThan(heunError);
    }

    @Test
    void testTimeDependentRightHandSide() {
        OdeFunction ramp = (t, y) -> 2 * t;
        OdeDriver driver = new OdeDriver(SolverMethod.RK3, List.of(ramp), 0.0, new double[] {0.0},
                0.5, 3.0, null, null);

        List<double[]> rows = collect(driver);

        assertThat(rows.get(rows.size() - 1)[1]).isCloseTo(9.0, within(1e-9));
    }

    @Test
    void testEveryIterationStartsFresh() {
        OdeFunction growth = (t, y) -> y[0];
        OdeDriver driver = new OdeDriver(SolverMethod.EULER, List.of(growth), 0.0, new double[] {1.0},
                1.0, 3.0, null, null);

        List<double[]> first = collect(driver);
        List<double[]> second = collect(driver);

        assertThat(second.get(3)).containsExactly(first.get(3));
    }

    @Test
    void testInvalidArguments() {
        assertThatThrownBy(() -> new OdeDriver(SolverMethod.EULER, List.of(ZERO), 0.0, new double[] {1.0, 2.0},
                1.0, 1.0, null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new OdeDriver(SolverMethod.EULER, List.of(ZERO), 0.0, new double[] {1.0},
                0.0, 1.0, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Timestep");
    }

    private static double finalValue(SolverMethod method, OdeFunction f) {
        List<double[]> rows = collect(new OdeDriver(method, List.of(f), 0.0, new double[] {1.0},
                0.25, 1.0, null, null));
        return rows.get(rows.size() - 1)[1];
    }

    private static List<double[]> collect(OdeDriver driver) {
        List<double[]> rows = new ArrayList<>();
        driver.forEach(rows::add);
        return rows;
    }
}
