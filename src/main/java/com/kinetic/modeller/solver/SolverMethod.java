package com.kinetic.modeller.solver;

import java.util.Arrays;
import java.util.stream.Collectors;

import com.kinetic.modeller.model.exception.ModelException;

/**
 * The fixed-step explicit integrators, each defined by its Butcher tableau.
 * Embedded pairs (Cash-Karp, Fehlberg, Dormand-Prince) are exposed as two
 * separate methods using the lower or higher order weights; no error control is done.
 */
public enum SolverMethod {
    EULER("Euler", 1, new ButcherTableau(
            new double[] {0},
            new double[][] {{}},
            new double[] {1})),

    HEUN("Heun", 2, new ButcherTableau(
            new double[] {0, 1},
            new double[][] {{}, {1}},
            new double[] {1.0 / 2, 1.0 / 2})),

    RK3("RK3", 3, new ButcherTableau(
            new double[] {0, 1.0 / 2, 1},
            new double[][] {{}, {1.0 / 2}, {-1, 2}},
            new double[] {1.0 / 6, 2.0 / 3, 1.0 / 6})),

    RK4("RK4", 4, new ButcherTableau(
            new double[] {0, 1.0 / 2, 1.0 / 2, 1},
            new double[][] {{}, {1.0 / 2}, {0, 1.0 / 2}, {0, 0, 1}},
            new double[] {1.0 / 6, 1.0 / 3, 1.0 / 3, 1.0 / 6})),

    RK38("RK38", 4, new ButcherTableau(
            new double[] {0, 1.0 / 3, 2.0 / 3, 1},
            new double[][] {{}, {1.0 / 3}, {-1.0 / 3, 1}, {1, -1, 1}},
            new double[] {1.0 / 8, 3.0 / 8, 3.0 / 8, 1.0 / 8})),

    CK4("CK4", 4, cashKarp(new double[] {2825.0 / 27648, 0, 18575.0 / 48384, 13525.0 / 55296, 277.0 / 14336, 1.0 / 4})),

    CK5("CK5", 5, cashKarp(new double[] {37.0 / 378, 0, 250.0 / 621, 125.0 / 594, 0, 512.0 / 1771})),

    RKF4("RKF4", 4, fehlberg(new double[] {25.0 / 216, 0, 1408.0 / 2565, 2197.0 / 4104, -1.0 / 5, 0})),

    RKF5("RKF5", 5, fehlberg(new double[] {16.0 / 135, 0, 6656.0 / 12825, 28561.0 / 56430, -9.0 / 50, 2.0 / 55})),

    DP4("DP4", 4, dormandPrince(new double[] {
            5179.0 / 57600, 0, 7571.0 / 16695, 393.0 / 640, -92097.0 / 339200, 187.0 / 2100, 1.0 / 40})),

    DP5("DP5", 5, dormandPrince(new double[] {
            35.0 / 384, 0, 500.0 / 1113, 125.0 / 192, -2187.0 / 6784, 11.0 / 84, 0}));

    private final String displayName;
    private final int order;
    private final ButcherTableau tableau;

    SolverMethod(String displayName, int order, ButcherTableau tableau) {
        this.displayName = displayName;
        this.order = order;
        this.tableau = tableau;
    }

    public String getDisplayName() {
        return displayName;
    }

    public int getOrder() {
        return order;
    }

    public ButcherTableau getTableau() {
        return tableau;
    }

    /**
     * Looks a solver up by name, ignoring case.
     *
     * @throws ModelException for an unknown name
     */
    public static SolverMethod fromName(String name) {
        if (name != null) {
            for (SolverMethod method : values()) {
                if (method.displayName.equalsIgnoreCase(name.trim())) {
                    return method;
                }
            }
        }
        throw new ModelException("Unknown solver '" + name + "'. Expected one of: " + names());
    }

    public static String names() {
        return Arrays.stream(values()).map(SolverMethod::getDisplayName).collect(Collectors.joining(", "));
    }

    private static ButcherTableau cashKarp(double[] b) {
        return new ButcherTableau(
                new double[] {0, 1.0 / 5, 3.0 / 10, 3.0 / 5, 1, 7.0 / 8},
                new double[][] {
                        {},
                        {1.0 / 5},
                        {3.0 / 40, 9.0 / 40},
                        {3.0 / 10, -9.0 / 10, 6.0 / 5},
                        {-11.0 / 54, 5.0 / 2, -70.0 / 27, 35.0 / 27},
                        {1631.0 / 55296, 175.0 / 512, 575.0 / 13824, 44275.0 / 110592, 253.0 / 4096}},
                b);
    }

    private static ButcherTableau fehlberg(double[] b) {
        return new ButcherTableau(
                new double[] {0, 1.0 / 4, 3.0 / 8, 12.0 / 13, 1, 1.0 / 2},
                new double[][] {
                        {},
                        {1.0 / 4},
                        {3.0 / 32, 9.0 / 32},
                        {1932.0 / 2197, -7200.0 / 2197, 7296.0 / 2197},
                        {439.0 / 216, -8, 3680.0 / 513, -845.0 / 4104},
                        {-8.0 / 27, 2, -3544.0 / 2565, 1859.0 / 4104, -11.0 / 40}},
                b);
    }

    private static ButcherTableau dormandPrince(double[] b) {
        return new ButcherTableau(
                new double[] {0, 1.0 / 5, 3.0 / 10, 4.0 / 5, 8.0 / 9, 1, 1},
                new double[][] {
                        {},
                        {1.0 / 5},
                        {3.0 / 40, 9.0 / 40},
                        {44.0 / 45, -56.0 / 15, 32.0 / 9},
                        {19372.0 / 6561, -25360.0 / 2187, 64448.0 / 6561, -212.0 / 729},
                        {9017.0 / 3168, -355.0 / 33, 46732.0 / 5247, 49.0 / 176, -5103.0 / 18656},
                        {35.0 / 384, 0, 500.0 / 1113, 125.0 / 192, -2187.0 / 6784, 11.0 / 84}},
                b);
    }
}
