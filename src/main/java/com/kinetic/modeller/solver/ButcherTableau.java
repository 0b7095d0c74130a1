package com.kinetic.modeller.solver;

import lombok.Getter;

/**
 * Coefficients of an explicit Runge-Kutta method.
 *
 * {@code a} is lower triangular: row {@code i} holds the weights of stages {@code 0..i-1}.
 */
@Getter
public class ButcherTableau {
    private final double[] c;
    private final double[][] a;
    private final double[] b;

    public ButcherTableau(double[] c, double[][] a, double[] b) {
        if (c.length != b.length || a.length != b.length) {
            throw new IllegalArgumentException("Tableau rows do not match stage count " + b.length);
        }
        for (int i = 0; i < a.length; i++) {
            if (a[i].length != i) {
                throw new IllegalArgumentException("Tableau row " + i + " must have " + i + " coefficients");
            }
        }
        this.c = c;
        this.a = a;
        this.b = b;
    }

    public int stages() {
        return b.length;
    }
}
