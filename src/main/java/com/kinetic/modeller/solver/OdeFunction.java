package com.kinetic.modeller.solver;

/**
 * Right-hand side of one state variable: its rate of change at time {@code t}.
 */
@FunctionalInterface
public interface OdeFunction {
    double apply(double t, double[] y);
}
