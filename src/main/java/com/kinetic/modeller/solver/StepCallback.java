package com.kinetic.modeller.solver;

/**
 * Hook run after each integration step, before the boundary policy.
 * It may modify {@code y} in place.
 */
@FunctionalInterface
public interface StepCallback {
    void afterStep(double t, double[] y);
}
