package com.kinetic.modeller.solver;

/**
 * Per-slot {@code [threshold, reset]} pairs applied after every step.
 *
 * A value below its lower threshold is replaced by the lower reset value; a value
 * above its upper threshold by the upper reset value. This is a hard reset, not a clamp
 * to the threshold.
 */
public class BoundaryPolicy {

    private final double[][] lowerbound;
    private final double[][] upperbound;

    public BoundaryPolicy(double[][] lowerbound, double[][] upperbound) {
        if (lowerbound.length != upperbound.length) {
            throw new IllegalArgumentException("Lower and upper bound tables differ in size: "
                    + lowerbound.length + " vs " + upperbound.length);
        }
        this.lowerbound = lowerbound;
        this.upperbound = upperbound;
    }

    /**
     * Same {@code [threshold, reset]} pairs for every one of {@code size} slots.
     */
    public static BoundaryPolicy uniform(int size, double[] lower, double[] upper) {
        double[][] lowerTable = new double[size][];
        double[][] upperTable = new double[size][];
        for (int i = 0; i < size; i++) {
            lowerTable[i] = lower.clone();
            upperTable[i] = upper.clone();
        }
        return new BoundaryPolicy(lowerTable, upperTable);
    }

    public void apply(double[] y) {
        int slots = Math.min(y.length, lowerbound.length);
        for (int i = 0; i < slots; i++) {
            if (y[i] < lowerbound[i][0]) {
                y[i] = lowerbound[i][1];
            }
            if (y[i] > upperbound[i][0]) {
                y[i] = upperbound[i][1];
            }
        }
    }
}
