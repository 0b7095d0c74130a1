package com.kinetic.modeller.solver;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Fixed-step explicit Runge-Kutta integration of a system of ODEs.
 *
 * Iterating yields rows {@code [t, y0, ..., yn-1]}: first the initial state, then one
 * row per step up to and including {@code endtime}. Each iteration runs a fresh
 * integration from the initial state.
 */
public class OdeDriver implements Iterable<double[]> {

    private static final double STEP_TOLERANCE = 1e-9;

    private final SolverMethod method;
    private final List<? extends OdeFunction> ode;
    private final double start;
    private final double[] initial;
    private final double timestep;
    private final double endtime;
    private final StepCallback callback;
    private final BoundaryPolicy bounds;

    public OdeDriver(SolverMethod method, List<? extends OdeFunction> ode, double start, double[] initial,
                     double timestep, double endtime, StepCallback callback, BoundaryPolicy bounds) {
        if (ode.size() != initial.length) {
            throw new IllegalArgumentException("Expected " + ode.size() + " initial values, got " + initial.length);
        }
        if (timestep <= 0) {
            throw new IllegalArgumentException("Timestep must be positive: " + timestep);
        }
        this.method = method;
        this.ode = List.copyOf(ode);
        this.start = start;
        this.initial = initial.clone();
        this.timestep = timestep;
        this.endtime = endtime;
        this.callback = callback;
        this.bounds = bounds;
    }

    /**
     * Number of steps taken after the initial row.
     */
    public long stepCount() {
        if (endtime <= start) {
            return 0;
        }
        return (long) Math.floor((endtime - start) / timestep + STEP_TOLERANCE);
    }

    /**
     * Advances {@code y} by one step of size {@code h} from time {@code t} and returns the new state.
     * Neither the callback nor the boundary policy is applied.
     */
    public double[] step(double t, double[] y, double h) {
        ButcherTableau tableau = method.getTableau();
        int n = y.length;
        int stages = tableau.stages();
        double[][] k = new double[stages][n];
        double[] stage = new double[n];

        for (int s = 0; s < stages; s++) {
            double[] a = tableau.getA()[s];
            for (int i = 0; i < n; i++) {
                double sum = y[i];
                for (int j = 0; j < s; j++) {
                    sum += h * a[j] * k[j][i];
                }
                stage[i] = sum;
            }
            double ts = t + tableau.getC()[s] * h;
            for (int i = 0; i < n; i++) {
                k[s][i] = ode.get(i).apply(ts, stage);
            }
        }

        double[] next = y.clone();
        double[] b = tableau.getB();
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            for (int s = 0; s < stages; s++) {
                sum += b[s] * k[s][i];
            }
            next[i] += h * sum;
        }
        return next;
    }

    @Override
    public Iterator<double[]> iterator() {
        return new Iterator<>() {
            private final long steps = stepCount();
            private long index = -1;
            private double[] y = initial.clone();

            @Override
            public boolean hasNext() {
                return index < steps;
            }

            @Override
            public double[] next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                index++;
                double t = start + index * timestep;
                if (index > 0) {
                    y = step(start + (index - 1) * timestep, y, timestep);
                    if (callback != null) {
                        callback.afterStep(t, y);
                    }
                    if (bounds != null) {
                        bounds.apply(y);
                    }
                }
                return row(t, y);
            }
        };
    }

    private static double[] row(double t, double[] y) {
        double[] row = new double[y.length + 1];
        row[0] = t;
        System.arraycopy(y, 0, row, 1, y.length);
        return row;
    }
}
