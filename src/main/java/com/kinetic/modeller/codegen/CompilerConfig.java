package com.kinetic.modeller.codegen;

import com.kinetic.modeller.parser.exception.ParseException;
import com.kinetic.modeller.solver.SolverMethod;

import lombok.Builder;
import lombok.Data;

/**
 * Settings for generating an integration program. Passed explicitly through the pipeline.
 */
@Data
@Builder
public class CompilerConfig {
    public static final String DEFAULT_SOLVER = "RK4";
    public static final String DEFAULT_LOWER_BOUND = "0;0";
    public static final String DEFAULT_UPPER_BOUND = "1e-3;1e-3";

    @Builder.Default
    private String solver = DEFAULT_SOLVER;

    @Builder.Default
    private double timestep = 1.0;

    @Builder.Default
    private double endtime = 21600.0;

    /** {@code [threshold, reset]} applied to every slot. */
    @Builder.Default
    private double[] lowerbound = {0.0, 0.0};

    @Builder.Default
    private double[] upperbound = {1e-3, 1e-3};

    @Builder.Default
    private String className = "OdeProgram";

    /** Default for the generated program when no sampling argument is given. */
    @Builder.Default
    private int sampling = 100;

    public static CompilerConfig defaults() {
        return CompilerConfig.builder().build();
    }

    public SolverMethod solverMethod() {
        return SolverMethod.fromName(solver);
    }

    /**
     * Parses a {@code threshold;reset} pair such as {@code 1e-3;1e-3}.
     *
     * @throws ParseException when the text is not two numbers separated by {@code ;}
     */
    public static double[] parseBound(String text) {
        if (text == null) {
            throw new ParseException("Bound is missing; expected 'threshold;reset'");
        }
        String[] parts = text.split(";", -1);
        if (parts.length != 2) {
            throw new ParseException("Bound must be 'threshold;reset', got: " + text);
        }
        try {
            return new double[] {Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim())};
        } catch (NumberFormatException e) {
            throw new ParseException("Bound values must be numeric, got: " + text);
        }
    }
}
