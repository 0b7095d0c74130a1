package com.kinetic.modeller.cli.model;

import com.kinetic.modeller.codegen.CompilerConfig;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Integration options shared by the commands that generate or run a model.
 * No validation here; see SolverOptionsValidator.
 */
@Getter
public class SolverOptions {

	@Option(names = { "--solver", "-s" }, defaultValue = CompilerConfig.DEFAULT_SOLVER,
			description = "Euler, Heun, RK3, RK4, RK38, CK4, CK5, RKF4, RKF5, DP4 or DP5 (default: ${DEFAULT-VALUE})")
	private String solver;

	@Option(names = { "--timestep" }, defaultValue = "1", description = "Integration step (default: ${DEFAULT-VALUE})")
	private double timestep;

	@Option(names = { "--endtime" }, defaultValue = "21600", description = "Simulated time span starting at 0 (default: ${DEFAULT-VALUE})")
	private double endtime;

	@Option(names = { "--lowerbound" }, defaultValue = CompilerConfig.DEFAULT_LOWER_BOUND,
			description = "threshold;reset applied when a value drops below threshold (default: ${DEFAULT-VALUE})")
	private String lowerbound;

	@Option(names = { "--upperbound" }, defaultValue = CompilerConfig.DEFAULT_UPPER_BOUND,
			description = "threshold;reset applied when a value rises above threshold (default: ${DEFAULT-VALUE})")
	private String upperbound;

	@Option(names = { "--sampling" }, defaultValue = "100",
			description = "Keep every n-th row; the last row is always kept (default: ${DEFAULT-VALUE})")
	private int sampling;
}
