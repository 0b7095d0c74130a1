package com.kinetic.modeller.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.kinetic.modeller.cli.exception.OptionsValidationException;
import com.kinetic.modeller.cli.model.SolverOptions;
import com.kinetic.modeller.codegen.CompilerConfig;
import com.kinetic.modeller.model.exception.ModelException;
import com.kinetic.modeller.parser.exception.ParseException;
import com.kinetic.modeller.solver.SolverMethod;

/**
 * Checks command options up front and reports every problem at once.
 */
public class SolverOptionsValidator {

	public CompilerConfig validate(SolverOptions o) {
		return validate(o, CompilerConfig.defaults().getClassName());
	}

	public CompilerConfig validate(SolverOptions o, String className) {
		List<String> errors = new ArrayList<>();

		try {
			SolverMethod.fromName(o.getSolver());
		} catch (ModelException e) {
			errors.add(e.getMessage());
		}

		if (!(o.getTimestep() > 0)) {
			errors.add("Timestep must be > 0. Got: " + o.getTimestep());
		}
		if (o.getEndtime() < 0) {
			errors.add("End time must be >= 0. Got: " + o.getEndtime());
		}
		if (o.getSampling() < 1) {
			errors.add("Sampling must be >= 1. Got: " + o.getSampling());
		}

		double[] lower = parseBound(o.getLowerbound(), "--lowerbound", errors);
		double[] upper = parseBound(o.getUpperbound(), "--upperbound", errors);

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		return CompilerConfig.builder()
				.solver(o.getSolver())
				.timestep(o.getTimestep())
				.endtime(o.getEndtime())
				.lowerbound(lower)
				.upperbound(upper)
				.sampling(o.getSampling())
				.className(className)
				.build();
	}

	/**
	 * Collects an error for each input file that is missing or not a regular file.
	 */
	public static void requireFiles(List<Path> files, List<String> errors) {
		if (files == null || files.isEmpty()) {
			errors.add("At least one input file is required.");
			return;
		}
		for (Path file : files) {
			if (!Files.isRegularFile(file)) {
				errors.add("Input file does not exist or is not a file: " + file);
			}
		}
	}

	/**
	 * A reaction prefix is only needed when more than one file is merged.
	 */
	public static void requirePrefix(String prefix, List<Path> files, List<String> errors) {
		if (files != null && files.size() > 1 && (prefix == null || prefix.isBlank())) {
			errors.add("Prefix must not be blank (--prefix / -p).");
		}
	}

	private static double[] parseBound(String raw, String option, List<String> errors) {
		try {
			return CompilerConfig.parseBound(raw);
		} catch (ParseException e) {
			errors.add(option + ": " + e.getMessage());
			return null;
		}
	}
}
