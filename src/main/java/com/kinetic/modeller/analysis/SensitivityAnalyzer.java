package com.kinetic.modeller.analysis;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kinetic.modeller.codegen.CompilerConfig;
import com.kinetic.modeller.compiler.CompiledModel;
import com.kinetic.modeller.compiler.ModelCompiler;
import com.kinetic.modeller.model.InterpolationMode;
import com.kinetic.modeller.model.Specification;
import com.kinetic.modeller.simulation.SimulationResult;
import com.kinetic.modeller.simulation.Simulator;

/**
 * One-factor-at-a-time local sensitivity analysis.
 *
 * The baseline is simulated first, then each numeric entry of Variables in turn is multiplied
 * by a factor while all others keep their written values. Each run works on its own copy of
 * the specification, re-read with extended interpolation so that rate laws pick up the change.
 */
public class SensitivityAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(SensitivityAnalyzer.class);

    public static final String BASELINE = "original";
    public static final String NO_CHANGE = "None";

    private final ModelCompiler compiler;
    private final Simulator simulator;

    public SensitivityAnalyzer() {
        this(new ModelCompiler(), new Simulator());
    }

    public SensitivityAnalyzer(ModelCompiler compiler, Simulator simulator) {
        this.compiler = compiler;
        this.simulator = simulator;
    }

    public SensitivityResult analyze(Specification spec, double multiple, OutputFormat format, CompilerConfig config) {
        List<SensitivityRow> rows = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        List<String> parameters = spec.keys(Specification.VARIABLES);

        log.info("Processing model 1 of {}: baseline", parameters.size() + 1);
        SimulationResult baseline = simulate(spec, config);
        collect(rows, BASELINE, NO_CHANGE, baseline, format);

        int modelCount = 1;
        for (String parameter : parameters) {
            modelCount++;
            String raw = spec.getRaw(Specification.VARIABLES, parameter).orElse("").trim();
            double original;
            try {
                original = Double.parseDouble(raw);
            } catch (NumberFormatException e) {
                log.warn("Variable {} is not numeric ({}); skipped", parameter, raw);
                skipped.add(parameter);
                continue;
            }

            double changed = original * multiple;
            String change = original + " --> " + changed;
            Specification perturbed = spec.copy();
            perturbed.set(Specification.VARIABLES, parameter, String.valueOf(changed));

            log.info("Processing model {} of {}: {} {}", modelCount, parameters.size() + 1, parameter, change);
            collect(rows, parameter, change, simulate(perturbed, config), format);
        }

        return new SensitivityResult(baseline.getLabels(), rows, skipped);
    }

    private SimulationResult simulate(Specification spec, CompilerConfig config) {
        CompiledModel model = compiler.compile(spec.withMode(InterpolationMode.EXTENDED));
        return simulator.run(model, config);
    }

    private static void collect(List<SensitivityRow> rows, String parameter, String change,
                                SimulationResult result, OutputFormat format) {
        if (format == OutputFormat.REDUCED) {
            rows.add(new SensitivityRow(parameter, change, result.lastRow()));
        } else {
            for (double[] row : result.getRows()) {
                rows.add(new SensitivityRow(parameter, change, row));
            }
        }
    }
}
