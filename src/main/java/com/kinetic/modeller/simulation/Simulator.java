package com.kinetic.modeller.simulation;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kinetic.modeller.codegen.CompilerConfig;
import com.kinetic.modeller.compiler.CompiledModel;
import com.kinetic.modeller.model.exception.ModelException;
import com.kinetic.modeller.solver.BoundaryPolicy;
import com.kinetic.modeller.solver.OdeDriver;
import com.kinetic.modeller.solver.SolverMethod;

/**
 * Integrates a compiled model in-process, with the same solver, bounds and sampling rules
 * as the generated program.
 *
 * Every {@code sampling}-th row is kept, counting the initial row as row zero; the final row
 * is always kept.
 */
public class Simulator {
    private static final Logger log = LoggerFactory.getLogger(Simulator.class);

    public SimulationResult run(CompiledModel model, CompilerConfig config) {
        return run(model, config, config.getSampling());
    }

    public SimulationResult run(CompiledModel model, CompilerConfig config, int sampling) {
        if (sampling < 1) {
            throw new ModelException("Sampling must be at least 1, got " + sampling);
        }
        SolverMethod solver = config.solverMethod();
        OdeDriver driver = new OdeDriver(solver, model.getDerivatives(), 0.0, model.initialState(),
                config.getTimestep(), config.getEndtime(), null,
                BoundaryPolicy.uniform(model.size(), config.getLowerbound(), config.getUpperbound()));

        log.info("Simulating {} entities with {} (timestep {}, endtime {}, sampling {})",
                model.size(), solver.getDisplayName(), config.getTimestep(), config.getEndtime(), sampling);

        List<double[]> rows = new ArrayList<>();
        long count = 0;
        double[] last = null;
        boolean lastKept = false;
        for (double[] row : driver) {
            lastKept = count % sampling == 0;
            if (lastKept) {
                rows.add(row);
            }
            last = row;
            count++;
        }
        if (last != null && !lastKept) {
            rows.add(last);
        }

        log.debug("Kept {} of {} rows", rows.size(), count);
        return new SimulationResult(model.labels(), rows, count - 1);
    }
}
