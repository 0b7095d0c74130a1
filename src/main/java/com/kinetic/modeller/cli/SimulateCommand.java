package com.kinetic.modeller.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.kinetic.modeller.cli.exception.OptionsValidationException;
import com.kinetic.modeller.cli.model.SolverOptions;
import com.kinetic.modeller.cli.validation.SolverOptionsValidator;
import com.kinetic.modeller.codegen.CompilerConfig;
import com.kinetic.modeller.compiler.CompiledModel;
import com.kinetic.modeller.merge.ModelMerger;
import com.kinetic.modeller.model.ModelDiagnostics;
import com.kinetic.modeller.simulation.SimulationResult;
import com.kinetic.modeller.simulation.Simulator;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Compiles and integrates a specification (or several, merged) in-process and writes the trajectory as CSV.
 */
@Command(
        name = "simulate",
        mixinStandardHelpOptions = true,
        description = "Simulates a model specification and writes the sampled results as CSV."
)
public class SimulateCommand extends AbstractModelCommand {

    @Parameters(arity = "1..*", description = "Model specification files; several are merged into one model")
    private List<Path> specFiles;

    @Option(names = { "--result-file", "-r" }, defaultValue = "oderesult.csv", description = "CSV output file (default: ${DEFAULT-VALUE})")
    private Path resultFile;

    @Option(names = { "--prefix", "-p" }, defaultValue = ModelMerger.DEFAULT_PREFIX, description = "Prefix for renumbered reaction ids when merging (default: ${DEFAULT-VALUE})")
    private String prefix;

    @Mixin
    private SolverOptions solverOptions;

    @Override
    protected void execute() throws IOException {
        List<String> errors = new ArrayList<>();
        SolverOptionsValidator.requireFiles(specFiles, errors);
        SolverOptionsValidator.requirePrefix(prefix, specFiles, errors);
        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
        CompilerConfig config = new SolverOptionsValidator().validate(solverOptions);

        printer.printBanner("Simulate", specFiles);
        printer.printConfig(config);

        ModelDiagnostics diagnostics = new ModelDiagnostics();
        CompiledModel model = compileModels(specFiles, prefix, diagnostics).getModel();
        SimulationResult result = new Simulator().run(model, config);
        result.writeCsv(resultFile);

        printer.printDiagnostics(diagnostics);
        printer.printSuccess(result.getRows().size() + " result rows", resultFile);
    }

    @Override
    protected String commandName() {
        return "Simulation";
    }
}
