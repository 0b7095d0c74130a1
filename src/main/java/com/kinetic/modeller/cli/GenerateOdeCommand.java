package com.kinetic.modeller.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.kinetic.modeller.cli.exception.OptionsValidationException;
import com.kinetic.modeller.cli.model.SolverOptions;
import com.kinetic.modeller.cli.validation.SolverOptionsValidator;
import com.kinetic.modeller.codegen.CompilerConfig;
import com.kinetic.modeller.codegen.GeneratedProgram;
import com.kinetic.modeller.codegen.SolverEmitter;
import com.kinetic.modeller.codegen.util.NamingUtil;
import com.kinetic.modeller.merge.ModelMerger;
import com.kinetic.modeller.model.ModelDiagnostics;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Compiles a specification, or several merged into one model, into a single-file Java ODE program.
 */
@Command(
        name = "gen-ode",
        mixinStandardHelpOptions = true,
        description = "Generates a self-contained Java ODE program from a model specification."
)
public class GenerateOdeCommand extends AbstractModelCommand {

    @Parameters(arity = "1..*", description = "Model specification files; several are merged into one model")
    private List<Path> specFiles;

    @Option(names = { "--output", "-o" }, description = "Output file or directory (defaults to <class-name>.java in the current directory)")
    private Path output;

    @Option(names = { "--class-name", "-c" }, defaultValue = "OdeProgram", description = "Class name of the generated program (default: ${DEFAULT-VALUE})")
    private String className;

    @Option(names = { "--prefix", "-p" }, defaultValue = ModelMerger.DEFAULT_PREFIX, description = "Prefix for renumbered reaction ids when merging (default: ${DEFAULT-VALUE})")
    private String prefix;

    @Mixin
    private SolverOptions solverOptions;

    @Override
    protected void execute() throws IOException {
        List<String> errors = new ArrayList<>();
        SolverOptionsValidator.requireFiles(specFiles, errors);
        if (!NamingUtil.isValidClassName(className)) {
            errors.add("Not a valid Java class name: " + className);
        }
        SolverOptionsValidator.requirePrefix(prefix, specFiles, errors);
        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
        CompilerConfig config = new SolverOptionsValidator().validate(solverOptions, className);

        printer.printBanner("Generate ODE", specFiles);
        printer.printConfig(config);

        ModelDiagnostics diagnostics = new ModelDiagnostics();
        LoadedModel loaded = compileModels(specFiles, prefix, diagnostics);
        GeneratedProgram program = new SolverEmitter().emit(loaded.getSpecification(), loaded.getModel(), config);

        Path target = program.writeTo(output == null ? Path.of(".") : output);
        printer.printDiagnostics(diagnostics);
        printer.printSuccess("ODE program", target);
    }

    @Override
    protected String commandName() {
        return "ODE generation";
    }
}
