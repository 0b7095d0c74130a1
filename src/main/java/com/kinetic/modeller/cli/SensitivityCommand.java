package com.kinetic.modeller.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.kinetic.modeller.analysis.OutputFormat;
import com.kinetic.modeller.analysis.SensitivityAnalyzer;
import com.kinetic.modeller.analysis.SensitivityResult;
import com.kinetic.modeller.cli.exception.OptionsValidationException;
import com.kinetic.modeller.cli.model.SolverOptions;
import com.kinetic.modeller.cli.validation.SolverOptionsValidator;
import com.kinetic.modeller.codegen.CompilerConfig;
import com.kinetic.modeller.model.InterpolationMode;
import com.kinetic.modeller.model.exception.ModelException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Local sensitivity analysis: each variable is scaled in turn and the model re-simulated.
 */
@Command(
        name = "sensitivity",
        mixinStandardHelpOptions = true,
        description = "Performs one-factor-at-a-time local sensitivity analysis over the Variables stanza."
)
public class SensitivityCommand extends AbstractModelCommand {

    @Parameters(index = "0", description = "Model specification file")
    private Path specFile;

    @Option(names = { "--multiple", "-m" }, defaultValue = "100", description = "Factor applied to each variable (default: ${DEFAULT-VALUE})")
    private double multiple;

    @Option(names = { "--format", "-f" }, defaultValue = "REDUCED", description = "reduced (final row only) or full (default: ${DEFAULT-VALUE})")
    private String format;

    @Option(names = { "--result-file", "-r" }, defaultValue = "sensitivity_analysis.csv", description = "CSV output file (default: ${DEFAULT-VALUE})")
    private Path resultFile;

    @Mixin
    private SolverOptions solverOptions;

    @Override
    protected void execute() throws IOException {
        List<String> errors = new ArrayList<>();
        SolverOptionsValidator.requireFiles(List.of(specFile), errors);
        OutputFormat outputFormat = null;
        try {
            outputFormat = OutputFormat.fromName(format);
        } catch (ModelException e) {
            errors.add(e.getMessage());
        }
        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }
        CompilerConfig config = new SolverOptionsValidator().validate(solverOptions);

        printer.printBanner("Sensitivity Analysis", List.of(specFile));
        printer.printConfig(config);

        SensitivityResult result = new SensitivityAnalyzer()
                .analyze(load(specFile, InterpolationMode.BASIC), multiple, outputFormat, config);
        result.writeCsv(resultFile);

        if (!result.getSkippedParameters().isEmpty()) {
            printer.printSkipped(result.getSkippedParameters());
        }
        printer.printSuccess("Sensitivity results", resultFile);
    }

    @Override
    protected String commandName() {
        return "Sensitivity analysis";
    }
}
