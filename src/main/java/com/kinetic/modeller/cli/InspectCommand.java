package com.kinetic.modeller.cli;

import java.nio.file.Path;
import java.io.IOException;
import java.util.List;

import com.kinetic.modeller.compiler.GraphBuilder;
import com.kinetic.modeller.model.EntityTable;
import com.kinetic.modeller.model.InterpolationMode;
import com.kinetic.modeller.model.ModelDiagnostics;
import com.kinetic.modeller.model.Specification;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Prints a specification, the entity table built from it, or its flux summary.
 */
@Command(
        name = "inspect",
        mixinStandardHelpOptions = true,
        description = "Reads a model specification and prints its stanzas, entities or fluxes."
)
public class InspectCommand extends AbstractModelCommand {

    public enum View { SPEC, MODEL, FLUX }

    @Parameters(index = "0", description = "Model specification file")
    private Path specFile;

    @Option(names = { "--view", "-v" }, defaultValue = "MODEL", description = "spec, model or flux (default: ${DEFAULT-VALUE})")
    private View view;

    @Option(names = { "--mode" }, defaultValue = "EXTENDED", description = "Interpolation mode: basic or extended (default: ${DEFAULT-VALUE})")
    private InterpolationMode mode;

    @Override
    protected void execute() throws IOException {
        printer.printBanner("Inspect", List.of(specFile));
        Specification spec = load(specFile, mode);

        if (view == View.SPEC) {
            printer.printSpecification(spec);
            return;
        }

        ModelDiagnostics diagnostics = new ModelDiagnostics();
        EntityTable table = new GraphBuilder().build(spec, diagnostics);
        if (view == View.MODEL) {
            printer.printModel(spec, table);
        } else {
            printer.printFluxes(table);
        }
        printer.printDiagnostics(diagnostics);
    }

    @Override
    protected String commandName() {
        return "Inspect";
    }
}
