package com.kinetic.modeller.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.kinetic.modeller.cli.exception.OptionsValidationException;
import com.kinetic.modeller.cli.validation.SolverOptionsValidator;
import com.kinetic.modeller.codegen.util.FileWriteUtil;
import com.kinetic.modeller.model.InterpolationMode;
import com.kinetic.modeller.model.exception.ModelException;
import com.kinetic.modeller.network.NetworkEdge;
import com.kinetic.modeller.network.NetworkFormat;
import com.kinetic.modeller.network.NetworkMapper;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Writes the reaction network of one or more specifications as an edge list.
 */
@Command(
        name = "gen-network",
        mixinStandardHelpOptions = true,
        description = "Generates a network visualisation file from model specifications."
)
public class NetworkCommand extends AbstractModelCommand {

    @Parameters(arity = "1..*", description = "Model specification files")
    private List<Path> specFiles;

    @Option(names = { "--output", "-o" }, required = true, description = "Network output file")
    private Path output;

    @Option(names = { "--format", "-f" }, defaultValue = "SIF", description = "Output format: SIF (default: ${DEFAULT-VALUE})")
    private String format;

    @Override
    protected void execute() throws IOException {
        List<String> errors = new ArrayList<>();
        SolverOptionsValidator.requireFiles(specFiles, errors);
        NetworkFormat networkFormat = null;
        try {
            networkFormat = NetworkFormat.fromName(format);
        } catch (ModelException e) {
            errors.add(e.getMessage());
        }
        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        printer.printBanner("Network", specFiles);
        NetworkMapper mapper = new NetworkMapper();
        List<NetworkEdge> edges = mapper.project(loadAll(specFiles, InterpolationMode.EXTENDED), networkFormat);
        FileWriteUtil.safeWriteLines(output, mapper.render(edges, networkFormat));
        printer.printSuccess(networkFormat + " network", output);
    }

    @Override
    protected String commandName() {
        return "Network generation";
    }
}
