package com.kinetic.modeller.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.kinetic.modeller.cli.exception.OptionsValidationException;
import com.kinetic.modeller.cli.validation.SolverOptionsValidator;
import com.kinetic.modeller.merge.MergeResult;
import com.kinetic.modeller.merge.ModelMerger;
import com.kinetic.modeller.model.InterpolationMode;
import com.kinetic.modeller.model.Specification;
import com.kinetic.modeller.parser.SpecWriter;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Merges specifications into one, renumbering reactions so their ids stay unique.
 * Specifications are read without extended interpolation so references are written back unchanged.
 */
@Command(
        name = "merge",
        mixinStandardHelpOptions = true,
        description = "Merges several model specifications into a single specification."
)
public class MergeCommand extends AbstractModelCommand {

    @Parameters(arity = "1..*", description = "Model specification files, in merge order")
    private List<Path> specFiles;

    @Option(names = { "--output", "-o" }, required = true, description = "Merged specification file")
    private Path output;

    @Option(names = { "--prefix", "-p" }, defaultValue = ModelMerger.DEFAULT_PREFIX, description = "Prefix for renumbered reaction ids (default: ${DEFAULT-VALUE})")
    private String prefix;

    @Override
    protected void execute() throws IOException {
        List<String> errors = new ArrayList<>();
        SolverOptionsValidator.requireFiles(specFiles, errors);
        if (prefix == null || prefix.isBlank()) {
            errors.add("Prefix must not be blank (--prefix / -p).");
        }
        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        printer.printBanner("Merge", specFiles);
        List<Specification> specs = loadAll(specFiles, InterpolationMode.BASIC);
        MergeResult result = new ModelMerger().merge(specs, List.of(), prefix, true, false);

        new SpecWriter().write(result.getSpecification(), output);
        printer.printMergeSummary(result);
        printer.printSuccess("Merged specification", output);
    }

    @Override
    protected String commandName() {
        return "Merge";
    }
}
