package com.kinetic.modeller.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.kinetic.modeller.cli.exception.OptionsValidationException;
import com.kinetic.modeller.cli.validation.SolverOptionsValidator;
import com.kinetic.modeller.gsm.GenomeScaleConverter;
import com.kinetic.modeller.gsm.GsmConversionOptions;
import com.kinetic.modeller.gsm.GsmReaction;
import com.kinetic.modeller.gsm.GsmReactionReader;
import com.kinetic.modeller.model.Specification;
import com.kinetic.modeller.parser.SpecWriter;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Converts a genome-scale reaction list into a kinetic model specification.
 */
@Command(
        name = "gsm-to-spec",
        mixinStandardHelpOptions = true,
        description = "Converts a tab-separated genome-scale reaction list into a Michaelis-Menten model specification."
)
public class GsmToSpecCommand extends AbstractModelCommand {

    @Parameters(index = "0", description = "Reaction list: number, id, reactants, products, name (tab-separated)")
    private Path reactionFile;

    @Option(names = { "--output", "-o" }, required = true, description = "Specification output file")
    private Path output;

    @Option(names = { "--model-name", "-n" }, defaultValue = "", description = "Model name written to Identifiers")
    private String modelName;

    @Option(names = { "--author", "-a" }, defaultValue = "", description = "Author written to Identifiers")
    private String author;

    @Option(names = { "--metabolite-initial" }, defaultValue = "1e-5", description = "Initial value of every metabolite (default: ${DEFAULT-VALUE})")
    private double metaboliteInitial;

    @Option(names = { "--enzyme-conc" }, defaultValue = "1e-6", description = "Enzyme concentration of every reaction (default: ${DEFAULT-VALUE})")
    private double enzymeConc;

    @Option(names = { "--enzyme-kcat" }, defaultValue = "13.7", description = "Turnover number of every reaction (default: ${DEFAULT-VALUE})")
    private double enzymeKcat;

    @Option(names = { "--enzyme-km" }, defaultValue = "1.3e-4", description = "Michaelis constant of every reaction (default: ${DEFAULT-VALUE})")
    private double enzymeKm;

    @Override
    protected void execute() throws IOException {
        List<String> errors = new ArrayList<>();
        SolverOptionsValidator.requireFiles(List.of(reactionFile), errors);
        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        printer.printBanner("Genome-scale Conversion", List.of(reactionFile));
        List<GsmReaction> reactions = new GsmReactionReader().read(reactionFile);
        GsmConversionOptions options = GsmConversionOptions.builder()
                .modelName(modelName)
                .author(author)
                .metaboliteInitial(metaboliteInitial)
                .enzymeConc(enzymeConc)
                .enzymeKcat(enzymeKcat)
                .enzymeKm(enzymeKm)
                .build();
        Specification spec = new GenomeScaleConverter().convert(reactions, options);

        new SpecWriter().write(spec, output);
        printer.printSuccess("Model specification", output);
    }

    @Override
    protected String commandName() {
        return "Genome-scale conversion";
    }
}
