package com.kinetic.modeller.cli;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.kinetic.modeller.cli.exception.OptionsValidationException;
import com.kinetic.modeller.model.ReactionBound;
import com.kinetic.modeller.parser.BoundOverrideParser;

import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Validates mutation and medium-change strings before they are handed to flux-balance tooling.
 */
@Command(
        name = "check-overrides",
        mixinStandardHelpOptions = true,
        description = "Parses mutation (id,upper,lower;...) and medium change (id,value;...) strings and prints them."
)
public class CheckOverridesCommand extends AbstractModelCommand {

    @Option(names = { "--mutation" }, description = "Reaction bound overrides, e.g. NNAM,100,0;RBFK,0,0")
    private String mutation;

    @Option(names = { "--medium" }, description = "Medium changes, e.g. EX_o2_e,0;EX_glc__D_e,5.0")
    private String medium;

    @Override
    protected void execute() {
        List<String> errors = new ArrayList<>();
        if (mutation == null && medium == null) {
            errors.add("At least one of --mutation or --medium is required.");
            throw new OptionsValidationException(errors);
        }

        BoundOverrideParser parser = new BoundOverrideParser();
        Map<String, ReactionBound> mutations = parser.parseMutations(mutation);
        Map<String, Double> changes = parser.parseMediumChanges(medium);
        printer.printOverrides(mutations, changes);
    }

    @Override
    protected String commandName() {
        return "Override check";
    }
}
