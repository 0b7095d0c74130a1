package com.kinetic.modeller.cli;

import java.util.concurrent.Callable;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Root command; all work is done by the subcommands.
 */
@Command(
        name = "kinetic-modeller",
        mixinStandardHelpOptions = true,
        version = "kinetic-modeller 1.0.0",
        description = "Compiles reaction network specifications into ODE programs, simulates and merges them.",
        subcommands = {
                InspectCommand.class,
                GenerateOdeCommand.class,
                SimulateCommand.class,
                MergeCommand.class,
                NetworkCommand.class,
                SensitivityCommand.class,
                GsmToSpecCommand.class,
                CheckOverridesCommand.class
        }
)
public class ModellerCommand implements Callable<Integer> {

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
