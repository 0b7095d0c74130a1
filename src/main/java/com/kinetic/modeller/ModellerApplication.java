package com.kinetic.modeller;

import com.kinetic.modeller.cli.ModellerCommand;
import picocli.CommandLine;

/**
 * Main entry point for the kinetic modeller.
 * Compiles reaction network specifications into ODE programs, simulates them and
 * merges several specifications into one network.
 */
public class ModellerApplication {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String... args) {
        return new CommandLine(new ModellerCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
