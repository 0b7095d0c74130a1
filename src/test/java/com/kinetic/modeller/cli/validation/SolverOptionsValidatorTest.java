package com.kinetic.modeller.cli.validation;

import com.kinetic.modeller.cli.exception.OptionsValidationException;
import com.kinetic.modeller.cli.model.SolverOptions;
import com.kinetic.modeller.codegen.CompilerConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SolverOptionsValidatorTest {

    @TempDir
    Path tempDir;

    private final SolverOptionsValidator validator = new SolverOptionsValidator();

    @Test
    void testDefaultsAreValid() {
        CompilerConfig config = validator.validate(options());

        assertThat(config.getSolver()).isEqualTo("RK4");
        assertThat(config.getTimestep()).isEqualTo(1.0);
        assertThat(config.getEndtime()).isEqualTo(21600.0);
        assertThat(config.getLowerbound()).containsExactly(0.0, 0.0);
        assertThat(config.getUpperbound()).containsExactly(1e-3, 1e-3);
        assertThat(config.getSampling()).isEqualTo(100);
        assertThat(config.getClassName()).isEqualTo("OdeProgram");
    }

    @Test
    void testAllErrorsAreCollected() {
        SolverOptions options = options("--solver", "Verlet", "--timestep", "-1", "--sampling", "0",
                "--lowerbound", "0", "--upperbound", "a;b");

        assertThatThrownBy(() -> validator.validate(options))
                .isInstanceOfSatisfying(OptionsValidationException.class, e ->
                        assertThat(e.getErrors()).hasSize(5));
    }

    @Test
    void testRequireFiles() {
        List<String> errors = new ArrayList<>();

        SolverOptionsValidator.requireFiles(List.of(tempDir, tempDir.resolve("missing.txt")), errors);

        assertThat(errors).hasSize(2);
    }

    private static SolverOptions options(String... args) {
        SolverOptions options = new SolverOptions();
        new CommandLine(options).parseArgs(args);
        return options;
    }
}
