package com.kinetic.modeller.simulation;

import com.kinetic.modeller.codegen.CompilerConfig;
import com.kinetic.modeller.compiler.CompiledModel;
import com.kinetic.modeller.compiler.ModelCompiler;
import com.kinetic.modeller.model.exception.ModelException;
import com.kinetic.modeller.parser.SpecLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests: specification text through compilation to an in-process trajectory.
 */
class SimulatorTest {

    private static final CompiledModel CONVERSION = new ModelCompiler().compile(new SpecLoader().parse("""
            [Objects]
            A = substrate
            B = product
            [Initials]
            A = 10
            [Reactions]
            r1 = A -> B | 0.1*A
            """));

    private static final CompilerConfig WIDE_BOUNDS = CompilerConfig.builder()
            .timestep(0.1)
            .endtime(10.0)
            .lowerbound(new double[] {-1.0, 0.0})
            .upperbound(new double[] {1e6, 1e6})
            .build();

    @TempDir
    Path tempDir;

    private final Simulator simulator = new Simulator();

    @Test
    void testConversionConservesMass() {
        SimulationResult result = simulator.run(CONVERSION, WIDE_BOUNDS, 1);

        assertThat(result.getLabels()).containsExactly("time", "A", "B");
        assertThat(result.getRows()).hasSize(101);
        assertThat(result.getStepsTaken()).isEqualTo(100);
        assertThat(result.finalValue("A")).isCloseTo(10.0 * Math.exp(-1.0), within(1e-6));
        for (double[] row : result.getRows()) {
            assertThat(row[1] + row[2]).isCloseTo(10.0, within(1e-9));
        }
    }

    @Test
    void testSamplingAlwaysKeepsLastRow() {
        SimulationResult result = simulator.run(CONVERSION, WIDE_BOUNDS, 30);

        // rows 0, 30, 60, 90 and the final row 100
        assertThat(result.getRows()).extracting(row -> Math.round(row[0] * 10))
                .containsExactly(0L, 30L, 60L, 90L, 100L);
    }

    @Test
    void testLastRowIsNotDuplicated() {
        SimulationResult result = simulator.run(CONVERSION, WIDE_BOUNDS, 50);

        assertThat(result.getRows()).hasSize(3);
    }

    @Test
    void testDefaultBoundsResetLargeValues() {
        CompilerConfig config = CompilerConfig.builder().timestep(1.0).endtime(2.0).build();

        SimulationResult result = simulator.run(CONVERSION, config, 1);

        // A starts at 10, above the 1e-3 threshold, and is reset after the first step
        assertThat(result.getRows().get(0)[1]).isEqualTo(10.0);
        assertThat(result.getRows().get(1)[1]).isEqualTo(1e-3);
    }

    @Test
    void testInvalidSampling() {
        assertThatThrownBy(() -> simulator.run(CONVERSION, WIDE_BOUNDS, 0))
                .isInstanceOf(ModelException.class)
                .hasMessageContaining("Sampling");
    }

    @Test
    void testWriteCsv() throws IOException {
        SimulationResult result = simulator.run(CONVERSION, WIDE_BOUNDS, 100);
        Path csv = tempDir.resolve("oderesult.csv");

        result.writeCsv(csv);

        List<String> lines = Files.readAllLines(csv);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo("time,A,B");
        assertThat(lines.get(1)).isEqualTo("0.0,10.0,0.0");
    }
}
