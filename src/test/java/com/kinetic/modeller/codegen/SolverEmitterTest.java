package com.kinetic.modeller.codegen;

import com.kinetic.modeller.compiler.CompiledModel;
import com.kinetic.modeller.compiler.ModelCompiler;
import com.kinetic.modeller.model.Specification;
import com.kinetic.modeller.model.exception.ModelException;
import com.kinetic.modeller.parser.SpecLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the generated ODE program listing.
 */
class SolverEmitterTest {

    private static final Clock FIXED = Clock.fixed(Instant.parse("2024-01-02T03:04:05Z"), ZoneOffset.UTC);

    private static final String MODEL = """
            [Identifiers]
            name = decay
            [Objects]
            A = substrate
            B = product
            [Initials]
            A = 10
            [Reactions]
            r1 = A -> B | 0.1*A
            """;

    @TempDir
    Path tempDir;

    private final SolverEmitter emitter = new SolverEmitter(FIXED);

    @Test
    void testProgramContainsHeaderAndDerivatives() {
        GeneratedProgram program = emit(MODEL, CompilerConfig.defaults());
        String source = program.getSource();

        assertThat(program.fileName()).isEqualTo("OdeProgram.java");
        assertThat(source).contains("// Generated by kinetic-modeller");
        assertThat(source).contains("// Generated at: 2024-01-02T03:04:05Z");
        assertThat(source).contains("// Solver: RK4 (order 4, fixed step)");
        assertThat(source).contains("//   name: decay");
        assertThat(source).contains("public class OdeProgram {");
        assertThat(source).contains("static double d_A(double t, double[] y) {");
        assertThat(source).contains("double r1 = 0.1 * y[0];    // r1");
        assertThat(source).contains("return (0) - (r1);");
        assertThat(source).contains("return (r1) - (0);");
    }

    @Test
    void testMainDeclaresStateAndSolverCall() {
        String source = emit(MODEL, CompilerConfig.defaults()).getSource();

        assertThat(source).contains("Derivative[] ODE = new Derivative[2];");
        assertThat(source).contains("ODE[0] = OdeProgram::d_A;");
        assertThat(source).contains("ODE[1] = OdeProgram::d_B;");
        assertThat(source).contains("y[0] = 10.0;    // A : substrate");
        assertThat(source).contains("y[1] = 0.0;    // B : product");
        assertThat(source).contains("String[] labels = {\"time\", \"A\", \"B\"};");
        assertThat(source).contains("{0.0, 0.0},");
        assertThat(source).contains("{0.001, 0.001}");
        assertThat(source).contains("double timestep = 1.0;");
        assertThat(source).contains("double endtime = 21600.0;");
        assertThat(source).contains("Solver model = new Solver(ODE, 0.0, y, timestep, endtime, null, lowerbound, upperbound);");
        assertThat(source).contains(": 100);");
    }

    @Test
    void testSelectedTableauIsEmitted() {
        CompilerConfig config = CompilerConfig.builder().solver("euler").className("DecayRun").build();

        GeneratedProgram program = emit(MODEL, config);

        assertThat(program.getSolver().getDisplayName()).isEqualTo("Euler");
        assertThat(program.getSource()).contains("public class DecayRun {");
        assertThat(program.getSource()).contains("static final double[] C = {0.0};");
        assertThat(program.getSource()).contains("static final double[] B = {1.0};");
    }

    @Test
    void testSharedRateLawGetsOneLocalPerReaction() {
        String source = emit("""
                [Objects]
                A = pool
                [Reactions]
                in = -> A | 2 ^ 3
                loop = A -> A | 0.5*A
                """, CompilerConfig.defaults()).getSource();

        assertThat(source).contains("double in = Math.pow(2.0, 3.0);");
        assertThat(source).contains("double loop = 0.5 * y[0];");
        assertThat(source).contains("return (in + loop) - (loop);");
    }

    @Test
    void testAwkwardNamesAreSanitized() {
        String source = emit("""
                [Objects]
                glc.D = glucose
                main = clashes with main
                [Reactions]
                1st = glc.D -> main | -glc.D
                """, CompilerConfig.defaults()).getSource();

        assertThat(source).contains("static double d_glc_D(double t, double[] y)");
        assertThat(source).contains("static double d_main(double t, double[] y)");
        assertThat(source).contains("double _1st = (-y[0]);");
        assertThat(source).contains("\"glc.D\"");
    }

    @Test
    void testUnknownSolverFails() {
        CompilerConfig config = CompilerConfig.builder().solver("Verlet").build();

        assertThatThrownBy(() -> emit(MODEL, config))
                .isInstanceOf(ModelException.class)
                .hasMessageContaining("Verlet");
    }

    @Test
    void testInvalidClassNameFails() {
        CompilerConfig config = CompilerConfig.builder().className("class").build();

        assertThatThrownBy(() -> emit(MODEL, config))
                .isInstanceOf(ModelException.class)
                .hasMessageContaining("class name");
    }

    @Test
    void testWriteToDirectory() throws IOException {
        GeneratedProgram program = emit(MODEL, CompilerConfig.defaults());

        Path written = program.writeTo(tempDir);

        assertThat(written).isEqualTo(tempDir.resolve("OdeProgram.java"));
        assertThat(Files.readString(written)).isEqualTo(program.getSource());
    }

    @Test
    void testParseBound() {
        assertThat(CompilerConfig.parseBound("1e-3; 0")).containsExactly(1e-3, 0.0);
        assertThatThrownBy(() -> CompilerConfig.parseBound("1e-3"))
                .hasMessageContaining("threshold;reset");
    }

    private GeneratedProgram emit(String text, CompilerConfig config) {
        Specification spec = new SpecLoader().parse(text);
        CompiledModel model = new ModelCompiler().compile(spec);
        return emitter.emit(spec, model, config);
    }
}
