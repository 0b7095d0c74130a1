package com.kinetic.modeller.codegen;

import com.kinetic.modeller.compiler.CompiledModel;
import com.kinetic.modeller.compiler.ModelCompiler;
import com.kinetic.modeller.model.Specification;
import com.kinetic.modeller.parser.SpecLoader;
import com.kinetic.modeller.simulation.Simulator;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.tools.JavaCompiler;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.lang.reflect.Method;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Compiles emitted programs with the system Java compiler and runs their {@code main}.
 */
class GeneratedProgramExecutionTest {

    private static final String CONVERSION = """
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

    @Test
    void testProgramOutputMatchesSimulator() throws Exception {
        CompilerConfig config = CompilerConfig.builder()
                .timestep(0.1)
                .endtime(10.0)
                .lowerbound(new double[] {-1.0, 0.0})
                .upperbound(new double[] {1e6, 1e6})
                .className("ConversionRun")
                .build();
        Specification spec = new SpecLoader().parse(CONVERSION);
        CompiledModel model = new ModelCompiler().compile(spec);

        List<String> printed = run(new SolverEmitter().emit(spec, model, config), "10");
        List<String> expected = new Simulator().run(model, config, 10).toCsvLines();

        assertThat(printed).hasSameSizeAs(expected);
        assertThat(printed.get(0)).isEqualTo("time,A,B");
        for (int i = 1; i < expected.size(); i++) {
            double[] actualRow = parseRow(printed.get(i));
            double[] expectedRow = parseRow(expected.get(i));
            assertThat(actualRow).hasSameSizeAs(expectedRow);
            for (int column = 0; column < expectedRow.length; column++) {
                assertThat(actualRow[column]).isCloseTo(expectedRow[column], within(1e-12));
            }
        }
    }

    @Test
    void testProgramResetsOutOfBoundValuesAfterEachStep() throws Exception {
        Specification spec = new SpecLoader().parse("""
                [Objects]
                A = drained
                B = saturated
                [Initials]
                A = -0.5
                B = 2e-3
                """);
        CompiledModel model = new ModelCompiler().compile(spec);
        CompilerConfig config = CompilerConfig.builder().timestep(1.0).endtime(2.0).className("ClampRun").build();

        List<String> printed = run(new SolverEmitter().emit(spec, model, config), "1");

        assertThat(printed).containsExactly(
                "time,A,B",
                "0.0,-0.5,0.002",
                "1.0,0.0,0.001",
                "2.0,0.0,0.001");
    }

    @Test
    void testReactionsNamedAfterJavaClassesCompile() throws Exception {
        Specification spec = new SpecLoader().parse("""
                [Objects]
                A = substrate
                B = product
                [Initials]
                A = 1
                [Reactions]
                Math = A -> B | 0.5*A^2
                Double = B -> A | exp(-B) * 0
                ODE = A -> B | 0
                """);
        CompiledModel model = new ModelCompiler().compile(spec);
        CompilerConfig config = CompilerConfig.builder().timestep(0.5).endtime(1.0).className("ShadowRun").build();

        List<String> printed = run(new SolverEmitter().emit(spec, model, config), "1");

        assertThat(printed).hasSize(3);
        assertThat(printed.get(0)).isEqualTo("time,A,B");
    }

    private List<String> run(GeneratedProgram program, String... args) throws Exception {
        Path source = program.writeTo(tempDir);
        Path classes = Files.createDirectories(tempDir.resolve("classes"));

        JavaCompiler compiler = ToolProvider.getSystemJavaCompiler();
        assertThat(compiler).as("system Java compiler").isNotNull();
        ByteArrayOutputStream diagnostics = new ByteArrayOutputStream();
        int status = compiler.run(null, null, diagnostics, "-d", classes.toString(), source.toString());
        assertThat(status).as(diagnostics.toString(StandardCharsets.UTF_8)).isZero();

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        PrintStream original = System.out;
        try (URLClassLoader loader = new URLClassLoader(new URL[] {classes.toUri().toURL()}, getClass().getClassLoader())) {
            Method main = loader.loadClass(program.getClassName()).getMethod("main", String[].class);
            System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
            main.invoke(null, (Object) args);
        } finally {
            System.setOut(original);
        }
        return out.toString(StandardCharsets.UTF_8).lines().toList();
    }

    private static double[] parseRow(String line) {
        return Arrays.stream(line.split(",")).mapToDouble(Double::parseDouble).toArray();
    }
}
