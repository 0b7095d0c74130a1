package com.kinetic.modeller.analysis;

import com.kinetic.modeller.codegen.CompilerConfig;
import com.kinetic.modeller.model.InterpolationMode;
import com.kinetic.modeller.model.Specification;
import com.kinetic.modeller.model.exception.ModelException;
import com.kinetic.modeller.parser.SpecLoader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SensitivityAnalyzerTest {

    private static final String MODEL = """
            [Objects]
            A = substrate
            B = product
            [Initials]
            A = 10
            [Variables]
            k = 0.1
            label = fast
            [Reactions]
            r1 = A -> B | ${Variables:k} * A
            """;

    private static final CompilerConfig CONFIG = CompilerConfig.builder()
            .timestep(0.1)
            .endtime(5.0)
            .sampling(10)
            .lowerbound(new double[] {-1.0, 0.0})
            .upperbound(new double[] {1e6, 1e6})
            .build();

    private final SensitivityAnalyzer analyzer = new SensitivityAnalyzer();

    @Test
    void testReducedKeepsOneRowPerModel() {
        SensitivityResult result = analyzer.analyze(spec(), 2.0, OutputFormat.REDUCED, CONFIG);

        assertThat(result.header()).containsExactly("Parameter", "Change", "time", "A", "B");
        assertThat(result.getRows()).extracting(SensitivityRow::getParameter).containsExactly("original", "k");
        assertThat(result.getRows().get(0).getChange()).isEqualTo("None");
        assertThat(result.getRows().get(1).getChange()).isEqualTo("0.1 --> 0.2");
        assertThat(result.getSkippedParameters()).containsExactly("label");
    }

    @Test
    void testFasterRateConsumesMoreSubstrate() {
        SensitivityResult result = analyzer.analyze(spec(), 2.0, OutputFormat.REDUCED, CONFIG);

        double baseline = result.rowsFor("original").get(0).getValues()[1];
        double perturbed = result.rowsFor("k").get(0).getValues()[1];
        assertThat(baseline).isCloseTo(10.0 * Math.exp(-0.5), within(1e-6));
        assertThat(perturbed).isCloseTo(10.0 * Math.exp(-1.0), within(1e-6));
    }

    @Test
    void testFullKeepsSampledRows() {
        SensitivityResult result = analyzer.analyze(spec(), 2.0, OutputFormat.FULL, CONFIG);

        // 51 rows sampled every 10th: 0, 10, 20, 30, 40, 50
        assertThat(result.rowsFor("original")).hasSize(6);
        assertThat(result.rowsFor("k")).hasSize(6);
    }

    @Test
    void testInputSpecificationIsUnchanged() {
        Specification spec = spec();
        Specification before = spec.copy();

        analyzer.analyze(spec, 100, OutputFormat.REDUCED, CONFIG);

        assertThat(spec).isEqualTo(before);
    }

    @Test
    void testCsvLines() {
        List<String> lines = analyzer.analyze(spec(), 2.0, OutputFormat.REDUCED, CONFIG).toCsvLines();

        assertThat(lines).hasSize(3);
        assertThat(lines.get(0)).isEqualTo("Parameter,Change,time,A,B");
        assertThat(lines.get(1)).startsWith("original,None,");
    }

    @Test
    void testOutputFormatLookup() {
        assertThat(OutputFormat.fromName("Full")).isEqualTo(OutputFormat.FULL);
        assertThatThrownBy(() -> OutputFormat.fromName("partial")).isInstanceOf(ModelException.class);
        assertThatThrownBy(() -> OutputFormat.fromName(null)).isInstanceOf(ModelException.class);
    }

    private static Specification spec() {
        return new SpecLoader(InterpolationMode.BASIC).parse(MODEL);
    }
}
