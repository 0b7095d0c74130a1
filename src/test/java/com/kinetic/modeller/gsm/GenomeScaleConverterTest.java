package com.kinetic.modeller.gsm;

import com.kinetic.modeller.compiler.CompiledModel;
import com.kinetic.modeller.compiler.ModelCompiler;
import com.kinetic.modeller.model.Specification;
import com.kinetic.modeller.parser.SpecLoader;
import com.kinetic.modeller.parser.SpecWriter;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for converting genome-scale reaction lists into specifications.
 */
class GenomeScaleConverterTest {

    private static final List<GsmReaction> REACTIONS = List.of(
            new GsmReaction("1", "HEX1", List.of("glc__D_c", "atp_c"), List.of("g6p_c", "adp_c"), "hexokinase"),
            new GsmReaction("2", "EX_glc", List.of(), List.of("glc__D_c"), "glucose uptake"));

    private final GenomeScaleConverter converter = new GenomeScaleConverter();

    @Test
    void testStanzasAreFilled() {
        Specification spec = converter.convert(REACTIONS, GsmConversionOptions.builder()
                .modelName("ecoli core").author("lab").build());

        assertThat(spec.get(Specification.IDENTIFIERS, "name")).contains("ecoli core");
        assertThat(spec.keys(Specification.OBJECTS))
                .containsExactly("m_g6p_c", "m_adp_c", "m_glc__D_c", "m_atp_c");
        assertThat(spec.get(Specification.INITIALS, "m_atp_c")).contains("1.0E-5");
        assertThat(spec.keys(Specification.VARIABLES)).containsExactly(
                "m_HEX1_conc", "m_EX_glc_conc", "m_HEX1_kcat", "m_EX_glc_kcat", "m_HEX1_km", "m_EX_glc_km");
        assertThat(spec.get(Specification.VARIABLES, "m_HEX1_kcat")).contains("13.7");
        assertThat(spec.keys(Specification.REACTIONS)).containsExactly("R1", "R2");
    }

    @Test
    void testMichaelisMentenRateLaw() {
        assertThat(GenomeScaleConverter.rateLaw(REACTIONS.get(0))).isEqualTo(
                "(${Variables:m_HEX1_kcat} * ${Variables:m_HEX1_conc} * m_glc__D_c * m_atp_c)"
                        + "/(${Variables:m_HEX1_km} + ${Variables:m_HEX1_conc} * m_glc__D_c * m_atp_c)");
        assertThat(GenomeScaleConverter.rateLaw(REACTIONS.get(1)))
                .contains("* 1)/(").endsWith("* 1)");
    }

    @Test
    void testMetaboliteNames() {
        assertThat(GenomeScaleConverter.metaboliteName("glc D[c]")).isEqualTo("m_glcD_c_");
        assertThat(GenomeScaleConverter.metaboliteName("13dpg_c")).isEqualTo("m_13dpg_c");
    }

    @Test
    void testConvertedSpecificationCompiles() {
        Specification spec = converter.convert(REACTIONS, GsmConversionOptions.builder().build());
        Specification reloaded = new SpecLoader().parse(new SpecWriter().write(spec));

        CompiledModel model = new ModelCompiler().compile(reloaded);

        assertThat(model.size()).isEqualTo(4);
        assertThat(model.getTable().get("m_glc__D_c").orElseThrow().getInflux()).containsOnlyKeys("R2");
        assertThat(model.getTable().get("m_glc__D_c").orElseThrow().getOutflux()).containsOnlyKeys("R1");
    }
}
