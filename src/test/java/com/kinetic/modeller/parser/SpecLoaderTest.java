package com.kinetic.modeller.parser;

import com.kinetic.modeller.model.InterpolationMode;
import com.kinetic.modeller.model.Specification;
import com.kinetic.modeller.parser.exception.ParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for SpecLoader and value interpolation.
 */
class SpecLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testParseStanzasInDeclarationOrder() {
        Specification spec = new SpecLoader().parse("""
                [Identifiers]
                name = decay
                [Objects]
                A = substrate
                B : product
                [Initials]
                A = 10
                """);

        assertThat(spec.stanzaNames()).containsExactly("Identifiers", "Objects", "Initials");
        assertThat(spec.keys(Specification.OBJECTS)).containsExactly("A", "B");
        assertThat(spec.get(Specification.OBJECTS, "B")).contains("product");
        assertThat(spec.get(Specification.INITIALS, "A")).contains("10");
    }

    @Test
    void testSplitAtFirstDelimiterOnly() {
        Specification spec = new SpecLoader(InterpolationMode.BASIC).parse("""
                [Reactions]
                r1 = A -> B | k=1: 0.1*A
                """);

        assertThat(spec.getRaw(Specification.REACTIONS, "r1")).contains("A -> B | k=1: 0.1*A");
    }

    @Test
    void testCommentsAreSkipped() {
        Specification spec = new SpecLoader().parse("""
                # whole line comment
                ; another one
                [Objects]
                A = substrate   # trailing comment
                G6P = glucose;6P
                """);

        assertThat(spec.get(Specification.OBJECTS, "A")).contains("substrate");
        assertThat(spec.get(Specification.OBJECTS, "G6P")).contains("glucose;6P");
    }

    @Test
    void testContinuationLinesAreJoined() {
        Specification spec = new SpecLoader().parse("""
                [Reactions]
                r1 = A -> B |
                    0.1 * A
                r2 = B -> C | 0.2 * B
                """);

        assertThat(spec.getRaw(Specification.REACTIONS, "r1")).contains("A -> B |\n0.1 * A");
        assertThat(spec.getRaw(Specification.REACTIONS, "r2")).contains("B -> C | 0.2 * B");
    }

    @Test
    void testLaterKeyWins() {
        Specification spec = new SpecLoader().parse("""
                [Initials]
                A = 1
                A = 2
                """);

        assertThat(spec.size(Specification.INITIALS)).isEqualTo(1);
        assertThat(spec.get(Specification.INITIALS, "A")).contains("2");
    }

    @Test
    void testExtendedInterpolationAcrossStanzas() {
        Specification spec = new SpecLoader(InterpolationMode.EXTENDED).parse("""
                [Variables]
                k = 0.1
                k2 = ${k}
                [Reactions]
                r1 = A -> B | ${Variables:k2} * A
                price = $$5
                """);

        assertThat(spec.get(Specification.REACTIONS, "r1")).contains("A -> B | 0.1 * A");
        assertThat(spec.get(Specification.REACTIONS, "price")).contains("$5");
        assertThat(spec.getRaw(Specification.REACTIONS, "r1")).contains("A -> B | ${Variables:k2} * A");
    }

    @Test
    void testBasicInterpolationWithinStanza() {
        Specification spec = new SpecLoader(InterpolationMode.BASIC).parse("""
                [Variables]
                k = 0.1
                rate = %(k)s * 2
                percent = 50%%
                """);

        assertThat(spec.get(Specification.VARIABLES, "rate")).contains("0.1 * 2");
        assertThat(spec.get(Specification.VARIABLES, "percent")).contains("50%");
    }

    @Test
    void testBadReferenceFailsOnRead() {
        Specification spec = new SpecLoader().parse("""
                [Reactions]
                r1 = A -> B | ${Variables:missing} * A
                """);

        assertThatThrownBy(() -> spec.get(Specification.REACTIONS, "r1"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Variables");
    }

    @Test
    void testInterpolationCycleIsReported() {
        Specification spec = new SpecLoader().parse("""
                [Variables]
                a = ${b}
                b = ${a}
                """);

        assertThatThrownBy(() -> spec.get(Specification.VARIABLES, "a"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("cycle");
    }

    @Test
    void testEntryBeforeHeaderIsRejected() {
        assertThatThrownBy(() -> new SpecLoader().parse("A = 1\n[Objects]\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("line 1");
    }

    @Test
    void testLineWithoutDelimiterIsRejected() {
        assertThatThrownBy(() -> new SpecLoader().parse("[Objects]\nA substrate\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("line 2");
    }

    @Test
    void testMalformedHeaderIsRejected() {
        assertThatThrownBy(() -> new SpecLoader().parse("[Objects\nA = 1\n"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Malformed stanza header");
    }

    @Test
    void testLoadFromFile() throws IOException {
        Path file = tempDir.resolve("model.txt");
        Files.writeString(file, "[Objects]\nA = substrate\n");

        Specification spec = new SpecLoader().load(file);

        assertThat(spec.keys(Specification.OBJECTS)).containsExactly("A");
    }

    @Test
    void testStripInlineCommentNeedsWhitespace() {
        assertThat(SpecLoader.stripInlineComment("A = x # note")).isEqualTo("A = x ");
        assertThat(SpecLoader.stripInlineComment("A = x#y")).isEqualTo("A = x#y");
    }
}
