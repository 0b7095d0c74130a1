package com.kinetic.modeller.model;

import com.kinetic.modeller.model.exception.ModelException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ReactionTest {

    @Test
    void testParseSidesAndRateLaw() {
        Reaction reaction = Reaction.parse("r1", "A + B -> C | k * A * B");

        assertThat(reaction.getSources()).containsExactly("A", "B");
        assertThat(reaction.getDestinations()).containsExactly("C");
        assertThat(reaction.getRateEq()).isEqualTo("k * A * B");
    }

    @Test
    void testEmptySideIsEnvironment() {
        Reaction reaction = Reaction.parse("out", "A -> | 0.1 * A");

        assertThat(reaction.getDestinations()).containsExactly(Reaction.ENVIRONMENT);
    }

    @Test
    void testOnlyFirstBarSplits() {
        Reaction reaction = Reaction.parse("r1", "A -> B | abs(A) | 2");

        assertThat(reaction.getRateEq()).isEqualTo("abs(A) | 2");
    }

    @Test
    void testMissingPartsFail() {
        assertThatThrownBy(() -> Reaction.parse("r1", "A -> B"))
                .isInstanceOf(ModelException.class)
                .hasMessageContaining("'|'");
        assertThatThrownBy(() -> Reaction.parse("r2", "A B | 1"))
                .isInstanceOf(ModelException.class)
                .hasMessageContaining("'->'");
    }
}
