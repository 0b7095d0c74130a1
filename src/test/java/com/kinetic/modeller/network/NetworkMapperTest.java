package com.kinetic.modeller.network;

import com.kinetic.modeller.model.Specification;
import com.kinetic.modeller.model.exception.ModelException;
import com.kinetic.modeller.parser.SpecLoader;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class NetworkMapperTest {

    private final NetworkMapper mapper = new NetworkMapper();

    @Test
    void testProjectReactionToPseudoNodes() {
        Specification spec = new SpecLoader().parse("""
                [Reactions]
                r1 = A + B -> C | 0.1*A*B
                """);

        List<String> lines = mapper.render(mapper.project(List.of(spec), NetworkFormat.SIF), NetworkFormat.SIF);

        assertThat(lines).containsExactly(
                "A cr r0s",
                "B cr r0s",
                "r0p rc C",
                "r0s rxn r0p");
    }

    @Test
    void testReactionsAreCountedAcrossSpecifications() {
        Specification first = new SpecLoader().parse("[Reactions]\nr1 = A -> B | 1\n");
        Specification second = new SpecLoader().parse("[Reactions]\nr1 = B -> | 1\n");

        List<NetworkEdge> edges = mapper.project(List.of(first, second), NetworkFormat.SIF);

        assertThat(edges).contains(
                new NetworkEdge("B", NetworkEdge.CONSUMED_BY, "r1s"),
                new NetworkEdge("r1p", NetworkEdge.PRODUCES, "X"));
        assertThat(edges).hasSize(6);
    }

    @Test
    void testFormatLookup() {
        assertThat(NetworkFormat.fromName("sif")).isEqualTo(NetworkFormat.SIF);
        assertThatThrownBy(() -> NetworkFormat.fromName("graphml"))
                .isInstanceOf(ModelException.class);
    }
}
