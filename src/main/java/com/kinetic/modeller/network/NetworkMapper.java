package com.kinetic.modeller.network;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kinetic.modeller.model.Reaction;
import com.kinetic.modeller.model.Specification;
import com.kinetic.modeller.model.exception.ModelException;

/**
 * Projects the reactions of one or more specifications onto a pairwise edge list.
 *
 * Reaction {@code i} (counted from zero across all specifications) becomes two pseudo-nodes
 * {@code r<i>s} and {@code r<i>p}: every source is linked to the first ({@code cr}), the second
 * to every destination ({@code rc}), and the two to each other ({@code rxn}).
 */
public class NetworkMapper {
    private static final Logger log = LoggerFactory.getLogger(NetworkMapper.class);

    public List<NetworkEdge> project(List<Specification> specs, NetworkFormat format) {
        if (format == null) {
            throw new ModelException("Network format is missing");
        }

        List<NetworkEdge> edges = new ArrayList<>();
        int index = 0;
        for (Specification spec : specs) {
            for (String id : spec.keys(Specification.REACTIONS)) {
                Reaction reaction = Reaction.parse(id, spec.get(Specification.REACTIONS, id).orElse(""));
                String substrate = "r" + index + "s";
                String product = "r" + index + "p";
                for (String source : reaction.getSources()) {
                    edges.add(new NetworkEdge(source, NetworkEdge.CONSUMED_BY, substrate));
                }
                for (String destination : reaction.getDestinations()) {
                    edges.add(new NetworkEdge(product, NetworkEdge.PRODUCES, destination));
                }
                edges.add(new NetworkEdge(substrate, NetworkEdge.REACTION, product));
                index++;
            }
        }

        log.info("Projected {} reactions into {} {} edges", index, edges.size(), format);
        return edges;
    }

    /**
     * Lines of the edge list in the requested format.
     */
    public List<String> render(List<NetworkEdge> edges, NetworkFormat format) {
        switch (format) {
            case SIF:
                return edges.stream().map(NetworkEdge::toSif).collect(Collectors.toList());
            default:
                throw new ModelException("Unsupported network format: " + format);
        }
    }
}
