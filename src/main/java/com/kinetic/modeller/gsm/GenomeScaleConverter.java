package com.kinetic.modeller.gsm;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kinetic.modeller.compiler.GraphBuilder;
import com.kinetic.modeller.model.InterpolationMode;
import com.kinetic.modeller.model.Specification;

/**
 * Turns a genome-scale reaction list into a kinetic specification with Michaelis-Menten
 * rate laws and uniform starting values.
 *
 * Every metabolite becomes an entity {@code m_<id>} and every reaction {@code R<number>} with
 * enzyme parameters {@code m_<reaction id>_conc}, {@code _kcat} and {@code _km} in Variables.
 */
public class GenomeScaleConverter {
    private static final Logger log = LoggerFactory.getLogger(GenomeScaleConverter.class);

    static final String METABOLITE_PREFIX = "m_";

    public Specification convert(List<GsmReaction> reactions, GsmConversionOptions options) {
        Specification spec = new Specification(InterpolationMode.EXTENDED);

        spec.set(Specification.SPECIFICATION, "type", GraphBuilder.SUPPORTED_TYPE);
        spec.set(Specification.IDENTIFIERS, "name", options.getModelName());
        spec.set(Specification.IDENTIFIERS, "author", options.getAuthor());

        // products first, then reactants, each metabolite once
        Set<String> metabolites = new LinkedHashSet<>();
        reactions.forEach(r -> r.getProducts().forEach(p -> metabolites.add(metaboliteName(p))));
        reactions.forEach(r -> r.getReactants().forEach(p -> metabolites.add(metaboliteName(p))));

        for (String metabolite : metabolites) {
            spec.set(Specification.OBJECTS, metabolite, metabolite);
        }
        for (String metabolite : metabolites) {
            spec.set(Specification.INITIALS, metabolite, String.valueOf(options.getMetaboliteInitial()));
        }

        for (GsmReaction reaction : reactions) {
            spec.set(Specification.VARIABLES, enzyme(reaction) + "_conc", String.valueOf(options.getEnzymeConc()));
        }
        for (GsmReaction reaction : reactions) {
            spec.set(Specification.VARIABLES, enzyme(reaction) + "_kcat", String.valueOf(options.getEnzymeKcat()));
        }
        for (GsmReaction reaction : reactions) {
            spec.set(Specification.VARIABLES, enzyme(reaction) + "_km", String.valueOf(options.getEnzymeKm()));
        }

        for (GsmReaction reaction : reactions) {
            spec.set(Specification.REACTIONS, "R" + reaction.getNumber(),
                    side(reaction.getReactants()) + " -> " + side(reaction.getProducts()) + " | " + rateLaw(reaction));
        }

        log.info("Converted {} reactions over {} metabolites", reactions.size(), metabolites.size());
        return spec;
    }

    /**
     * {@code (kcat * conc * S)/(km + conc * S)} where {@code S} is the product of the reactants,
     * or {@code 1} for a reaction without reactants.
     */
    static String rateLaw(GsmReaction reaction) {
        String enzyme = enzyme(reaction);
        String substrate = reaction.getReactants().isEmpty()
                ? "1"
                : reaction.getReactants().stream()
                        .map(GenomeScaleConverter::metaboliteName)
                        .collect(Collectors.joining(" * "));
        String kcat = "${Variables:" + enzyme + "_kcat}";
        String conc = "${Variables:" + enzyme + "_conc}";
        String km = "${Variables:" + enzyme + "_km}";
        return "(" + kcat + " * " + conc + " * " + substrate + ")/(" + km + " + " + conc + " * " + substrate + ")";
    }

    private static String side(List<String> metabolites) {
        return metabolites.stream().map(GenomeScaleConverter::metaboliteName).collect(Collectors.joining(" + "));
    }

    private static String enzyme(GsmReaction reaction) {
        return METABOLITE_PREFIX + toName(reaction.getId());
    }

    static String metaboliteName(String id) {
        return METABOLITE_PREFIX + toName(id);
    }

    /**
     * Drops whitespace and maps anything a rate law could not read as part of a name to {@code _}.
     */
    private static String toName(String id) {
        return id.replaceAll("\\s+", "").replaceAll("[^A-Za-z0-9_.]", "_");
    }
}
