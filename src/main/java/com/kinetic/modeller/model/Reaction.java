package com.kinetic.modeller.model;

import java.util.ArrayList;
import java.util.List;

import com.kinetic.modeller.model.exception.ModelException;

import lombok.Value;

/**
 * One entry of the Reactions stanza: {@code A + B -> C | rateLaw}.
 */
@Value
public class Reaction {

    /** Stands for the environment on a side of a reaction with no real entity. */
    public static final String ENVIRONMENT = "X";

    public static final String RATE_DELIMITER = "|";
    public static final String ARROW = "->";

    String id;
    List<String> sources;
    List<String> destinations;
    String rateEq;

    /**
     * Splits reaction text at the first {@code |} into movement and rate law, the
     * movement at {@code ->} into sides and each side at {@code +}.
     *
     * @throws ModelException when the text has no rate-law delimiter or no arrow
     */
    public static Reaction parse(String id, String text) {
        int bar = text.indexOf(RATE_DELIMITER);
        if (bar < 0) {
            throw new ModelException("Reaction '" + id + "' has no '" + RATE_DELIMITER + "' before its rate law: " + text);
        }
        String movement = text.substring(0, bar);
        String rateEq = text.substring(bar + 1).trim();

        int arrow = movement.indexOf(ARROW);
        if (arrow < 0) {
            throw new ModelException("Reaction '" + id + "' has no '" + ARROW + "' between its sides: " + text);
        }
        List<String> sources = splitSide(movement.substring(0, arrow));
        List<String> destinations = splitSide(movement.substring(arrow + ARROW.length()));
        return new Reaction(id, sources, destinations, rateEq);
    }

    private static List<String> splitSide(String side) {
        List<String> names = new ArrayList<>();
        for (String part : side.split("\\+")) {
            String name = part.trim();
            if (!name.isEmpty()) {
                names.add(name);
            }
        }
        return names.isEmpty() ? List.of(ENVIRONMENT) : List.copyOf(names);
    }
}
