package com.kinetic.modeller.parser;

import java.util.LinkedHashMap;
import java.util.Map;

import com.kinetic.modeller.model.ReactionBound;
import com.kinetic.modeller.parser.exception.ParseException;

/**
 * Parses the override strings handed to the flux-balance tooling.
 *
 * Mutations are {@code id,upper,lower;id,upper,lower;...} (so {@code RBFK,0,0} is a knock-out),
 * medium changes are {@code id,value;id,value;...}. Blank entries are ignored; a later entry for
 * the same id replaces an earlier one.
 */
public class BoundOverrideParser {

    private static final String ENTRY_SEPARATOR = ";";
    private static final String FIELD_SEPARATOR = ",";

    public Map<String, ReactionBound> parseMutations(String text) {
        Map<String, ReactionBound> mutations = new LinkedHashMap<>();
        for (String entry : entries(text)) {
            if (entry.isBlank()) {
                continue;
            }
            String[] fields = fields(entry, 3, "id,upper,lower");
            mutations.put(fields[0], new ReactionBound(number(fields[1], entry), number(fields[2], entry)));
        }
        return mutations;
    }

    public Map<String, Double> parseMediumChanges(String text) {
        Map<String, Double> changes = new LinkedHashMap<>();
        for (String entry : entries(text)) {
            if (entry.isBlank()) {
                continue;
            }
            String[] fields = fields(entry, 2, "id,value");
            changes.put(fields[0], number(fields[1], entry));
        }
        return changes;
    }

    private static String[] entries(String text) {
        if (text == null || text.isBlank()) {
            return new String[0];
        }
        return text.split(ENTRY_SEPARATOR);
    }

    private static String[] fields(String entry, int expected, String form) {
        String[] fields = entry.split(FIELD_SEPARATOR, -1);
        if (fields.length != expected) {
            throw new ParseException("Expected '" + form + "' but got '" + entry.trim() + "'");
        }
        for (int i = 0; i < fields.length; i++) {
            fields[i] = fields[i].trim();
        }
        if (fields[0].isEmpty()) {
            throw new ParseException("Missing id in '" + entry.trim() + "'");
        }
        return fields;
    }

    private static double number(String field, String entry) {
        try {
            return Double.parseDouble(field);
        } catch (NumberFormatException e) {
            throw new ParseException("Not a number: '" + field + "' in '" + entry.trim() + "'");
        }
    }
}
