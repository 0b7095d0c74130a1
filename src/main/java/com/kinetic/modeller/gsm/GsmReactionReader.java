package com.kinetic.modeller.gsm;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kinetic.modeller.parser.exception.ParseException;

/**
 * Reads a tab-separated reaction list: number, id, reactants, products, name.
 *
 * Reactants and products are {@code ;}-separated metabolite ids and may be empty. Blank
 * lines, {@code #} comments and a header line starting with {@code rxn_no} are skipped.
 */
public class GsmReactionReader {
    private static final Logger log = LoggerFactory.getLogger(GsmReactionReader.class);

    private static final String HEADER_START = "rxn_no";
    private static final int MIN_COLUMNS = 4;

    public List<GsmReaction> read(Path file) throws IOException {
        log.debug("Reading reaction list {}", file);
        return parse(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    public List<GsmReaction> parse(List<String> lines) {
        List<GsmReaction> reactions = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank() || line.trim().startsWith("#") || line.startsWith(HEADER_START)) {
                continue;
            }
            String[] columns = line.split("\t", -1);
            if (columns.length < MIN_COLUMNS) {
                throw new ParseException("Expected at least " + MIN_COLUMNS + " tab-separated columns, got "
                        + columns.length, i + 1);
            }
            String number = columns[0].trim();
            String id = columns[1].trim();
            if (number.isEmpty() || id.isEmpty()) {
                throw new ParseException("Reaction number and id are required", i + 1);
            }
            String name = columns.length > MIN_COLUMNS ? columns[MIN_COLUMNS].trim() : "";
            reactions.add(new GsmReaction(number, id, splitIds(columns[2]), splitIds(columns[3]), name));
        }
        return reactions;
    }

    private static List<String> splitIds(String column) {
        return Arrays.stream(column.split(";"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
