package com.kinetic.modeller.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kinetic.modeller.model.InterpolationMode;
import com.kinetic.modeller.model.Specification;
import com.kinetic.modeller.parser.exception.ParseException;

/**
 * Parser for sectioned model specification files.
 *
 * Format:
 * - Stanza header: [Objects]
 * - Entry: A = substrate  or  A : substrate (split at the first delimiter)
 * - Continuation: a line indented deeper than its key line extends the value
 * - Comments: lines starting with # or ;, and inline # or ; after whitespace
 *
 * Values are kept raw; interpolation happens when they are read from the
 * returned {@link Specification}.
 */
public class SpecLoader {
    private static final Logger log = LoggerFactory.getLogger(SpecLoader.class);

    private final InterpolationMode mode;

    public SpecLoader() {
        this(InterpolationMode.EXTENDED);
    }

    public SpecLoader(InterpolationMode mode) {
        this.mode = mode;
    }

    public Specification load(Path specFile) throws IOException {
        log.debug("Reading specification: {}", specFile);
        return parse(Files.readAllLines(specFile, StandardCharsets.UTF_8));
    }

    public Specification parse(String text) {
        return parse(text.lines().toList());
    }

    public Specification parse(List<String> lines) {
        Specification spec = new Specification(mode);

        String stanza = null;
        String key = null;
        int keyIndent = -1;

        int lineNum = 0;
        for (String line : lines) {
            lineNum++;

            String trimmed = line.strip();
            if (trimmed.isEmpty() || trimmed.startsWith("#") || trimmed.startsWith(";")) {
                continue;
            }

            int indent = indentOf(line);
            String content = stripInlineComment(line).strip();
            if (content.isEmpty()) {
                continue;
            }

            // Continuation of the previous value
            if (key != null && indent > keyIndent) {
                String previous = spec.getRaw(stanza, key).orElse("");
                spec.set(stanza, key, previous.isEmpty() ? content : previous + "\n" + content);
                continue;
            }

            if (content.startsWith("[")) {
                stanza = parseHeader(content, lineNum);
                spec.addStanza(stanza);
                key = null;
                keyIndent = -1;
                continue;
            }

            if (stanza == null) {
                throw new ParseException("Entry found before any stanza header: " + content, lineNum);
            }

            int delimiter = delimiterIndex(content);
            if (delimiter < 0) {
                throw new ParseException("Cannot split into key and value (expected '=' or ':'): " + content, lineNum);
            }
            String entryKey = content.substring(0, delimiter).strip();
            if (entryKey.isEmpty()) {
                throw new ParseException("Empty key in stanza [" + stanza + "]: " + content, lineNum);
            }
            String value = content.substring(delimiter + 1).strip();

            if (spec.contains(stanza, entryKey)) {
                log.debug("Key '{}' repeated in stanza [{}] at line {}, later value wins", entryKey, stanza, lineNum);
            }
            spec.set(stanza, entryKey, value);
            key = entryKey;
            keyIndent = indent;
        }

        return spec;
    }

    private String parseHeader(String content, int lineNum) {
        if (!content.endsWith("]")) {
            throw new ParseException("Malformed stanza header: " + content, lineNum);
        }
        String name = content.substring(1, content.length() - 1).strip();
        if (name.isEmpty()) {
            throw new ParseException("Empty stanza name", lineNum);
        }
        return name;
    }

    private static int delimiterIndex(String content) {
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '=' || c == ':') {
                return i;
            }
        }
        return -1;
    }

    private static int indentOf(String line) {
        int i = 0;
        while (i < line.length() && Character.isWhitespace(line.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * Inline comments need whitespace before the prefix, so values such as
     * "glucose;6P" survive.
     */
    static String stripInlineComment(String line) {
        for (int i = 1; i < line.length(); i++) {
            char c = line.charAt(i);
            if ((c == '#' || c == ';') && Character.isWhitespace(line.charAt(i - 1))) {
                return line.substring(0, i);
            }
        }
        return line;
    }
}
