package com.kinetic.modeller.parser;

import java.util.ArrayDeque;
import java.util.Deque;

import com.kinetic.modeller.model.InterpolationMode;
import com.kinetic.modeller.model.Specification;
import com.kinetic.modeller.parser.exception.ParseException;

/**
 * Expands references inside raw specification values.
 *
 * Extended references are resolved recursively; the chain of keys currently being
 * expanded is tracked so that a cycle is reported instead of recursing forever.
 */
public final class ValueInterpolator {

    private ValueInterpolator() {
        // Utility class
    }

    public static String resolve(Specification spec, String stanza, String key) {
        return resolve(spec, stanza, key, new ArrayDeque<>());
    }

    private static String resolve(Specification spec, String stanza, String key, Deque<String> chain) {
        String raw = spec.getRaw(stanza, key).orElseThrow(
                () -> new ParseException("Bad interpolation reference: no key '" + key + "' in stanza [" + stanza + "]"));
        String ref = stanza + ":" + key;
        if (chain.contains(ref)) {
            throw new ParseException("Interpolation cycle detected: " + String.join(" -> ", chain) + " -> " + ref);
        }
        chain.addLast(ref);
        try {
            return spec.getMode() == InterpolationMode.EXTENDED
                    ? expandExtended(spec, stanza, raw, chain)
                    : expandBasic(spec, stanza, raw, chain);
        } finally {
            chain.removeLast();
        }
    }

    private static String expandExtended(Specification spec, String stanza, String raw, Deque<String> chain) {
        StringBuilder sb = new StringBuilder();
        int pos = 0;
        while (pos < raw.length()) {
            char c = raw.charAt(pos);
            if (c != '$') {
                sb.append(c);
                pos++;
                continue;
            }
            char next = pos + 1 < raw.length() ? raw.charAt(pos + 1) : '\0';
            if (next == '$') {
                sb.append('$');
                pos += 2;
            } else if (next == '{') {
                int close = raw.indexOf('}', pos + 2);
                if (close < 0) {
                    throw new ParseException("Unterminated '${' in value: " + raw);
                }
                String reference = raw.substring(pos + 2, close);
                sb.append(lookupExtended(spec, stanza, reference, chain));
                pos = close + 1;
            } else {
                throw new ParseException("'$' must be followed by '$' or '{', found: " + raw.substring(pos));
            }
        }
        return sb.toString();
    }

    private static String lookupExtended(Specification spec, String stanza, String reference, Deque<String> chain) {
        String[] parts = reference.split(":", -1);
        String targetStanza;
        String targetKey;
        if (parts.length == 1) {
            targetStanza = stanza;
            targetKey = parts[0];
        } else if (parts.length == 2) {
            targetStanza = parts[0];
            targetKey = parts[1];
        } else {
            throw new ParseException("More than one ':' in interpolation reference: ${" + reference + "}");
        }
        if (!spec.hasStanza(targetStanza)) {
            throw new ParseException("Bad interpolation reference: no stanza [" + targetStanza + "] for ${" + reference + "}");
        }
        if (!spec.contains(targetStanza, targetKey)) {
            throw new ParseException("Bad interpolation reference: no key '" + targetKey + "' in stanza ["
                    + targetStanza + "] for ${" + reference + "}");
        }
        return resolve(spec, targetStanza, targetKey, chain);
    }

    private static String expandBasic(Specification spec, String stanza, String raw, Deque<String> chain) {
        StringBuilder sb = new StringBuilder();
        int pos = 0;
        while (pos < raw.length()) {
            char c = raw.charAt(pos);
            if (c != '%') {
                sb.append(c);
                pos++;
                continue;
            }
            char next = pos + 1 < raw.length() ? raw.charAt(pos + 1) : '\0';
            if (next == '%') {
                sb.append('%');
                pos += 2;
            } else if (next == '(') {
                int close = raw.indexOf(")s", pos + 2);
                if (close < 0) {
                    throw new ParseException("Bad interpolation variable reference: " + raw.substring(pos));
                }
                String targetKey = raw.substring(pos + 2, close);
                if (!spec.contains(stanza, targetKey)) {
                    throw new ParseException("Bad interpolation reference: no key '" + targetKey + "' in stanza [" + stanza + "]");
                }
                sb.append(resolve(spec, stanza, targetKey, chain));
                pos = close + 2;
            } else {
                throw new ParseException("'%' must be followed by '%' or '(', found: " + raw.substring(pos));
            }
        }
        return sb.toString();
    }
}
