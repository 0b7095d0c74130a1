package com.kinetic.modeller.codegen.util;

import java.util.Set;

import javax.lang.model.SourceVersion;

/**
 * Utility for turning entity and reaction names into Java identifiers.
 */
public class NamingUtil {

    // names a derivative body reads: its parameters, the classes rendered expressions call,
    // and the generated program's own members
    private static final Set<String> RESERVED_LOCALS = Set.of(
            "t", "y", "Math", "Double", "String", "System", "A", "B", "C", "ODE");

    private NamingUtil() {
        // Utility class
    }

    /**
     * Replaces every character that cannot appear in a Java identifier with {@code _}.
     * A leading digit is prefixed with {@code _}.
     */
    public static String sanitize(String name) {
        if (name == null || name.isEmpty()) {
            return "_";
        }
        StringBuilder sb = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            sb.append(Character.isJavaIdentifierPart(c) && c != '$' ? c : '_');
        }
        if (!Character.isJavaIdentifierStart(sb.charAt(0))) {
            sb.insert(0, '_');
        }
        return sb.toString();
    }

    /**
     * {@code base}, or {@code base_2}, {@code base_3}... whichever is not yet used.
     * The chosen name is added to {@code usedNames}.
     */
    public static String disambiguate(String base, Set<String> usedNames) {
        String candidate = base;
        int suffix = 2;
        while (usedNames.contains(candidate)) {
            candidate = base + "_" + suffix;
            suffix++;
        }
        usedNames.add(candidate);
        return candidate;
    }

    /**
     * Sanitized name that is also usable as a local variable without hiding a name the derivative body reads.
     */
    public static String toLocalName(String name) {
        String local = sanitize(name);
        if (!SourceVersion.isName(local) || RESERVED_LOCALS.contains(local)) {
            return "_" + local;
        }
        return local;
    }

    public static boolean isValidClassName(String name) {
        return name != null && SourceVersion.isName(name) && !name.contains(".");
    }

    /**
     * Flattens text for use inside a single-line comment.
     */
    public static String toCommentText(String text) {
        if (text == null) {
            return "";
        }
        // doubled backslashes cannot form a unicode escape
        return text.replace("\\", "\\\\").replaceAll("[\\r\\n]+", " ").trim();
    }
}
