package com.kinetic.modeller.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import com.kinetic.modeller.parser.ValueInterpolator;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * An ordered collection of named stanzas, each an ordered mapping of key to raw text.
 *
 * Values are stored exactly as written and expanded on read according to the
 * {@link InterpolationMode}. Keys and stanza names are case sensitive.
 */
@EqualsAndHashCode
public class Specification {

    public static final String SPECIFICATION = "Specification";
    public static final String IDENTIFIERS = "Identifiers";
    public static final String OBJECTS = "Objects";
    public static final String INITIALS = "Initials";
    public static final String VARIABLES = "Variables";
    public static final String REACTIONS = "Reactions";

    /** Stanzas that make up the model structure, in canonical order. */
    public static final List<String> MODEL_STANZAS = List.of(IDENTIFIERS, OBJECTS, INITIALS, VARIABLES, REACTIONS);

    private final Map<String, LinkedHashMap<String, String>> stanzas = new LinkedHashMap<>();

    @Getter
    @EqualsAndHashCode.Exclude
    private final InterpolationMode mode;

    public Specification(InterpolationMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public void addStanza(String stanza) {
        stanzas.computeIfAbsent(stanza, s -> new LinkedHashMap<>());
    }

    public boolean hasStanza(String stanza) {
        return stanzas.containsKey(stanza);
    }

    public List<String> stanzaNames() {
        return List.copyOf(stanzas.keySet());
    }

    /**
     * Keys of a stanza in declaration order. A missing stanza has no keys.
     */
    public List<String> keys(String stanza) {
        Map<String, String> values = stanzas.get(stanza);
        return values == null ? List.of() : new ArrayList<>(values.keySet());
    }

    public boolean contains(String stanza, String key) {
        Map<String, String> values = stanzas.get(stanza);
        return values != null && values.containsKey(key);
    }

    public int size(String stanza) {
        Map<String, String> values = stanzas.get(stanza);
        return values == null ? 0 : values.size();
    }

    public Optional<String> getRaw(String stanza, String key) {
        Map<String, String> values = stanzas.get(stanza);
        return values == null ? Optional.empty() : Optional.ofNullable(values.get(key));
    }

    /**
     * Unmodifiable view of a stanza's raw values.
     */
    public Map<String, String> rawStanza(String stanza) {
        Map<String, String> values = stanzas.get(stanza);
        return values == null ? Map.of() : Collections.unmodifiableMap(values);
    }

    /**
     * Interpolated value of a key, or empty when the key is absent.
     */
    public Optional<String> get(String stanza, String key) {
        if (!contains(stanza, key)) {
            return Optional.empty();
        }
        return Optional.of(ValueInterpolator.resolve(this, stanza, key));
    }

    /**
     * Interpolated copy of a whole stanza, in declaration order.
     */
    public Map<String, String> stanza(String stanza) {
        Map<String, String> resolved = new LinkedHashMap<>();
        for (String key : keys(stanza)) {
            resolved.put(key, ValueInterpolator.resolve(this, stanza, key));
        }
        return resolved;
    }

    public void set(String stanza, String key, String rawValue) {
        stanzas.computeIfAbsent(stanza, s -> new LinkedHashMap<>()).put(key, rawValue);
    }

    /**
     * Independent copy with the same interpolation mode.
     */
    public Specification copy() {
        return withMode(mode);
    }

    /**
     * Independent copy read with a different interpolation mode.
     */
    public Specification withMode(InterpolationMode newMode) {
        Specification copy = new Specification(newMode);
        stanzas.forEach((name, values) -> {
            copy.addStanza(name);
            values.forEach((key, value) -> copy.set(name, key, value));
        });
        return copy;
    }
}
