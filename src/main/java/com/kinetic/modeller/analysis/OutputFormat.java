package com.kinetic.modeller.analysis;

import java.util.Locale;

import com.kinetic.modeller.model.exception.ModelException;

/**
 * How much of each perturbed trajectory a sensitivity run keeps.
 */
public enum OutputFormat {
    /** Only the state at end time. */
    REDUCED,
    /** Every sampled row. */
    FULL;

    public static OutputFormat fromName(String name) {
        if (name == null) {
            throw new ModelException("Output format is missing; expected reduced or full");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new ModelException("Unknown output format '" + name + "'; expected reduced or full", e);
        }
    }
}
