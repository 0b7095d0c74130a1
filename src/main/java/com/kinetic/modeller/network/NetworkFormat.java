package com.kinetic.modeller.network;

import java.util.Locale;

import com.kinetic.modeller.model.exception.ModelException;

/**
 * Edge-list formats the network projection can produce.
 */
public enum NetworkFormat {
    /** Simple Interaction Format: {@code node relation node} per line. */
    SIF;

    public static NetworkFormat fromName(String name) {
        if (name != null) {
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ModelException("Unknown network format '" + name + "'", e);
            }
        }
        throw new ModelException("Network format is missing");
    }
}
