package com.kinetic.modeller.model;

/**
 * How raw specification values are expanded when read.
 */
public enum InterpolationMode {
    /**
     * {@code %(key)s} within the same stanza, {@code %%} for a literal percent sign.
     * {@code ${...}} references are left untouched.
     */
    BASIC,

    /**
     * {@code ${key}} or {@code ${Stanza:key}} resolved recursively, {@code $$} for a literal dollar sign.
     */
    EXTENDED
}
