package com.kinetic.modeller.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Soft failures accumulated while building a model.
 *
 * Pure structure only: callers log.
 */
@Getter
public class ModelDiagnostics {
    private final List<String> warnings = new ArrayList<>();

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }
}
