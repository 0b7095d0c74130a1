package com.kinetic.modeller.model;

import java.util.LinkedHashMap;
import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A modelled species with its initial value and the rate laws that produce
 * (influx) and consume (outflux) it, keyed by reaction id.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Entity {
    private String name;
    private String description;
    private double initialValue;
    private Map<String, String> influx = new LinkedHashMap<>();
    private Map<String, String> outflux = new LinkedHashMap<>();

    public Entity(String name, String description, double initialValue) {
        this(name, description, initialValue, new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    public Entity deepCopy() {
        return new Entity(name, description, initialValue,
                new LinkedHashMap<>(influx), new LinkedHashMap<>(outflux));
    }
}
