package com.kinetic.modeller.model;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import lombok.EqualsAndHashCode;

/**
 * Entities keyed by name, iterated in the order they were declared.
 */
@EqualsAndHashCode
public class EntityTable implements Iterable<Entity> {

    private final Map<String, Entity> entities = new LinkedHashMap<>();

    public void put(Entity entity) {
        entities.put(entity.getName(), entity);
    }

    public Optional<Entity> get(String name) {
        return Optional.ofNullable(entities.get(name));
    }

    public boolean contains(String name) {
        return entities.containsKey(name);
    }

    public int size() {
        return entities.size();
    }

    public List<String> names() {
        return new ArrayList<>(entities.keySet());
    }

    /**
     * Total number of influx and outflux entries across all entities.
     */
    public int fluxCount() {
        int count = 0;
        for (Entity entity : entities.values()) {
            count += entity.getInflux().size() + entity.getOutflux().size();
        }
        return count;
    }

    public EntityTable deepCopy() {
        EntityTable copy = new EntityTable();
        entities.values().forEach(e -> copy.put(e.deepCopy()));
        return copy;
    }

    @Override
    public Iterator<Entity> iterator() {
        return entities.values().iterator();
    }
}
