package com.kinetic.modeller.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * Entity name to state-vector slot. Slots are contiguous from zero in insertion order.
 */
@EqualsAndHashCode
@ToString
public class IndexTable {

    private final Map<String, Integer> slots = new LinkedHashMap<>();

    /**
     * Assigns the next free slot to a name.
     *
     * @throws IllegalArgumentException when the name already has a slot
     */
    public int assign(String name) {
        if (slots.containsKey(name)) {
            throw new IllegalArgumentException("Entity already indexed: " + name);
        }
        int slot = slots.size();
        slots.put(name, slot);
        return slot;
    }

    public OptionalInt slotOf(String name) {
        Integer slot = slots.get(name);
        return slot == null ? OptionalInt.empty() : OptionalInt.of(slot);
    }

    public boolean contains(String name) {
        return slots.containsKey(name);
    }

    public int size() {
        return slots.size();
    }

    /**
     * Names ordered by slot.
     */
    public List<String> names() {
        return new ArrayList<>(slots.keySet());
    }

    public String nameAt(int slot) {
        if (slot < 0 || slot >= slots.size()) {
            throw new IndexOutOfBoundsException("No entity at slot " + slot + " of " + slots.size());
        }
        return names().get(slot);
    }

    public Map<String, Integer> asMap() {
        return Collections.unmodifiableMap(slots);
    }
}
