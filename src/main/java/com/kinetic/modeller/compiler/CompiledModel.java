package com.kinetic.modeller.compiler;

import java.util.ArrayList;
import java.util.List;

import com.kinetic.modeller.model.Entity;
import com.kinetic.modeller.model.EntityTable;
import com.kinetic.modeller.model.IndexTable;

import lombok.Value;

/**
 * Entity table with rate laws rewritten to slot references, its index and one derivative per slot.
 */
@Value
public class CompiledModel {
    public static final String TIME_LABEL = "time";

    EntityTable table;
    IndexTable index;
    List<DerivativeFunction> derivatives;

    /**
     * {@code "time"} followed by entity names in slot order.
     */
    public List<String> labels() {
        List<String> labels = new ArrayList<>();
        labels.add(TIME_LABEL);
        labels.addAll(index.names());
        return labels;
    }

    public double[] initialState() {
        double[] y = new double[index.size()];
        for (Entity entity : table) {
            y[index.slotOf(entity.getName()).orElseThrow()] = entity.getInitialValue();
        }
        return y;
    }

    public int size() {
        return index.size();
    }
}
