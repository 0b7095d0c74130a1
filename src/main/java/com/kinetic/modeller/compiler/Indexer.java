package com.kinetic.modeller.compiler;

import com.kinetic.modeller.model.Entity;
import com.kinetic.modeller.model.EntityTable;
import com.kinetic.modeller.model.IndexTable;

/**
 * Assigns state-vector slots in entity-table order. No sorting, so the same table
 * always yields the same slots.
 */
public class Indexer {

    public IndexTable index(EntityTable table) {
        IndexTable index = new IndexTable();
        for (Entity entity : table) {
            index.assign(entity.getName());
        }
        return index;
    }
}
