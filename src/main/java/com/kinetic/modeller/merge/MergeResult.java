package com.kinetic.modeller.merge;

import java.util.List;
import java.util.Map;

import com.kinetic.modeller.model.EntityTable;
import com.kinetic.modeller.model.ModelDiagnostics;
import com.kinetic.modeller.model.Specification;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a merge. The specification or table is {@code null} when that part was not requested.
 */
@Value
@Builder
public class MergeResult {
    Specification specification;
    EntityTable entityTable;

    /** Old to new reaction id, one map per input specification. */
    List<Map<String, String>> renumbering;

    ModelDiagnostics diagnostics;

    public boolean hasSpecification() {
        return specification != null;
    }

    public boolean hasEntityTable() {
        return entityTable != null;
    }
}
