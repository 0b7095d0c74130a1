package com.kinetic.modeller.merge;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kinetic.modeller.model.Entity;
import com.kinetic.modeller.model.EntityTable;
import com.kinetic.modeller.model.ModelDiagnostics;
import com.kinetic.modeller.model.Specification;

/**
 * Merges several specifications, and the entity tables built from them, into one network.
 *
 * Reactions are renumbered first ({@code prefix1}, {@code prefix2}, ... across all inputs) so
 * that ids never collide. Stanzas are then unioned with later specifications winning, except
 * Identifiers, which are suffixed with the specification number. Entity tables are unioned
 * per entity, skipping any flux whose rate law text is already recorded for that entity in
 * the same direction. Inputs are never modified.
 */
public class ModelMerger {
    private static final Logger log = LoggerFactory.getLogger(ModelMerger.class);

    public static final String DEFAULT_PREFIX = "exp";

    private static final List<String> UNION_STANZAS = List.of(
            Specification.OBJECTS, Specification.INITIALS, Specification.VARIABLES, Specification.REACTIONS);

    public MergeResult merge(List<Specification> specs, List<EntityTable> tables, String prefix) {
        return merge(specs, tables, prefix, true, true);
    }

    public MergeResult merge(List<Specification> specs, List<EntityTable> tables, String prefix,
                             boolean mergeSpecifications, boolean mergeEntityTables) {
        if (mergeEntityTables && tables.size() != specs.size()) {
            throw new IllegalArgumentException("Expected one entity table per specification: "
                    + specs.size() + " specifications, " + tables.size() + " tables");
        }

        ModelDiagnostics diagnostics = new ModelDiagnostics();

        // Phase 1: renumber reactions into fresh copies
        ReactionRenumberer renumberer = new ReactionRenumberer(prefix);
        List<Map<String, String>> renumbering = new ArrayList<>();
        List<Specification> renamedSpecs = new ArrayList<>();
        List<EntityTable> renamedTables = new ArrayList<>();

        for (int i = 0; i < specs.size(); i++) {
            int specNumber = i + 1;
            Map<String, String> renames = renumberer.assign(specs.get(i));
            renumbering.add(renames);
            log.info("Renumbering {} reactions in specification {}", renames.size(), specNumber);

            if (mergeSpecifications) {
                renamedSpecs.add(ReactionRenumberer.renameReactions(specs.get(i), renames, specNumber));
            }
            if (mergeEntityTables) {
                renamedTables.add(ReactionRenumberer.renameFluxes(tables.get(i), renames, specNumber, diagnostics));
            }
        }

        // Phase 2: union
        Specification mergedSpec = mergeSpecifications && !renamedSpecs.isEmpty()
                ? mergeSpecifications(renamedSpecs)
                : null;
        EntityTable mergedTable = mergeEntityTables && !renamedTables.isEmpty()
                ? mergeEntityTables(renamedTables)
                : null;

        return MergeResult.builder()
                .specification(mergedSpec)
                .entityTable(mergedTable)
                .renumbering(List.copyOf(renumbering))
                .diagnostics(diagnostics)
                .build();
    }

    private Specification mergeSpecifications(List<Specification> specs) {
        log.info("Merging specifications...");
        Specification merged = specs.get(0).copy();

        Map<String, List<Integer>> statistics = new LinkedHashMap<>();
        for (String stanza : Specification.MODEL_STANZAS) {
            merged.addStanza(stanza);
            statistics.computeIfAbsent(stanza, s -> new ArrayList<>()).add(specs.get(0).size(stanza));
        }

        for (int i = 1; i < specs.size(); i++) {
            Specification spec = specs.get(i);
            int specNumber = i + 1;

            spec.rawStanza(Specification.IDENTIFIERS).forEach((key, value) ->
                    merged.set(Specification.IDENTIFIERS, key + "_" + specNumber, value));
            statistics.get(Specification.IDENTIFIERS).add(spec.size(Specification.IDENTIFIERS));

            for (String stanza : UNION_STANZAS) {
                spec.rawStanza(stanza).forEach((key, value) -> merged.set(stanza, key, value));
                statistics.get(stanza).add(spec.size(stanza));
            }
        }

        statistics.forEach((stanza, counts) -> log.info("Numbers of {} = {} (total {})", stanza,
                counts.stream().map(String::valueOf).collect(Collectors.joining(", ")),
                counts.stream().mapToInt(Integer::intValue).sum()));
        return merged;
    }

    private EntityTable mergeEntityTables(List<EntityTable> tables) {
        log.info("Merging entity tables...");
        log.info("Number of entities: {}", tables.stream()
                .map(t -> String.valueOf(t.size()))
                .collect(Collectors.joining(", ")));

        EntityTable merged = tables.get(0).deepCopy();
        for (int i = 1; i < tables.size(); i++) {
            for (Entity incoming : tables.get(i)) {
                Entity current = merged.get(incoming.getName()).orElse(null);
                if (current == null) {
                    log.debug("  {} is new - full entity merge", incoming.getName());
                    merged.put(incoming.deepCopy());
                    continue;
                }
                log.debug("  {} already present - merging fluxes", incoming.getName());
                mergeFluxes(current.getInflux(), incoming.getInflux(), incoming.getName(), "Influx");
                mergeFluxes(current.getOutflux(), incoming.getOutflux(), incoming.getName(), "Outflux");
            }
        }

        log.info("Number of merged entities: {}", merged.size());
        return merged;
    }

    private void mergeFluxes(Map<String, String> current, Map<String, String> incoming, String entityName,
                             String direction) {
        // compare against what was recorded before this entity's fluxes were merged
        List<String> recorded = new ArrayList<>(current.values());
        incoming.forEach((reactionId, rateLaw) -> {
            if (recorded.contains(rateLaw)) {
                log.debug("    {} ({}) in {} already present - not merged", direction, rateLaw, entityName);
            } else {
                log.debug("    {} ({}) in {} merged as {}", direction, rateLaw, entityName, reactionId);
                current.put(reactionId, rateLaw);
            }
        });
    }
}
