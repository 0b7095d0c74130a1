package com.kinetic.modeller.merge;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kinetic.modeller.model.Entity;
import com.kinetic.modeller.model.EntityTable;
import com.kinetic.modeller.model.ModelDiagnostics;
import com.kinetic.modeller.model.Specification;

/**
 * Hands out reaction ids {@code prefix1, prefix2, ...}. The counter runs on across every
 * specification passed to the same instance.
 */
public class ReactionRenumberer {
    private static final Logger log = LoggerFactory.getLogger(ReactionRenumberer.class);

    private final String prefix;
    private int counter;

    public ReactionRenumberer(String prefix) {
        this(prefix, 1);
    }

    public ReactionRenumberer(String prefix, int start) {
        this.prefix = prefix == null ? "" : prefix;
        this.counter = start;
    }

    public int nextNumber() {
        return counter;
    }

    /**
     * Old id to new id for every reaction of {@code spec}, in declaration order.
     */
    public Map<String, String> assign(Specification spec) {
        Map<String, String> renames = new LinkedHashMap<>();
        for (String id : spec.keys(Specification.REACTIONS)) {
            renames.put(id, prefix + counter);
            counter++;
        }
        return renames;
    }

    /**
     * Copy of {@code spec} whose Reactions keys are renamed; values stay raw.
     */
    public static Specification renameReactions(Specification spec, Map<String, String> renames, int specNumber) {
        Specification renamed = new Specification(spec.getMode());
        for (String stanza : spec.stanzaNames()) {
            renamed.addStanza(stanza);
            for (Map.Entry<String, String> entry : spec.rawStanza(stanza).entrySet()) {
                String key = entry.getKey();
                if (Specification.REACTIONS.equals(stanza)) {
                    key = renames.getOrDefault(key, key);
                    log.debug("  Specification {}: {} --> {}", specNumber, entry.getKey(), key);
                }
                renamed.set(stanza, key, entry.getValue());
            }
        }
        return renamed;
    }

    /**
     * Deep copy of {@code table} with influx and outflux keys renamed. A key with no rename
     * is reported and dropped.
     */
    public static EntityTable renameFluxes(EntityTable table, Map<String, String> renames, int specNumber,
                                           ModelDiagnostics diagnostics) {
        EntityTable renamed = new EntityTable();
        for (Entity entity : table) {
            Entity copy = entity.deepCopy();
            copy.setInflux(renameKeys(entity.getInflux(), renames, entity.getName(), specNumber, diagnostics));
            copy.setOutflux(renameKeys(entity.getOutflux(), renames, entity.getName(), specNumber, diagnostics));
            renamed.put(copy);
        }
        return renamed;
    }

    private static Map<String, String> renameKeys(Map<String, String> fluxes, Map<String, String> renames,
                                                  String entityName, int specNumber, ModelDiagnostics diagnostics) {
        Map<String, String> result = new LinkedHashMap<>();
        for (Map.Entry<String, String> flux : fluxes.entrySet()) {
            String newId = renames.get(flux.getKey());
            if (newId == null) {
                String warning = "Specification " + specNumber + ": entity " + entityName
                        + " references reaction " + flux.getKey() + " which is not in its Reactions stanza; flux omitted";
                log.warn(warning);
                diagnostics.addWarning(warning);
                continue;
            }
            result.put(newId, flux.getValue());
        }
        return result;
    }
}
