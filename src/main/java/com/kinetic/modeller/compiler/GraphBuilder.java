package com.kinetic.modeller.compiler;

import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kinetic.modeller.model.Entity;
import com.kinetic.modeller.model.EntityTable;
import com.kinetic.modeller.model.ModelDiagnostics;
import com.kinetic.modeller.model.Reaction;
import com.kinetic.modeller.model.Specification;
import com.kinetic.modeller.model.exception.ModelException;
import com.kinetic.modeller.model.expression.ExpressionEvaluator;
import com.kinetic.modeller.parser.RateLawParser;
import com.kinetic.modeller.parser.exception.ParseException;

/**
 * Builds the entity table from the Objects, Initials and Reactions stanzas.
 *
 * A reaction side naming an entity that is not declared in Objects is reported as a
 * warning and skipped; the rest of the reaction is still recorded.
 */
public class GraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    public static final String SUPPORTED_TYPE = "1";
    private static final String TYPE_KEY = "type";

    public EntityTable build(Specification spec) {
        return build(spec, new ModelDiagnostics());
    }

    public EntityTable build(Specification spec, ModelDiagnostics diagnostics) {
        checkType(spec);

        EntityTable table = new EntityTable();
        for (Map.Entry<String, String> object : spec.stanza(Specification.OBJECTS).entrySet()) {
            String name = object.getKey();
            double initial = spec.get(Specification.INITIALS, name)
                    .map(value -> parseInitial(name, value))
                    .orElse(0.0);
            table.put(new Entity(name, object.getValue(), initial));
        }
        log.debug("Declared {} entities", table.size());

        for (String id : spec.keys(Specification.REACTIONS)) {
            String text = spec.get(Specification.REACTIONS, id).orElse("");
            Reaction reaction = Reaction.parse(id, text);

            for (String source : reaction.getSources()) {
                resolve(table, reaction, source, "source", diagnostics)
                        .ifPresent(entity -> entity.getOutflux().put(id, reaction.getRateEq()));
            }
            for (String destination : reaction.getDestinations()) {
                resolve(table, reaction, destination, "destination", diagnostics)
                        .ifPresent(entity -> entity.getInflux().put(id, reaction.getRateEq()));
            }
        }

        log.debug("Linked {} reactions into {} flux entries", spec.size(Specification.REACTIONS), table.fluxCount());
        return table;
    }

    private Optional<Entity> resolve(EntityTable table, Reaction reaction, String name, String side,
                                     ModelDiagnostics diagnostics) {
        Optional<Entity> entity = table.get(name);
        if (entity.isEmpty() && !Reaction.ENVIRONMENT.equals(name)) {
            String warning = "Reaction " + reaction.getId() + ": " + side + " '" + name
                    + "' is not declared in Objects; skipped";
            log.warn(warning);
            diagnostics.addWarning(warning);
        }
        return entity;
    }

    private void checkType(Specification spec) {
        String type = spec.get(Specification.SPECIFICATION, TYPE_KEY).map(String::trim).orElse(SUPPORTED_TYPE);
        if (!SUPPORTED_TYPE.equals(type)) {
            throw new ModelException("Unsupported specification type '" + type + "'; only type "
                    + SUPPORTED_TYPE + " can be compiled");
        }
    }

    /**
     * Initial values are plain numbers or constant arithmetic such as {@code 2*1e-3}.
     */
    static double parseInitial(String name, String value) {
        String text = value.trim();
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            try {
                return ExpressionEvaluator.evaluateConstant(RateLawParser.parse(text));
            } catch (ParseException | ModelException inner) {
                throw new ModelException("Initial value of '" + name + "' is not numeric: " + value, inner);
            }
        }
    }
}
