package com.kinetic.modeller.compiler;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kinetic.modeller.model.Entity;
import com.kinetic.modeller.model.EntityTable;
import com.kinetic.modeller.model.IndexTable;
import com.kinetic.modeller.model.exception.ModelException;
import com.kinetic.modeller.model.expression.ExpressionNode;
import com.kinetic.modeller.parser.RateLawParser;

/**
 * Rewrites every influx and outflux rate law to state-vector references and builds one
 * derivative function per entity.
 *
 * The input table is left untouched; the rewritten table is a copy.
 */
public class RateLawCompiler {
    private static final Logger log = LoggerFactory.getLogger(RateLawCompiler.class);

    public CompiledModel compile(EntityTable table, IndexTable index) {
        RateLawRewriter rewriter = new RateLawRewriter(index);
        Map<String, FluxTerm> cache = new HashMap<>();

        EntityTable rewritten = new EntityTable();
        Map<String, DerivativeFunction> derivatives = new LinkedHashMap<>();

        for (Entity entity : table) {
            Entity copy = entity.deepCopy();
            List<FluxTerm> influx = compileFluxes(entity.getInflux(), copy.getInflux(), rewriter, index, cache);
            List<FluxTerm> outflux = compileFluxes(entity.getOutflux(), copy.getOutflux(), rewriter, index, cache);
            rewritten.put(copy);

            int slot = index.slotOf(entity.getName())
                    .orElseThrow(() -> new ModelException("Entity '" + entity.getName() + "' has no slot"));
            derivatives.put(entity.getName(), new DerivativeFunction(entity.getName(), slot, influx, outflux));
        }

        List<DerivativeFunction> ordered = new ArrayList<>();
        for (String name : index.names()) {
            DerivativeFunction derivative = derivatives.get(name);
            if (derivative == null) {
                throw new ModelException("Indexed entity '" + name + "' is missing from the entity table");
            }
            ordered.add(derivative);
        }

        log.debug("Compiled {} derivative functions from {} distinct rate laws", ordered.size(), cache.size());
        return new CompiledModel(rewritten, index, List.copyOf(ordered));
    }

    private List<FluxTerm> compileFluxes(Map<String, String> source, Map<String, String> target,
                                         RateLawRewriter rewriter, IndexTable index, Map<String, FluxTerm> cache) {
        List<FluxTerm> terms = new ArrayList<>();
        for (Map.Entry<String, String> flux : source.entrySet()) {
            String reactionId = flux.getKey();
            FluxTerm compiled = cache.computeIfAbsent(flux.getValue(),
                    rateLaw -> compileRateLaw(reactionId, rateLaw, rewriter, index));
            target.put(reactionId, compiled.getText());
            terms.add(new FluxTerm(reactionId, compiled.getText(), compiled.getExpression()));
        }
        return terms;
    }

    private FluxTerm compileRateLaw(String reactionId, String rateLaw, RateLawRewriter rewriter, IndexTable index) {
        SlotResolver resolver = new SlotResolver(index);
        ExpressionNode expression = RateLawParser.parse(rateLaw).accept(resolver);
        if (!resolver.getUnresolved().isEmpty()) {
            throw new ModelException("Rate law of reaction " + reactionId + " references unknown names "
                    + resolver.getUnresolved() + ": " + rateLaw);
        }
        return new FluxTerm(reactionId, rewriter.rewrite(rateLaw), expression);
    }
}
