package com.kinetic.modeller.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kinetic.modeller.model.EntityTable;
import com.kinetic.modeller.model.IndexTable;
import com.kinetic.modeller.model.ModelDiagnostics;
import com.kinetic.modeller.model.Specification;

/**
 * Single-model pipeline: graph building, indexing and rate-law compilation.
 */
public class ModelCompiler {
    private static final Logger log = LoggerFactory.getLogger(ModelCompiler.class);

    private final GraphBuilder graphBuilder = new GraphBuilder();
    private final Indexer indexer = new Indexer();
    private final RateLawCompiler rateLawCompiler = new RateLawCompiler();

    public CompiledModel compile(Specification spec) {
        return compile(spec, new ModelDiagnostics());
    }

    public CompiledModel compile(Specification spec, ModelDiagnostics diagnostics) {
        log.debug("Step 1: Building entity graph...");
        EntityTable table = graphBuilder.build(spec, diagnostics);
        return compile(table, diagnostics);
    }

    /**
     * Compiles an already built (for example merged) entity table.
     */
    public CompiledModel compile(EntityTable table, ModelDiagnostics diagnostics) {
        log.debug("Step 2: Assigning slots...");
        IndexTable index = indexer.index(table);

        log.debug("Step 3: Compiling rate laws...");
        CompiledModel model = rateLawCompiler.compile(table, index);

        if (diagnostics.hasWarnings()) {
            log.info("Compiled {} entities with {} warning(s)", model.size(), diagnostics.getWarnings().size());
        } else {
            log.info("Compiled {} entities", model.size());
        }
        return model;
    }
}
