package com.kinetic.modeller.cli.output;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kinetic.modeller.codegen.CompilerConfig;
import com.kinetic.modeller.model.Entity;
import com.kinetic.modeller.model.EntityTable;
import com.kinetic.modeller.model.ModelDiagnostics;
import com.kinetic.modeller.model.ReactionBound;
import com.kinetic.modeller.model.Specification;
import com.kinetic.modeller.merge.MergeResult;

/**
 * Responsible only for printing CLI output.
 * No validation, no execution.
 */
public class ModelReportPrinter {

    private static final Logger log = LoggerFactory.getLogger(ModelReportPrinter.class);

    private static final String RULE = "=================================================";
    private static final String NIL = "NIL";

    public void printBanner(String title, List<Path> inputs) {
        log.info(RULE);
        log.info("Kinetic Modeller - {}", title);
        log.info(RULE);
        for (int i = 0; i < inputs.size(); i++) {
            log.info("Input {}: {}", i + 1, inputs.get(i).toAbsolutePath());
        }
    }

    public void printConfig(CompilerConfig config) {
        log.info("Solver: {}", config.getSolver());
        log.info("Timestep: {}", config.getTimestep());
        log.info("End Time: {}", config.getEndtime());
        log.info("Lower Bound: {};{}", config.getLowerbound()[0], config.getLowerbound()[1]);
        log.info("Upper Bound: {};{}", config.getUpperbound()[0], config.getUpperbound()[1]);
        log.info(RULE);
    }

    public void printSpecification(Specification spec) {
        for (String stanza : spec.stanzaNames()) {
            log.info("[{}]", stanza);
            spec.rawStanza(stanza).forEach((key, value) -> log.info("{} = {}", key, value));
            log.info("");
        }
    }

    public void printModel(Specification spec, EntityTable table) {
        log.info("-------- Model Identifiers --------");
        spec.stanza(Specification.IDENTIFIERS).forEach((key, value) -> log.info("{}: {}", key, value));
        log.info("");
        log.info("-------- Model Objects --------");
        for (Entity entity : table) {
            log.info("Name: {}", entity.getName());
            log.info("Description: {}", entity.getDescription());
            log.info("Initial: {}", entity.getInitialValue());
            log.info("Influx: {}", entity.getInflux());
            log.info("Outflux: {}", entity.getOutflux());
            log.info("");
        }
    }

    public void printFluxes(EntityTable table) {
        log.info("Name|Productions|Usages");
        for (Entity entity : table) {
            log.info("{}|{}|{}", entity.getName(), joinIds(entity.getInflux()), joinIds(entity.getOutflux()));
        }
    }

    public void printMergeSummary(MergeResult result) {
        log.info(RULE);
        log.info("MERGE SUCCESSFUL");
        log.info(RULE);
        for (int i = 0; i < result.getRenumbering().size(); i++) {
            log.info("Specification {}:", i + 1);
            result.getRenumbering().get(i).forEach((from, to) -> log.info("  {} --> {}", from, to));
        }
        if (result.hasSpecification()) {
            for (String stanza : Specification.MODEL_STANZAS) {
                log.info("Merged {}: {}", stanza, result.getSpecification().size(stanza));
            }
        }
        if (result.hasEntityTable()) {
            log.info("Merged Entities: {}", result.getEntityTable().size());
        }
    }

    public void printDiagnostics(ModelDiagnostics diagnostics) {
        if (diagnostics.hasWarnings()) {
            log.warn("Warnings: {}", diagnostics.getWarnings().size());
        }
    }

    public void printSkipped(List<String> parameters) {
        log.warn("Skipped non-numeric variables: {}", String.join(", ", parameters));
    }

    public void printOverrides(Map<String, ReactionBound> mutations, Map<String, Double> mediumChanges) {
        log.info(RULE);
        log.info("Mutations: {}", mutations.size());
        mutations.forEach((id, bound) -> log.info("  {} upper={} lower={}", id, bound.getUpper(), bound.getLower()));
        log.info("Medium changes: {}", mediumChanges.size());
        mediumChanges.forEach((id, value) -> log.info("  {} = {}", id, value));
        log.info(RULE);
    }

    public void printSuccess(String what, Path output) {
        log.info(RULE);
        log.info("{} written to {}", what, output.toAbsolutePath());
        log.info(RULE);
    }

    public void printValidationErrors(List<String> errors) {
        log.error("Invalid options:");
        errors.forEach(e -> log.error("  - {}", e));
    }

    private static String joinIds(Map<String, String> fluxes) {
        return fluxes.isEmpty() ? NIL : String.join("; ", fluxes.keySet());
    }
}
