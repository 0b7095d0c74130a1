package com.kinetic.modeller.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kinetic.modeller.cli.exception.OptionsValidationException;
import com.kinetic.modeller.cli.output.ModelReportPrinter;
import com.kinetic.modeller.compiler.CompiledModel;
import com.kinetic.modeller.compiler.GraphBuilder;
import com.kinetic.modeller.compiler.ModelCompiler;
import com.kinetic.modeller.merge.MergeResult;
import com.kinetic.modeller.merge.ModelMerger;
import com.kinetic.modeller.model.EntityTable;
import com.kinetic.modeller.model.InterpolationMode;
import com.kinetic.modeller.model.ModelDiagnostics;
import com.kinetic.modeller.model.Specification;
import com.kinetic.modeller.model.exception.ModelException;
import com.kinetic.modeller.parser.SpecLoader;
import com.kinetic.modeller.parser.exception.ParseException;

import lombok.Value;

/**
 * Shared error handling for subcommands: validation errors are reported together,
 * specification and model errors by message, anything else with its stack trace.
 * Returns 0 on success and 1 on failure.
 */
public abstract class AbstractModelCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(AbstractModelCommand.class);

    protected final ModelReportPrinter printer = new ModelReportPrinter();

    @Override
    public Integer call() {
        try {
            execute();
            return 0;
        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e.getErrors());
            return 1;
        } catch (ParseException | ModelException e) {
            log.error("{} failed: {}", commandName(), e.getMessage());
            return 1;
        } catch (Exception e) {
            log.error("{} failed with exception", commandName(), e);
            return 1;
        }
    }

    protected abstract void execute() throws IOException;

    protected abstract String commandName();

    protected Specification load(Path file, InterpolationMode mode) throws IOException {
        return new SpecLoader(mode).load(file);
    }

    protected List<Specification> loadAll(List<Path> files, InterpolationMode mode) throws IOException {
        List<Specification> specs = new ArrayList<>();
        for (Path file : files) {
            specs.add(load(file, mode));
        }
        return specs;
    }

    /**
     * Loads and compiles one specification, or merges several (specifications and entity
     * tables, reactions renumbered with {@code prefix}) and compiles the merged table.
     */
    protected LoadedModel compileModels(List<Path> files, String prefix, ModelDiagnostics diagnostics)
            throws IOException {
        List<Specification> specs = loadAll(files, InterpolationMode.EXTENDED);
        ModelCompiler compiler = new ModelCompiler();
        if (specs.size() == 1) {
            return new LoadedModel(specs.get(0), compiler.compile(specs.get(0), diagnostics));
        }

        GraphBuilder graphBuilder = new GraphBuilder();
        List<EntityTable> tables = new ArrayList<>();
        for (Specification spec : specs) {
            tables.add(graphBuilder.build(spec, diagnostics));
        }
        MergeResult merged = new ModelMerger().merge(specs, tables, prefix, true, true);
        merged.getDiagnostics().getWarnings().forEach(diagnostics::addWarning);
        printer.printMergeSummary(merged);

        return new LoadedModel(merged.getSpecification(), compiler.compile(merged.getEntityTable(), diagnostics));
    }

    @Value
    protected static class LoadedModel {
        Specification specification;
        CompiledModel model;
    }
}
