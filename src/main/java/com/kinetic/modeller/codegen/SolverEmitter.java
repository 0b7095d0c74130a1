package com.kinetic.modeller.codegen;

import java.io.IOException;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.kinetic.modeller.codegen.util.NamingUtil;
import com.kinetic.modeller.compiler.CompiledModel;
import com.kinetic.modeller.compiler.DerivativeFunction;
import com.kinetic.modeller.compiler.FluxTerm;
import com.kinetic.modeller.model.Entity;
import com.kinetic.modeller.model.Specification;
import com.kinetic.modeller.model.exception.ModelException;
import com.kinetic.modeller.solver.ButcherTableau;
import com.kinetic.modeller.solver.SolverMethod;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;
import lombok.Value;

/**
 * Emits a self-contained Java program that integrates a compiled model with one of the
 * fixed-step solvers and prints the trajectory as CSV.
 *
 * The listing holds, in order: a header comment, one method per derivative, the selected
 * Butcher tableau with the driver, and a {@code main} declaring {@code ODE}, {@code y},
 * {@code labels}, {@code lowerbound}/{@code upperbound} and the driver call.
 */
public class SolverEmitter {
    private static final Logger log = LoggerFactory.getLogger(SolverEmitter.class);

    public static final String GENERATOR_NAME = "kinetic-modeller";
    private static final String TEMPLATE = "ode-program.ftl";
    private static final Set<String> RESERVED_METHODS = Set.of("main", "print");

    private final Configuration freemarkerConfig;
    private final Clock clock;

    public SolverEmitter() {
        this(Clock.systemUTC());
    }

    public SolverEmitter(Clock clock) {
        this.clock = clock;
        this.freemarkerConfig = createFreemarkerConfig();
    }

    private Configuration createFreemarkerConfig() {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setClassForTemplateLoading(getClass(), "/templates");
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    /**
     * @throws ModelException for an unknown solver, an invalid class name or a non-positive timestep
     */
    public GeneratedProgram emit(Specification spec, CompiledModel model, CompilerConfig config) {
        SolverMethod solver = config.solverMethod();
        if (!NamingUtil.isValidClassName(config.getClassName())) {
            throw new ModelException("Not a valid Java class name: " + config.getClassName());
        }
        if (config.getTimestep() <= 0) {
            throw new ModelException("Timestep must be positive, got " + config.getTimestep());
        }
        double[] lower = requirePair(config.getLowerbound(), "lowerbound");
        double[] upper = requirePair(config.getUpperbound(), "upperbound");

        Map<String, Object> data = new HashMap<>();
        data.put("generator", GENERATOR_NAME);
        data.put("timestamp", Instant.now(clock).truncatedTo(ChronoUnit.SECONDS).toString());
        data.put("className", config.getClassName());
        data.put("identifiers", identifiers(spec));
        data.put("solver", solverData(solver));
        data.put("size", String.valueOf(model.size()));
        data.put("timestep", JavaSourceRenderer.literal(config.getTimestep()));
        data.put("endtime", JavaSourceRenderer.literal(config.getEndtime()));
        data.put("sampling", String.valueOf(Math.max(1, config.getSampling())));
        data.put("lowerbound", joinLiterals(lower));
        data.put("upperbound", joinLiterals(upper));
        data.put("labels", model.labels());

        List<ProgramDerivative> derivatives = derivatives(model);
        data.put("derivatives", derivatives);
        data.put("entities", entities(model, derivatives));

        String source = render(data);
        log.info("Generated {} with {} derivative functions using solver {}",
                config.getClassName() + ".java", derivatives.size(), solver.getDisplayName());
        return new GeneratedProgram(config.getClassName(), solver, source);
    }

    private String render(Map<String, Object> data) {
        try {
            Template template = freemarkerConfig.getTemplate(TEMPLATE);
            StringWriter out = new StringWriter();
            template.process(data, out);
            return out.toString();
        } catch (IOException | TemplateException e) {
            throw new IllegalStateException("Failed to render template " + TEMPLATE, e);
        }
    }

    private List<ProgramIdentifier> identifiers(Specification spec) {
        List<ProgramIdentifier> identifiers = new ArrayList<>();
        spec.stanza(Specification.IDENTIFIERS).forEach((key, value) ->
                identifiers.add(new ProgramIdentifier(NamingUtil.toCommentText(key), NamingUtil.toCommentText(value))));
        return identifiers;
    }

    private List<ProgramDerivative> derivatives(CompiledModel model) {
        JavaSourceRenderer renderer = new JavaSourceRenderer(model.size());
        Set<String> usedMethods = new HashSet<>(RESERVED_METHODS);
        List<ProgramDerivative> derivatives = new ArrayList<>();

        for (DerivativeFunction derivative : model.getDerivatives()) {
            String method = NamingUtil.disambiguate("d_" + NamingUtil.sanitize(derivative.getEntityName()), usedMethods);

            Set<String> usedLocals = new HashSet<>();
            Map<String, ProgramFlux> locals = new LinkedHashMap<>();
            List<String> influx = fluxLocals(derivative.getInflux(), locals, usedLocals, renderer);
            List<String> outflux = fluxLocals(derivative.getOutflux(), locals, usedLocals, renderer);

            String returnExpression = "(" + joinTerms(influx) + ") - (" + joinTerms(outflux) + ")";
            derivatives.add(new ProgramDerivative(method, String.valueOf(derivative.getSlot()),
                    NamingUtil.toCommentText(derivative.getEntityName()),
                    new ArrayList<>(locals.values()), returnExpression));
        }
        return derivatives;
    }

    private List<String> fluxLocals(List<FluxTerm> terms, Map<String, ProgramFlux> locals, Set<String> usedLocals,
                                    JavaSourceRenderer renderer) {
        List<String> names = new ArrayList<>();
        for (FluxTerm term : terms) {
            ProgramFlux flux = locals.computeIfAbsent(term.getReactionId(), id -> new ProgramFlux(
                    NamingUtil.disambiguate(NamingUtil.toLocalName(id), usedLocals),
                    renderer.render(term.getExpression()),
                    NamingUtil.toCommentText(id)));
            names.add(flux.getLocal());
        }
        return names;
    }

    private List<ProgramEntity> entities(CompiledModel model, List<ProgramDerivative> derivatives) {
        List<ProgramEntity> entities = new ArrayList<>();
        for (int slot = 0; slot < model.size(); slot++) {
            String name = model.getIndex().nameAt(slot);
            Entity entity = model.getTable().get(name)
                    .orElseThrow(() -> new IllegalStateException("Indexed entity missing from table: " + name));
            entities.add(new ProgramEntity(String.valueOf(slot), derivatives.get(slot).getMethod(),
                    JavaSourceRenderer.literal(entity.getInitialValue()),
                    NamingUtil.toCommentText(name), NamingUtil.toCommentText(entity.getDescription())));
        }
        return entities;
    }

    private static Map<String, Object> solverData(SolverMethod solver) {
        ButcherTableau tableau = solver.getTableau();
        Map<String, Object> data = new HashMap<>();
        data.put("name", solver.getDisplayName());
        data.put("order", String.valueOf(solver.getOrder()));
        data.put("c", joinLiterals(tableau.getC()));
        data.put("a", Arrays.stream(tableau.getA()).map(SolverEmitter::joinLiterals).collect(Collectors.toList()));
        data.put("b", joinLiterals(tableau.getB()));
        return data;
    }

    private static double[] requirePair(double[] bound, String name) {
        if (bound == null || bound.length != 2) {
            throw new ModelException(name + " must be a [threshold, reset] pair");
        }
        return bound;
    }

    private static String joinLiterals(double[] values) {
        return Arrays.stream(values).mapToObj(JavaSourceRenderer::literal).collect(Collectors.joining(", "));
    }

    private static String joinTerms(List<String> terms) {
        return terms.isEmpty() ? "0" : String.join(" + ", terms);
    }

    @Value
    public static class ProgramIdentifier {
        String key;
        String value;
    }

    @Value
    public static class ProgramFlux {
        String local;
        String expression;
        String reactionId;
    }

    @Value
    public static class ProgramDerivative {
        String method;
        String slot;
        String entityName;
        List<ProgramFlux> fluxes;
        String returnExpression;
    }

    @Value
    public static class ProgramEntity {
        String slot;
        String method;
        String initial;
        String name;
        String description;
    }
}
