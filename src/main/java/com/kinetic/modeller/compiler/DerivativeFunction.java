package com.kinetic.modeller.compiler;

import java.util.List;
import java.util.stream.Collectors;

import com.kinetic.modeller.model.expression.ExpressionEvaluator;
import com.kinetic.modeller.solver.OdeFunction;

import lombok.Value;

/**
 * Rate of change of one entity: the sum of its influx terms minus the sum of its outflux terms.
 */
@Value
public class DerivativeFunction implements OdeFunction {
    String entityName;
    int slot;
    List<FluxTerm> influx;
    List<FluxTerm> outflux;

    /**
     * Source form {@code (a + b) - (c)}, with {@code 0} standing in for an empty side.
     */
    public String expression() {
        return "(" + join(influx) + ") - (" + join(outflux) + ")";
    }

    @Override
    public double apply(double t, double[] y) {
        ExpressionEvaluator evaluator = new ExpressionEvaluator(t, y);
        return sum(influx, evaluator) - sum(outflux, evaluator);
    }

    private static String join(List<FluxTerm> terms) {
        if (terms.isEmpty()) {
            return "0";
        }
        return terms.stream().map(FluxTerm::getText).collect(Collectors.joining(" + "));
    }

    private static double sum(List<FluxTerm> terms, ExpressionEvaluator evaluator) {
        double total = 0.0;
        for (FluxTerm term : terms) {
            total += evaluator.evaluate(term.getExpression());
        }
        return total;
    }
}
