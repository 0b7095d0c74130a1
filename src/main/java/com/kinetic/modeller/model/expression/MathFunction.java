package com.kinetic.modeller.model.expression;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.DoubleUnaryOperator;

/**
 * Functions a rate law may call. Names may carry a {@code math.} prefix.
 */
public enum MathFunction {
    EXP("exp", "Math.exp", Math::exp),
    LOG("log", "Math.log", Math::log),
    LN("ln", "Math.log", Math::log),
    LOG10("log10", "Math.log10", Math::log10),
    SQRT("sqrt", "Math.sqrt", Math::sqrt),
    ABS("abs", "Math.abs", Math::abs),
    SIN("sin", "Math.sin", Math::sin),
    COS("cos", "Math.cos", Math::cos),
    TAN("tan", "Math.tan", Math::tan),
    TANH("tanh", "Math.tanh", Math::tanh),
    FLOOR("floor", "Math.floor", Math::floor),
    CEIL("ceil", "Math.ceil", Math::ceil),
    POW("pow", "Math.pow", null),
    MIN("min", "Math.min", null),
    MAX("max", "Math.max", null);

    private static final String MATH_PREFIX = "math.";

    private final String name;
    private final String javaName;
    private final DoubleUnaryOperator unary;

    MathFunction(String name, String javaName, DoubleUnaryOperator unary) {
        this.name = name;
        this.javaName = javaName;
        this.unary = unary;
    }

    public String getName() {
        return name;
    }

    public String getJavaName() {
        return javaName;
    }

    public int getArity() {
        return unary != null ? 1 : 2;
    }

    public double apply(double[] args) {
        if (unary != null) {
            return unary.applyAsDouble(args[0]);
        }
        return switch (this) {
            case POW -> Math.pow(args[0], args[1]);
            case MIN -> Math.min(args[0], args[1]);
            case MAX -> Math.max(args[0], args[1]);
            default -> throw new IllegalStateException("No binary form for " + name);
        };
    }

    public static Optional<MathFunction> lookup(String identifier) {
        String bare = identifier.startsWith(MATH_PREFIX) ? identifier.substring(MATH_PREFIX.length()) : identifier;
        return Arrays.stream(values())
                .filter(f -> f.name.equals(bare))
                .findFirst();
    }
}
