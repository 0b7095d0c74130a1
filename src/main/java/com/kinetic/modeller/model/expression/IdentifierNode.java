package com.kinetic.modeller.model.expression;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * A bare name: an entity before slot substitution, the time variable {@code t}, or a constant.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class IdentifierNode extends ExpressionNode {
    public static final String TIME = "t";
    public static final String PI = "pi";

    String name;

    public boolean isTime() {
        return TIME.equals(name);
    }

    public boolean isConstant() {
        return PI.equals(name);
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
