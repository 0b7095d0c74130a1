package com.kinetic.modeller.model.expression;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Numeric literal. The source text is kept for diagnostics.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class NumberNode extends ExpressionNode {
    double value;
    String text;

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
