package com.kinetic.modeller.model.expression;

import lombok.EqualsAndHashCode;
import lombok.Value;

@Value
@EqualsAndHashCode(callSuper = false)
public class UnaryNode extends ExpressionNode {
    boolean negated;
    ExpressionNode operand;

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
