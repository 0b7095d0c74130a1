package com.kinetic.modeller.model.expression;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Value;

@Value
@EqualsAndHashCode(callSuper = false)
public class FunctionNode extends ExpressionNode {
    MathFunction function;
    List<ExpressionNode> arguments;

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
