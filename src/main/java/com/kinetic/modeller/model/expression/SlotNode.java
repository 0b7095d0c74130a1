package com.kinetic.modeller.model.expression;

import lombok.EqualsAndHashCode;
import lombok.Value;

/**
 * Positional access into the state vector, written {@code y[slot]}.
 */
@Value
@EqualsAndHashCode(callSuper = false)
public class SlotNode extends ExpressionNode {
    int slot;

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
