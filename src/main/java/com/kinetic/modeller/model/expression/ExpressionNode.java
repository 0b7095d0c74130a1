package com.kinetic.modeller.model.expression;

/**
 * Base class for nodes of a parsed rate-law expression.
 */
public abstract class ExpressionNode {

    public abstract <T> T accept(ExpressionVisitor<T> visitor);
}
