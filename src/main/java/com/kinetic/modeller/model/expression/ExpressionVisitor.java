package com.kinetic.modeller.model.expression;

/**
 * Visitor over rate-law expression trees.
 */
public interface ExpressionVisitor<T> {
    T visit(NumberNode node);

    T visit(IdentifierNode node);

    T visit(SlotNode node);

    T visit(UnaryNode node);

    T visit(BinaryNode node);

    T visit(FunctionNode node);
}
