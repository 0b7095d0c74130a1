package com.kinetic.modeller.model.expression;

import com.kinetic.modeller.model.exception.ModelException;

/**
 * Evaluates an expression against a state vector and a time point.
 *
 * Names other than {@code t} and {@code pi} must have been replaced by slots beforehand.
 */
public class ExpressionEvaluator implements ExpressionVisitor<Double> {

    private final double t;
    private final double[] y;

    public ExpressionEvaluator(double t, double[] y) {
        this.t = t;
        this.y = y;
    }

    /**
     * Evaluates an expression that references neither slots nor names other than {@code pi}.
     */
    public static double evaluateConstant(ExpressionNode node) {
        return node.accept(new ExpressionEvaluator(0.0, new double[0]));
    }

    public double evaluate(ExpressionNode node) {
        return node.accept(this);
    }

    @Override
    public Double visit(NumberNode node) {
        return node.getValue();
    }

    @Override
    public Double visit(IdentifierNode node) {
        if (node.isTime()) {
            return t;
        }
        if (node.isConstant()) {
            return Math.PI;
        }
        throw new ModelException("Unresolved identifier '" + node.getName() + "'");
    }

    @Override
    public Double visit(SlotNode node) {
        if (node.getSlot() >= y.length) {
            throw new ModelException("State vector has no slot " + node.getSlot() + " (size " + y.length + ")");
        }
        return y[node.getSlot()];
    }

    @Override
    public Double visit(UnaryNode node) {
        double value = node.getOperand().accept(this);
        return node.isNegated() ? -value : value;
    }

    @Override
    public Double visit(BinaryNode node) {
        double left = node.getLeft().accept(this);
        double right = node.getRight().accept(this);
        return node.getOperator().apply(left, right);
    }

    @Override
    public Double visit(FunctionNode node) {
        double[] args = new double[node.getArguments().size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = node.getArguments().get(i).accept(this);
        }
        return node.getFunction().apply(args);
    }
}
