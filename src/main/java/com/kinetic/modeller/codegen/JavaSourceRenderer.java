package com.kinetic.modeller.codegen;

import java.util.stream.Collectors;

import com.kinetic.modeller.model.exception.ModelException;
import com.kinetic.modeller.model.expression.BinaryNode;
import com.kinetic.modeller.model.expression.BinaryNode.Operator;
import com.kinetic.modeller.model.expression.ExpressionNode;
import com.kinetic.modeller.model.expression.ExpressionVisitor;
import com.kinetic.modeller.model.expression.FunctionNode;
import com.kinetic.modeller.model.expression.IdentifierNode;
import com.kinetic.modeller.model.expression.NumberNode;
import com.kinetic.modeller.model.expression.SlotNode;
import com.kinetic.modeller.model.expression.UnaryNode;

/**
 * Renders a slot-resolved expression as a Java {@code double} expression over {@code t} and {@code y}.
 *
 * Literals are always written as doubles so that {@code 1/2} stays a real division.
 */
public class JavaSourceRenderer implements ExpressionVisitor<String> {

    private static final int UNARY_PRECEDENCE = 3;
    private static final int ATOM_PRECEDENCE = 5;

    private final int stateSize;

    public JavaSourceRenderer(int stateSize) {
        this.stateSize = stateSize;
    }

    public String render(ExpressionNode node) {
        return node.accept(this);
    }

    @Override
    public String visit(NumberNode node) {
        return literal(node.getValue());
    }

    @Override
    public String visit(IdentifierNode node) {
        if (node.isTime()) {
            return "t";
        }
        if (node.isConstant()) {
            return "Math.PI";
        }
        throw new ModelException("Cannot render unresolved name '" + node.getName() + "'");
    }

    @Override
    public String visit(SlotNode node) {
        if (node.getSlot() >= stateSize) {
            throw new IllegalStateException("Derivative references slot " + node.getSlot()
                    + " but the state vector has " + stateSize + " slots");
        }
        return "y[" + node.getSlot() + "]";
    }

    @Override
    public String visit(UnaryNode node) {
        String operand = wrap(node.getOperand(), UNARY_PRECEDENCE, false);
        return node.isNegated() ? "(-" + operand + ")" : operand;
    }

    @Override
    public String visit(BinaryNode node) {
        Operator operator = node.getOperator();
        if (operator == Operator.POWER) {
            return "Math.pow(" + render(node.getLeft()) + ", " + render(node.getRight()) + ")";
        }
        int precedence = operator.getPrecedence();
        boolean rightStrict = operator == Operator.MINUS || operator == Operator.DIVIDE;
        return wrap(node.getLeft(), precedence, false) + " " + operator.getSymbol() + " "
                + wrap(node.getRight(), precedence, rightStrict);
    }

    @Override
    public String visit(FunctionNode node) {
        return node.getFunction().getJavaName() + "("
                + node.getArguments().stream().map(this::render).collect(Collectors.joining(", "))
                + ")";
    }

    private String wrap(ExpressionNode child, int parentPrecedence, boolean strict) {
        String rendered = render(child);
        int childPrecedence = precedenceOf(child);
        if (childPrecedence < parentPrecedence || (strict && childPrecedence == parentPrecedence)) {
            return "(" + rendered + ")";
        }
        return rendered;
    }

    private static int precedenceOf(ExpressionNode node) {
        if (node instanceof BinaryNode binary && binary.getOperator() != Operator.POWER) {
            return binary.getOperator().getPrecedence();
        }
        if (node instanceof UnaryNode unary && !unary.isNegated()) {
            return precedenceOf(unary.getOperand());
        }
        return ATOM_PRECEDENCE;
    }

    static String literal(double value) {
        if (Double.isNaN(value)) {
            return "Double.NaN";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? "Double.POSITIVE_INFINITY" : "Double.NEGATIVE_INFINITY";
        }
        return Double.toString(value);
    }
}
