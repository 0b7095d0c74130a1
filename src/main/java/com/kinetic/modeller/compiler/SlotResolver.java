package com.kinetic.modeller.compiler;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

import com.kinetic.modeller.model.IndexTable;
import com.kinetic.modeller.model.expression.BinaryNode;
import com.kinetic.modeller.model.expression.ExpressionNode;
import com.kinetic.modeller.model.expression.ExpressionVisitor;
import com.kinetic.modeller.model.expression.FunctionNode;
import com.kinetic.modeller.model.expression.IdentifierNode;
import com.kinetic.modeller.model.expression.NumberNode;
import com.kinetic.modeller.model.expression.SlotNode;
import com.kinetic.modeller.model.expression.UnaryNode;

/**
 * Rebuilds an expression tree with entity names replaced by slot nodes.
 * Names that are neither entities nor {@code t}/{@code pi} are collected in {@link #getUnresolved()}.
 */
public class SlotResolver implements ExpressionVisitor<ExpressionNode> {

    private final IndexTable index;
    private final Set<String> unresolved = new LinkedHashSet<>();

    public SlotResolver(IndexTable index) {
        this.index = index;
    }

    public Set<String> getUnresolved() {
        return unresolved;
    }

    @Override
    public ExpressionNode visit(NumberNode node) {
        return node;
    }

    @Override
    public ExpressionNode visit(IdentifierNode node) {
        OptionalInt slot = index.slotOf(node.getName());
        if (slot.isPresent()) {
            return new SlotNode(slot.getAsInt());
        }
        if (!node.isTime() && !node.isConstant()) {
            unresolved.add(node.getName());
        }
        return node;
    }

    @Override
    public ExpressionNode visit(SlotNode node) {
        if (node.getSlot() >= index.size()) {
            unresolved.add("y[" + node.getSlot() + "]");
        }
        return node;
    }

    @Override
    public ExpressionNode visit(UnaryNode node) {
        return new UnaryNode(node.isNegated(), node.getOperand().accept(this));
    }

    @Override
    public ExpressionNode visit(BinaryNode node) {
        return new BinaryNode(node.getOperator(), node.getLeft().accept(this), node.getRight().accept(this));
    }

    @Override
    public ExpressionNode visit(FunctionNode node) {
        List<ExpressionNode> arguments = new ArrayList<>();
        for (ExpressionNode argument : node.getArguments()) {
            arguments.add(argument.accept(this));
        }
        return new FunctionNode(node.getFunction(), List.copyOf(arguments));
    }
}
