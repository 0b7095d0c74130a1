package com.kinetic.modeller.compiler;

import com.kinetic.modeller.model.expression.ExpressionNode;

import lombok.Value;

/**
 * One reaction's contribution to a derivative: the rewritten rate-law text and its parsed tree.
 */
@Value
public class FluxTerm {
    String reactionId;
    String text;
    ExpressionNode expression;
}
