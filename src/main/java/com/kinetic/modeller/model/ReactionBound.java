package com.kinetic.modeller.model;

import lombok.Value;

/**
 * Flux bound override for one reaction, as given in a mutation string.
 */
@Value
public class ReactionBound {
    double upper;
    double lower;
}
