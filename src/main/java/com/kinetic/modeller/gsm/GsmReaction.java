package com.kinetic.modeller.gsm;

import java.util.List;

import lombok.Value;

/**
 * One reaction of a genome-scale model, as listed by the flux-balance tooling.
 */
@Value
public class GsmReaction {
    String number;
    String id;
    List<String> reactants;
    List<String> products;
    String name;
}
