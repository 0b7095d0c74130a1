package com.kinetic.modeller.network;

import lombok.Value;

@Value
public class NetworkEdge {
    public static final String CONSUMED_BY = "cr";
    public static final String PRODUCES = "rc";
    public static final String REACTION = "rxn";

    String source;
    String relation;
    String target;

    public String toSif() {
        return source + " " + relation + " " + target;
    }
}
