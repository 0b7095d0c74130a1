package com.kinetic.modeller.gsm;

import lombok.Builder;
import lombok.Data;

/**
 * Identifiers and the uniform starting values written into a converted specification.
 */
@Data
@Builder
public class GsmConversionOptions {
    @Builder.Default
    private String modelName = "";

    @Builder.Default
    private String author = "";

    @Builder.Default
    private double metaboliteInitial = 1e-5;

    @Builder.Default
    private double enzymeConc = 1e-6;

    @Builder.Default
    private double enzymeKcat = 13.7;

    @Builder.Default
    private double enzymeKm = 1.3e-4;
}
