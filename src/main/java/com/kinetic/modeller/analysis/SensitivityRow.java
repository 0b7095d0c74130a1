package com.kinetic.modeller.analysis;

import lombok.Value;

/**
 * One trajectory row of one perturbed (or baseline) model.
 */
@Value
public class SensitivityRow {
    String parameter;
    String change;
    double[] values;
}
