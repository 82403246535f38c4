package com.yhy.recourse.mip;

import lombok.Value;

/**
 * Ascending candidate values of one feature with their empirical percentiles.
 */
@Value
public class FeasibleGrid {

    double[] values;

    double[] percentiles;

    double currentValue;

    double currentPercentile;

    public int size() {
        return values.length;
    }
}
