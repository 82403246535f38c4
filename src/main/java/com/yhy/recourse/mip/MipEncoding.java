package com.yhy.recourse.mip;

import lombok.Value;

import java.util.List;

/**
 * Flattened index tables consumed by {@link RecourseMipFormulator}. All
 * per-feature arrays are aligned with {@link #getFeatures()}.
 */
@Value
public class MipEncoding {

    List<FeatureEncoding> features;

    int[] featureIndices;

    double[] coefficients;

    List<String> noOpIndicatorNames;

    List<String> indicatorNames;

    double[] actionLowerBounds;

    double[] actionUpperBounds;

    double[] maxCosts;

    /** Smallest positive gap between any two distinct cost values across all curves, 0 included. */
    double minCostIncrement;

    /** Sum over features of the largest attainable cost. */
    double totalMaxCost;

    public int size() {
        return features.size();
    }

    /**
     * Weight of the total-cost tie-breaker in the max-cost objective.
     * <p>
     * Two distinct max-cost values differ by at least {@code minCostIncrement}, and
     * the tie-breaker is at most {@code epsilon * totalMaxCost = minCostIncrement},
     * strictly less for any action with positive total cost. A larger max-cost can
     * therefore never beat a smaller one on the tie-breaker.
     */
    public double epsilon() {
        if (features.isEmpty() || !(totalMaxCost > 0.0)) {
            return 0.0;
        }
        return minCostIncrement / totalMaxCost;
    }
}
