package com.yhy.recourse.mip;

import java.util.Arrays;

/**
 * Validated {@code (action, cost)} points of one actionable feature, ordered
 * outward from the {@code (0, 0)} anchor in the direction that raises the score.
 * Instances are only produced by {@link CostCurveBuilder}.
 */
public final class CostCurve {

    private final String featureName;
    private final int featureIndex;
    private final double coefficient;
    private final double[] actions;
    private final double[] costs;

    CostCurve(String featureName, int featureIndex, double coefficient, double[] actions, double[] costs) {
        this.featureName = featureName;
        this.featureIndex = featureIndex;
        this.coefficient = coefficient;
        this.actions = actions;
        this.costs = costs;
    }

    public String getFeatureName() {
        return featureName;
    }

    public int getFeatureIndex() {
        return featureIndex;
    }

    public double getCoefficient() {
        return coefficient;
    }

    public int size() {
        return actions.length;
    }

    public double action(int k) {
        return actions[k];
    }

    public double cost(int k) {
        return costs[k];
    }

    public double[] getActions() {
        return actions.clone();
    }

    public double[] getCosts() {
        return costs.clone();
    }

    public double minAction() {
        return Arrays.stream(actions).min().orElse(0.0);
    }

    public double maxAction() {
        return Arrays.stream(actions).max().orElse(0.0);
    }

    public double maxCost() {
        return costs[costs.length - 1];
    }

    @Override
    public String toString() {
        return featureName + "{actions=" + Arrays.toString(actions) + ", costs=" + Arrays.toString(costs) + "}";
    }
}
