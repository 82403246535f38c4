package com.yhy.recourse.mip;

import java.util.ArrayList;
import java.util.Arrays;

/**
 * Small recourse problems shared by the tests.
 */
final class Fixtures {

    private Fixtures() {
    }

    static GridActionSet.Feature actionable(String name, double[] grid, double[] percentiles) {
        return GridActionSet.Feature.builder()
                .name(name)
                .actionable(true)
                .grid(grid)
                .percentiles(percentiles)
                .build();
    }

    static GridActionSet.Feature immutable(String name) {
        return GridActionSet.Feature.builder()
                .name(name)
                .actionable(false)
                .build();
    }

    static GridActionSet actionSet(GridActionSet.Feature... features) {
        return new GridActionSet(new ArrayList<>(Arrays.asList(features)));
    }

    /**
     * One actionable feature, w = 1, b = 0, x = -1; grid {-1, 0, 1, 2} at percentiles {0.1, 0.5, 0.6, 0.9}.
     * Cheapest flip: delta 1 at cost 0.4.
     */
    static GridActionSet singleFeature() {
        return actionSet(actionable("f0", new double[]{-1, 0, 1, 2}, new double[]{0.1, 0.5, 0.6, 0.9}));
    }

    static ClassifierModel singleClassifier() {
        return new ClassifierModel(new double[]{1.0}, 0.0);
    }

    static double[] singleX() {
        return new double[]{-1.0};
    }

    /**
     * Two actionable features, w = (1, 1), b = -3, x = (0, 0).
     * <pre>
     * f0 deltas 1, 2, 3 at costs 0.3, 0.6, 0.8
     * f1 deltas 1, 2, 3 at costs 0.2, 0.4, 0.85
     * </pre>
     * Best max cost and best total cost: (1, 2). Best single feature: (3, 0).
     */
    static GridActionSet twoFeatures() {
        return actionSet(
                actionable("f0", new double[]{0, 1, 2, 3}, new double[]{0.1, 0.4, 0.7, 0.9}),
                actionable("f1", new double[]{0, 1, 2, 3}, new double[]{0.1, 0.3, 0.5, 0.95}));
    }

    static ClassifierModel twoClassifier() {
        return new ClassifierModel(new double[]{1.0, 1.0}, -3.0);
    }

    static double[] twoX() {
        return new double[]{0.0, 0.0};
    }
}
