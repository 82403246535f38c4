package com.yhy.recourse.mip;

/**
 * Source of feature names, actionability and feasible value grids, aligned to
 * the classifier's coefficient order.
 */
public interface ActionSet {

    int size();

    String getName(int index);

    boolean isActionable(int index);

    /**
     * Candidate absolute values for an actionable feature together with their
     * percentiles, relative to the feature's current value.
     */
    FeasibleGrid feasibleGrid(int index, double currentValue);

    default int actionableCount() {
        int n = 0;
        for (int j = 0; j < size(); j++) {
            if (isActionable(j)) {
                n++;
            }
        }
        return n;
    }
}
