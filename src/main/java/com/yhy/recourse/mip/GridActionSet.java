package com.yhy.recourse.mip;

import com.yhy.recourse.mip.exception.RecourseConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link ActionSet} backed by explicit per-feature grids. The percentile of a
 * current value that falls between grid points is interpolated linearly.
 */
public class GridActionSet implements ActionSet {

    @Value
    @Builder
    public static class Feature {
        String name;
        boolean actionable;
        double[] grid;
        double[] percentiles;
    }

    private final List<Feature> features;

    public GridActionSet(List<Feature> features) {
        if (features == null || features.isEmpty()) {
            throw new RecourseConfigurationException("action set needs at least one feature");
        }
        for (Feature f : features) {
            if (f.isActionable()) {
                checkGrid(f);
            }
        }
        this.features = Collections.unmodifiableList(new ArrayList<>(features));
    }

    private static void checkGrid(Feature f) {
        double[] grid = f.getGrid();
        double[] pct = f.getPercentiles();
        if (grid == null || pct == null || grid.length == 0 || grid.length != pct.length) {
            throw new RecourseConfigurationException("feature " + f.getName() + ": grid and percentiles must be non-empty and of equal length");
        }
        for (int k = 0; k < grid.length; k++) {
            if (!Double.isFinite(grid[k]) || !Double.isFinite(pct[k]) || pct[k] < 0.0 || pct[k] > 1.0) {
                throw new RecourseConfigurationException("feature " + f.getName() + ": invalid grid point " + k);
            }
            if (k > 0 && grid[k] <= grid[k - 1]) {
                throw new RecourseConfigurationException("feature " + f.getName() + ": grid must be strictly ascending");
            }
        }
    }

    @Override
    public int size() {
        return features.size();
    }

    @Override
    public String getName(int index) {
        return features.get(index).getName();
    }

    @Override
    public boolean isActionable(int index) {
        return features.get(index).isActionable();
    }

    @Override
    public FeasibleGrid feasibleGrid(int index, double currentValue) {
        Feature f = features.get(index);
        if (!f.isActionable()) {
            throw new IllegalArgumentException("feature " + f.getName() + " is not actionable");
        }
        return new FeasibleGrid(f.getGrid().clone(), f.getPercentiles().clone(), currentValue,
                percentileOf(f.getGrid(), f.getPercentiles(), currentValue));
    }

    static double percentileOf(double[] grid, double[] pct, double value) {
        if (value <= grid[0]) {
            return pct[0];
        }
        int last = grid.length - 1;
        if (value >= grid[last]) {
            return pct[last];
        }
        for (int k = 1; k <= last; k++) {
            if (value <= grid[k]) {
                double t = (value - grid[k - 1]) / (grid[k] - grid[k - 1]);
                return pct[k - 1] + t * (pct[k] - pct[k - 1]);
            }
        }
        return pct[last];
    }
}
