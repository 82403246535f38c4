package com.yhy.recourse.mip;

import com.yhy.recourse.mip.exception.CurveValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a feasible grid into a {@link CostCurve}.
 * <ul>
 *     <li>values become deltas from the current value</li>
 *     <li>percentiles become costs relative to the current percentile {@code p0}</li>
 *     <li>only deltas pointing in the direction of {@code sign(w)} are kept</li>
 *     <li>the curve always starts at {@code (0, 0)}</li>
 * </ul>
 */
public class CostCurveBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(CostCurveBuilder.class);

    static final double ACTION_TOLERANCE = 1e-8;
    static final double COEFFICIENT_TOLERANCE = 1e-8;

    private final CostType costType;

    public CostCurveBuilder(CostType costType) {
        this.costType = costType;
    }

    /**
     * @return the curve, or empty when no grid point moves the score upward
     * @throws CurveValidationException when the resulting curve breaks an invariant
     */
    public Optional<CostCurve> build(String name, int featureIndex, double coefficient, FeasibleGrid grid) {
        if (Math.abs(coefficient) < COEFFICIENT_TOLERANCE) {
            throw new CurveValidationException(name, "coefficient is zero");
        }
        int direction = coefficient > 0 ? 1 : -1;
        double p0 = grid.getCurrentPercentile();

        List<Double> actions = new ArrayList<>();
        List<Double> costs = new ArrayList<>();
        actions.add(0.0);
        costs.add(0.0);

        int candidates = 0;
        int n = grid.size();
        for (int i = 0; i < n; i++) {
            // walk outward from the anchor: ascending for w > 0, descending for w < 0
            int k = direction > 0 ? i : n - 1 - i;
            double delta = grid.getValues()[k] - grid.getCurrentValue();
            if (direction * delta <= ACTION_TOLERANCE) {
                continue;
            }
            candidates++;
            double cost = cost(name, p0, grid.getPercentiles()[k], direction);
            if (!(cost > 0.0)) {
                continue;
            }
            int last = actions.size() - 1;
            if (Math.abs(delta - actions.get(last)) <= ACTION_TOLERANCE) {
                continue;
            }
            if (last > 0 && cost == costs.get(last)) {
                // same price for a larger move
                actions.set(last, delta);
                continue;
            }
            actions.add(delta);
            costs.add(cost);
        }

        if (candidates == 0) {
            LOGGER.debug("Feature {} has no feasible move that raises the score, skipped", name);
            return Optional.empty();
        }

        double[] a = actions.stream().mapToDouble(Double::doubleValue).toArray();
        double[] c = costs.stream().mapToDouble(Double::doubleValue).toArray();
        validate(name, coefficient, a, c);
        return Optional.of(new CostCurve(name, featureIndex, coefficient, a, c));
    }

    private double cost(String name, double p0, double p, int direction) {
        // moving up the score moves the feature up (w > 0) or down (w < 0) its distribution
        boolean upward = direction > 0;
        if (!costType.isLogOdds()) {
            return upward ? p - p0 : p0 - p;
        }
        double cost = upward ? Math.log((1.0 - p0) / (1.0 - p)) : Math.log((1.0 - p) / (1.0 - p0));
        if (Double.isNaN(cost) || Double.isInfinite(cost)) {
            throw new CurveValidationException(name, "log-odds cost undefined at percentile " + p + " (current " + p0 + ")");
        }
        return cost;
    }

    /**
     * Checks the curve invariants. Public so that curves coming from other sources can be vetted the same way.
     */
    public static void validate(String name, double coefficient, double[] actions, double[] costs) {
        if (Math.abs(coefficient) < COEFFICIENT_TOLERANCE) {
            throw new CurveValidationException(name, "coefficient is zero");
        }
        if (actions.length != costs.length) {
            throw new CurveValidationException(name, "actions and costs differ in length");
        }
        if (actions.length < 2) {
            throw new CurveValidationException(name, "fewer than 2 points");
        }
        if (actions[0] != 0.0 || costs[0] != 0.0) {
            throw new CurveValidationException(name, "first point is not (0, 0)");
        }
        Set<Double> seenActions = new HashSet<>();
        Set<Double> seenCosts = new HashSet<>();
        for (int k = 0; k < actions.length; k++) {
            if (!seenActions.add(actions[k])) {
                throw new CurveValidationException(name, "duplicate action " + actions[k]);
            }
            if (!seenCosts.add(costs[k])) {
                throw new CurveValidationException(name, "duplicate cost " + costs[k]);
            }
            if (k > 0) {
                if (Math.signum(actions[k]) != Math.signum(coefficient)) {
                    throw new CurveValidationException(name, "action " + actions[k] + " has the wrong sign");
                }
                if (costs[k] < costs[k - 1]) {
                    throw new CurveValidationException(name, "cost decreases at point " + k);
                }
            }
        }
    }
}
