package com.yhy.recourse.mip;

import com.yhy.recourse.mip.exception.UnsupportedBackendOperationException;
import com.yhy.recourse.mip.solver.BackendCapability;
import com.yhy.recourse.mip.solver.ConstraintSense;
import com.yhy.recourse.mip.solver.MipBackend;
import com.yhy.recourse.mip.solver.MipSolveResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

/**
 * A formulated recourse MIP: the backend handle plus the ids of every
 * variable the formulation created. Changes after construction go through the
 * methods here so that capability checks happen in one place.
 */
public class RecourseMip {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecourseMip.class);

    public static final String SCORE_ROW = "score";
    public static final String MIN_ITEMS_ROW = "min_items";
    public static final String MAX_ITEMS_ROW = "max_items";

    private final MipBackend backend;
    private final MipEncoding encoding;
    private final CostType costType;
    private final int[] actionVars;
    private final int[][] indicatorVars;
    private final int[] costVars;
    private final int maxCostVar;

    private int minItems;
    private int maxItems;
    private int exclusionCount;
    private int frozenCount;

    RecourseMip(MipBackend backend, MipEncoding encoding, CostType costType, int[] actionVars, int[][] indicatorVars,
                int[] costVars, int maxCostVar, int minItems, int maxItems) {
        this.backend = backend;
        this.encoding = encoding;
        this.costType = costType;
        this.actionVars = actionVars;
        this.indicatorVars = indicatorVars;
        this.costVars = costVars;
        this.maxCostVar = maxCostVar;
        this.minItems = minItems;
        this.maxItems = maxItems;
    }

    public MipBackend getBackend() {
        return backend;
    }

    public MipEncoding getEncoding() {
        return encoding;
    }

    public CostType getCostType() {
        return costType;
    }

    public int getMinItems() {
        return minItems;
    }

    public int getMaxItems() {
        return maxItems;
    }

    public int getExclusionCount() {
        return exclusionCount;
    }

    public int getFrozenCount() {
        return frozenCount;
    }

    /**
     * @return whether exclusions or frozen features from an enumeration are in the model
     */
    public boolean hasTrail() {
        return exclusionCount > 0 || frozenCount > 0;
    }

    /**
     * On/off pattern of the encoded features in {@code record}, in encoding order.
     */
    public boolean[] changedPattern(SolutionRecord record) {
        boolean[] changed = new boolean[encoding.size()];
        for (int i = 0; i < changed.length; i++) {
            int featureIndex = encoding.getFeatures().get(i).getFeatureIndex();
            changed[i] = Math.abs(record.action(featureIndex)) > CostCurveBuilder.ACTION_TOLERANCE;
        }
        return changed;
    }

    public int actionVar(int feature) {
        return actionVars[feature];
    }

    public int noOpVar(int feature) {
        return indicatorVars[feature][0];
    }

    /**
     * @return the id of {@code c[j]}, or {@code -1} when the cost type needs no cost variables
     */
    public int costVar(int feature) {
        return costVars == null ? -1 : costVars[feature];
    }

    public boolean hasMaxCostVar() {
        return maxCostVar >= 0;
    }

    public int maxCostVar() {
        return maxCostVar;
    }

    /**
     * Index of the curve point whose indicator is set in {@code result}.
     */
    public int selectedPoint(MipSolveResult result, int feature) {
        int[] vars = indicatorVars[feature];
        int best = 0;
        for (int k = 1; k < vars.length; k++) {
            if (result.value(vars[k]) > result.value(vars[best])) {
                best = k;
            }
        }
        return best;
    }

    /**
     * Moves the cardinality rows to new limits in place.
     */
    public void setItemLimits(int minItems, int maxItems) {
        require(BackendCapability.BOUND_MUTATION, "change item limits");
        int n = encoding.size();
        backend.setConstraintRhs(MAX_ITEMS_ROW, n - maxItems);
        backend.setConstraintRhs(MIN_ITEMS_ROW, n - Math.max(minItems, 1));
        this.minItems = minItems;
        this.maxItems = maxItems;
    }

    /**
     * Keeps every feature flagged in {@code changed} at its current value in later solves.
     */
    public void freezeFeatures(boolean[] changed) {
        require(BackendCapability.BOUND_MUTATION, "freeze changed features");
        for (int i = 0; i < changed.length; i++) {
            if (changed[i]) {
                backend.setLowerBound(noOpVar(i), 1.0);
                frozenCount++;
            }
        }
        LOGGER.debug("Froze features {}", Arrays.toString(changed));
    }

    /**
     * Cuts off the on/off pattern {@code changed}:
     * {@code sum(unchanged u[j][0]) - sum(changed u[j][0]) <= n - 1 - |changed|}.
     */
    public void excludePattern(boolean[] changed) {
        require(BackendCapability.INCREMENTAL_CONSTRAINTS, "exclude a feature combination");
        int n = changed.length;
        int[] vars = new int[n];
        double[] coefficients = new double[n];
        int changedCount = 0;
        for (int i = 0; i < n; i++) {
            vars[i] = noOpVar(i);
            if (changed[i]) {
                coefficients[i] = -1.0;
                changedCount++;
            } else {
                coefficients[i] = 1.0;
            }
        }
        String name = "exclude[" + exclusionCount + "]";
        backend.addConstraint(name, vars, coefficients, ConstraintSense.LE, n - 1 - changedCount);
        exclusionCount++;
        LOGGER.debug("Added {} for pattern {}", name, Arrays.toString(changed));
    }

    private void require(BackendCapability capability, String operation) {
        if (!backend.supports(capability)) {
            throw new UnsupportedBackendOperationException(capability, "backend " + backend.getName() + " cannot " + operation);
        }
    }
}
