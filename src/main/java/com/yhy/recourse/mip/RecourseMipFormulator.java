package com.yhy.recourse.mip;

import com.yhy.recourse.mip.exception.RecourseConfigurationException;
import com.yhy.recourse.mip.solver.ConstraintSense;
import com.yhy.recourse.mip.solver.MipBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Writes the recourse MIP into a backend.
 * <pre>
 * min  Cost(a)
 * s.t. sum_j w[j] a[j]                &gt;= -score(x)
 *      a[j] - sum_k u[j][k] delta[j][k] = 0
 *      sum_k u[j][k]                    = 1
 *      sum_j u[j][0]                   &gt;= n - max_items
 *      sum_j u[j][0]                   &lt;= n - max(min_items, 1)
 * </pre>
 * The cardinality rows count untouched features through the no-op
 * indicators {@code u[j][0]}, so no counting variables are needed.
 */
public class RecourseMipFormulator {

    private static final Logger LOGGER = LoggerFactory.getLogger(RecourseMipFormulator.class);

    public RecourseMip formulate(MipEncoding encoding, double score, CostType costType, int minItems, int maxItems,
                                 MipBackend backend) {
        int n = encoding.size();
        List<FeatureEncoding> features = encoding.getFeatures();
        boolean maxCost = costType == CostType.MAX;

        // a[j]
        int[] actionVars = new int[n];
        for (int i = 0; i < n; i++) {
            actionVars[i] = backend.addContinuous(features.get(i).getActionVarName(),
                    encoding.getActionLowerBounds()[i], encoding.getActionUpperBounds()[i], 0.0);
        }

        // sum_j w[j] a[j] >= -score
        backend.addConstraint(RecourseMip.SCORE_ROW, actionVars, encoding.getCoefficients(), ConstraintSense.GE, -score);

        // u[j][k] with 1-of-K selection
        int[][] indicatorVars = new int[n][];
        for (int i = 0; i < n; i++) {
            FeatureEncoding f = features.get(i);
            CostCurve curve = f.getCurve();
            int size = curve.size();
            indicatorVars[i] = new int[size];
            for (int k = 0; k < size; k++) {
                double objective = maxCost ? 0.0 : curve.cost(k);
                indicatorVars[i][k] = backend.addBinary(f.getIndicatorNames().get(k), objective);
            }

            int[] setVars = new int[size + 1];
            double[] setCoefficients = new double[size + 1];
            setVars[0] = actionVars[i];
            setCoefficients[0] = -1.0;
            double[] ones = new double[size];
            for (int k = 0; k < size; k++) {
                setVars[k + 1] = indicatorVars[i][k];
                setCoefficients[k + 1] = curve.action(k);
                ones[k] = 1.0;
            }
            backend.addConstraint("set_a[" + f.getFeatureIndex() + "]", setVars, setCoefficients, ConstraintSense.EQ, 0.0);
            backend.addConstraint("pick_a[" + f.getFeatureIndex() + "]", indicatorVars[i], ones, ConstraintSense.EQ, 1.0);
        }

        // n - max_items <= sum_j u[j][0] <= n - min_items
        int[] noOps = new int[n];
        double[] ones = new double[n];
        for (int i = 0; i < n; i++) {
            noOps[i] = indicatorVars[i][0];
            ones[i] = 1.0;
        }
        backend.addConstraint(RecourseMip.MAX_ITEMS_ROW, noOps, ones, ConstraintSense.GE, n - maxItems);
        backend.addConstraint(RecourseMip.MIN_ITEMS_ROW, noOps, ones, ConstraintSense.LE, n - Math.max(minItems, 1));

        int[] costVars = null;
        int maxCostVar = -1;
        if (maxCost) {
            double epsilon = encoding.epsilon();
            maxCostVar = backend.addContinuous("max_cost", 0.0, Double.POSITIVE_INFINITY, 1.0);
            costVars = new int[n];
            for (int i = 0; i < n; i++) {
                FeatureEncoding f = features.get(i);
                CostCurve curve = f.getCurve();
                costVars[i] = backend.addContinuous(f.getCostVarName(), 0.0, Double.POSITIVE_INFINITY, epsilon);

                // c[j] = sum_k u[j][k] cost[j][k]
                int size = curve.size();
                int[] defVars = new int[size + 1];
                double[] defCoefficients = new double[size + 1];
                defVars[0] = costVars[i];
                defCoefficients[0] = -1.0;
                for (int k = 0; k < size; k++) {
                    defVars[k + 1] = indicatorVars[i][k];
                    defCoefficients[k + 1] = curve.cost(k);
                }
                backend.addConstraint("def_cost[" + f.getFeatureIndex() + "]", defVars, defCoefficients, ConstraintSense.EQ, 0.0);

                // max_cost >= c[j]
                backend.addConstraint("set_max_cost[" + f.getFeatureIndex() + "]",
                        new int[]{maxCostVar, costVars[i]}, new double[]{1.0, -1.0}, ConstraintSense.GE, 0.0);
            }
            LOGGER.debug("Max-cost objective with epsilon {}", epsilon);
        }

        LOGGER.info("Built recourse MIP on {}: {} features, {} indicators, cost type {}, items [{}, {}]",
                backend.getName(), n, encoding.getIndicatorNames().size(), costType, minItems, maxItems);
        return new RecourseMip(backend, encoding, costType, actionVars, indicatorVars, costVars, maxCostVar, minItems, maxItems);
    }

    /**
     * @throws RecourseConfigurationException unless {@code 0 <= minItems <= maxItems <= featureCount}
     */
    public static void validateItemLimits(int minItems, int maxItems, int featureCount) {
        if (minItems < 0 || maxItems < 0) {
            throw new RecourseConfigurationException("item limits must be non-negative");
        }
        if (minItems > maxItems) {
            throw new RecourseConfigurationException("min_items " + minItems + " exceeds max_items " + maxItems);
        }
        if (maxItems > featureCount) {
            throw new RecourseConfigurationException("max_items " + maxItems + " exceeds the " + featureCount + " features");
        }
    }
}
