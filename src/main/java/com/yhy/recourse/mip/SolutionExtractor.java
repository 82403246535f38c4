package com.yhy.recourse.mip;

import com.yhy.recourse.mip.solver.MipSolveResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a raw backend result back into a {@link SolutionRecord} and runs the
 * advisory checks. Problems found by the checks end up in
 * {@link SolutionRecord#getWarnings()}; nothing here throws on a bad solution.
 */
public class SolutionExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SolutionExtractor.class);

    static final double ACTION_TOLERANCE = 1e-8;
    static final double BOUNDARY_TOLERANCE = 1e-4;
    static final double COST_TOLERANCE = 1e-4;
    static final double LINK_TOLERANCE = 1e-6;

    private final ActionSet actionSet;
    private final ClassifierModel classifier;

    public SolutionExtractor(ActionSet actionSet, ClassifierModel classifier) {
        this.actionSet = actionSet;
        this.classifier = classifier;
    }

    public SolutionRecord extract(RecourseMip mip, MipSolveResult result, double[] x, boolean checkFlag) {
        int d = actionSet.size();
        if (!result.isPrimalFeasible()) {
            LOGGER.info("No feasible action: {}", result.getStatusText());
            return SolutionRecord.infeasible(d, result.getStatusText(), result.getIterations(),
                    result.getNodesProcessed(), result.getNodesRemaining(), result.getWallSeconds());
        }

        List<String> warnings = new ArrayList<>();
        double[] actions = new double[d];
        double[] costs = new double[d];
        MipEncoding encoding = mip.getEncoding();
        for (int i = 0; i < encoding.size(); i++) {
            FeatureEncoding f = encoding.getFeatures().get(i);
            CostCurve curve = f.getCurve();
            int k = mip.selectedPoint(result, i);
            double delta = curve.action(k);
            double solverAction = result.value(mip.actionVar(i));
            if (checkFlag && Math.abs(solverAction - delta) > LINK_TOLERANCE * Math.max(1.0, Math.abs(delta))) {
                warnings.add(String.format("numerical issue: %s = %.8f but selected point has delta %.8f",
                        f.getActionVarName(), solverAction, delta));
            }
            actions[f.getFeatureIndex()] = delta;
            costs[f.getFeatureIndex()] = curve.cost(k);
        }

        double cost = mip.getCostType() == CostType.MAX ? result.value(mip.maxCostVar()) : result.getObjectiveValue();

        List<String> changed = new ArrayList<>();
        for (int j = 0; j < d; j++) {
            if (Math.abs(actions[j]) > ACTION_TOLERANCE) {
                changed.add(actionSet.getName(j));
            }
        }

        if (checkFlag) {
            check(mip, x, actions, costs, cost, warnings);
            warnings.forEach(w -> LOGGER.warn(w));
        }

        LOGGER.info("Solve finished with status {}, cost {}, changed {}", result.getStatusText(), cost, changed);
        return SolutionRecord.builder()
                .feasible(true)
                .status(result.getStatusText())
                .cost(cost)
                .actions(boxed(actions))
                .costs(boxed(costs))
                .changedFeatures(changed)
                .upperBound(result.getObjectiveValue())
                .lowerBound(result.getBestBound())
                .gap(result.getRelativeGap())
                .iterations(result.getIterations())
                .nodesProcessed(result.getNodesProcessed())
                .nodesRemaining(result.getNodesRemaining())
                .runtime(result.getWallSeconds())
                .warnings(warnings)
                .build();
    }

    private void check(RecourseMip mip, double[] x, double[] actions, double[] costs, double cost, List<String> warnings) {
        int d = actions.length;
        int changedCount = 0;
        for (int j = 0; j < d; j++) {
            boolean changed = Math.abs(actions[j]) > ACTION_TOLERANCE;
            if (changed) {
                changedCount++;
                if (!actionSet.isActionable(j)) {
                    warnings.add("feature " + actionSet.getName(j) + " changed but is not actionable");
                }
                if (!(costs[j] > 0.0)) {
                    warnings.add("feature " + actionSet.getName(j) + " changed at non-positive cost " + costs[j]);
                }
            } else if (Math.abs(costs[j]) > COST_TOLERANCE) {
                warnings.add("feature " + actionSet.getName(j) + " untouched but has cost " + costs[j]);
            }
        }

        int lower = Math.max(mip.getMinItems(), 1);
        if (changedCount < lower || changedCount > mip.getMaxItems()) {
            warnings.add("changed " + changedCount + " features, outside [" + lower + ", " + mip.getMaxItems() + "]");
        }

        double[] moved = x.clone();
        for (int j = 0; j < d; j++) {
            moved[j] += actions[j];
        }
        if (classifier.prediction(x) == classifier.prediction(moved)) {
            double score = classifier.score(moved);
            if (Math.abs(score) <= BOUNDARY_TOLERANCE) {
                warnings.add(String.format("numerical issue: near-zero score(x + a) = %.8f", score));
            } else {
                warnings.add(String.format("action does not flip the prediction, score(x + a) = %.8f", score));
            }
        }

        double aggregate = mip.getCostType() == CostType.MAX
                ? Arrays.stream(costs).max().orElse(0.0)
                : Arrays.stream(costs).sum();
        if (Math.abs(cost - aggregate) > COST_TOLERANCE * Math.max(Math.abs(aggregate), 1e-10)) {
            warnings.add(String.format("numerical issue: reported cost %.6f but %s of costs is %.6f",
                    cost, mip.getCostType() == CostType.MAX ? "maximum" : "sum", aggregate));
        }
    }

    private static List<Double> boxed(double[] values) {
        List<Double> list = new ArrayList<>(values.length);
        for (double v : values) {
            list.add(v);
        }
        return list;
    }
}
