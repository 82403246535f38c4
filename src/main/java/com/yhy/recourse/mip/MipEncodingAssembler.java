package com.yhy.recourse.mip;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Builds a cost curve for every actionable feature and flattens the result
 * into {@link MipEncoding}.
 */
public class MipEncodingAssembler {

    private static final Logger LOGGER = LoggerFactory.getLogger(MipEncodingAssembler.class);

    static final double COST_TOLERANCE = 1e-9;

    public MipEncoding assemble(ActionSet actionSet, ClassifierModel classifier, double[] x, CostType costType) {
        CostCurveBuilder curveBuilder = new CostCurveBuilder(costType);
        List<FeatureEncoding> features = new ArrayList<>();
        for (int j = 0; j < actionSet.size(); j++) {
            if (!actionSet.isActionable(j)) {
                continue;
            }
            String name = actionSet.getName(j);
            Optional<CostCurve> curve = curveBuilder.build(name, j, classifier.coefficient(j), actionSet.feasibleGrid(j, x[j]));
            curve.ifPresent(c -> features.add(encode(c)));
        }
        MipEncoding encoding = flatten(features);
        LOGGER.debug("Encoded {} of {} actionable features, {} indicators", encoding.size(), actionSet.actionableCount(),
                encoding.getIndicatorNames().size());
        return encoding;
    }

    private static FeatureEncoding encode(CostCurve curve) {
        int j = curve.getFeatureIndex();
        List<String> indicators = new ArrayList<>(curve.size());
        for (int k = 0; k < curve.size(); k++) {
            indicators.add("u[" + j + "][" + k + "]");
        }
        return new FeatureEncoding(curve, "a[" + j + "]", List.copyOf(indicators), "c[" + j + "]");
    }

    static MipEncoding flatten(List<FeatureEncoding> features) {
        int n = features.size();
        int[] idx = new int[n];
        double[] coefficients = new double[n];
        double[] lb = new double[n];
        double[] ub = new double[n];
        double[] maxCosts = new double[n];
        List<String> noOps = new ArrayList<>(n);
        List<String> indicators = new ArrayList<>();
        TreeSet<Double> pooledCosts = new TreeSet<>();
        double totalMaxCost = 0.0;

        for (int i = 0; i < n; i++) {
            FeatureEncoding f = features.get(i);
            CostCurve curve = f.getCurve();
            idx[i] = f.getFeatureIndex();
            coefficients[i] = f.getCoefficient();
            lb[i] = curve.minAction();
            ub[i] = curve.maxAction();
            maxCosts[i] = curve.maxCost();
            totalMaxCost += curve.maxCost();
            noOps.add(f.getNoOpIndicatorName());
            indicators.addAll(f.getIndicatorNames());
            for (int k = 0; k < curve.size(); k++) {
                pooledCosts.add(curve.cost(k));
            }
        }

        double minIncrement = Double.POSITIVE_INFINITY;
        Double previous = null;
        for (Double c : pooledCosts) {
            // gaps at rounding level are the same cost computed twice
            if (previous != null && c - previous > COST_TOLERANCE) {
                minIncrement = Math.min(minIncrement, c - previous);
            }
            previous = c;
        }
        if (Double.isInfinite(minIncrement)) {
            minIncrement = 0.0;
        }

        return new MipEncoding(List.copyOf(features), idx, coefficients, List.copyOf(noOps), List.copyOf(indicators),
                lb, ub, maxCosts, minIncrement, totalMaxCost);
    }
}
