package com.yhy.recourse.mip;

import lombok.Value;

import java.util.List;

/**
 * Variable names for one encoded feature {@code j}: the action {@code a[j]},
 * the indicators {@code u[j][k]} (one per curve point, {@code u[j][0]} being
 * the no-op) and the cost {@code c[j]}.
 */
@Value
public class FeatureEncoding {

    CostCurve curve;

    String actionVarName;

    List<String> indicatorNames;

    String costVarName;

    public int getFeatureIndex() {
        return curve.getFeatureIndex();
    }

    public String getFeatureName() {
        return curve.getFeatureName();
    }

    public double getCoefficient() {
        return curve.getCoefficient();
    }

    public String getNoOpIndicatorName() {
        return indicatorNames.get(0);
    }
}
