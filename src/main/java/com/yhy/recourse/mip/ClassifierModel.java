package com.yhy.recourse.mip;

import com.yhy.recourse.mip.exception.RecourseConfigurationException;

import java.util.Arrays;

/**
 * Linear score function {@code w . x + b}. Immutable.
 */
public final class ClassifierModel {

    private final double[] coefficients;
    private final double intercept;

    public ClassifierModel(double[] coefficients, double intercept) {
        if (coefficients == null || coefficients.length == 0) {
            throw new RecourseConfigurationException("classifier needs at least one coefficient");
        }
        for (int j = 0; j < coefficients.length; j++) {
            if (!Double.isFinite(coefficients[j])) {
                throw new RecourseConfigurationException("coefficient " + j + " is not finite");
            }
        }
        if (!Double.isFinite(intercept)) {
            throw new RecourseConfigurationException("intercept is not finite");
        }
        this.coefficients = coefficients.clone();
        this.intercept = intercept;
    }

    public int size() {
        return coefficients.length;
    }

    public double coefficient(int j) {
        return coefficients[j];
    }

    public double[] getCoefficients() {
        return coefficients.clone();
    }

    public double getIntercept() {
        return intercept;
    }

    public double score(double[] x) {
        if (x.length != coefficients.length) {
            throw new RecourseConfigurationException("expected " + coefficients.length + " values, got " + x.length);
        }
        double s = intercept;
        for (int j = 0; j < x.length; j++) {
            s += coefficients[j] * x[j];
        }
        return s;
    }

    public double prediction(double[] x) {
        return Math.signum(score(x));
    }

    @Override
    public String toString() {
        return "ClassifierModel{coefficients=" + Arrays.toString(coefficients) + ", intercept=" + intercept + "}";
    }
}
