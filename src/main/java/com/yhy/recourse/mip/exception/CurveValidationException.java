package com.yhy.recourse.mip.exception;

/**
 * A feature's feasible-cost curve is degenerate, non-unique or wrong-signed.
 * Points at malformed upstream grid data.
 */
public class CurveValidationException extends RecourseException {

    private static final long serialVersionUID = 1L;

    private final String featureName;

    public CurveValidationException(String featureName, String message) {
        super("invalid cost curve for feature '" + featureName + "': " + message);
        this.featureName = featureName;
    }

    public String getFeatureName() {
        return featureName;
    }
}
