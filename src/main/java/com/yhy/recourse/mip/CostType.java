package com.yhy.recourse.mip;

/**
 * How per-feature costs are derived from percentiles and aggregated.
 */
public enum CostType {

    /** Sum of percentile shifts. */
    TOTAL(false),

    /** Sum of log-odds percentile shifts. */
    LOCAL(true),

    /** Largest percentile shift, ties broken by the sum. */
    MAX(false);

    private final boolean logOdds;

    CostType(boolean logOdds) {
        this.logOdds = logOdds;
    }

    public boolean isLogOdds() {
        return logOdds;
    }
}
