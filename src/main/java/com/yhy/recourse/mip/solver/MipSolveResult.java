package com.yhy.recourse.mip.solver;

import lombok.Builder;
import lombok.Value;

/**
 * Raw output of one {@link MipBackend#solve()} call. Diagnostics a backend
 * cannot report are left at their defaults ({@code NaN} or {@code 0}).
 */
@Value
@Builder
public class MipSolveResult {

    MipStatus status;

    String statusText;

    @Builder.Default
    double objectiveValue = Double.NaN;

    @Builder.Default
    double bestBound = Double.NaN;

    @Builder.Default
    double relativeGap = Double.NaN;

    long iterations;

    long nodesProcessed;

    long nodesRemaining;

    double wallSeconds;

    /** Solution values indexed by variable id; empty when no primal solution exists. */
    @Builder.Default
    double[] values = new double[0];

    public boolean isPrimalFeasible() {
        return status != null && status.isPrimalFeasible();
    }

    public double value(int variable) {
        return values[variable];
    }
}
