package com.yhy.recourse.mip.solver;

public enum MipStatus {
    OPTIMAL,
    FEASIBLE,
    INFEASIBLE,
    UNBOUNDED,
    NOT_SOLVED;

    public boolean isPrimalFeasible() {
        return this == OPTIMAL || this == FEASIBLE;
    }
}
