package com.yhy.recourse.mip.solver;

public enum BackendType {
    OR_TOOLS,
    OJALGO
}
