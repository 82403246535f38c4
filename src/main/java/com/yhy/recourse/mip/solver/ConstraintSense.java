package com.yhy.recourse.mip.solver;

public enum ConstraintSense {
    EQ,
    LE,
    GE
}
