package com.yhy.recourse.mip.solver;

/**
 * Optional features a {@link MipBackend} may declare. Callers branch on these,
 * never on the backend's name.
 */
public enum BackendCapability {

    /** Linear rows can be added after the model has been solved. */
    INCREMENTAL_CONSTRAINTS,

    /** Row right-hand sides and variable bounds can be changed after the model has been solved. */
    BOUND_MUTATION
}
