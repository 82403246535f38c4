package com.yhy.recourse.mip;

import com.yhy.recourse.mip.solver.BackendCapability;

/**
 * Rule for excluding a recorded item from later solves of the same flipset.
 */
public enum EnumerationPolicy {

    /** Features changed by a recorded item stay untouched afterwards, so items touch disjoint features. */
    MUTUALLY_EXCLUSIVE(BackendCapability.BOUND_MUTATION),

    /** The exact on/off pattern of a recorded item is cut off; any other pattern may follow. */
    DISTINCT_SUBSETS(BackendCapability.INCREMENTAL_CONSTRAINTS);

    private final BackendCapability requiredCapability;

    EnumerationPolicy(BackendCapability requiredCapability) {
        this.requiredCapability = requiredCapability;
    }

    public BackendCapability getRequiredCapability() {
        return requiredCapability;
    }
}
