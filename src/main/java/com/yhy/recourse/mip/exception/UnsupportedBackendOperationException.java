package com.yhy.recourse.mip.exception;

import com.yhy.recourse.mip.solver.BackendCapability;

/**
 * The active solver backend does not declare the capability an operation needs.
 */
public class UnsupportedBackendOperationException extends RecourseException {

    private static final long serialVersionUID = 1L;

    private final BackendCapability capability;

    public UnsupportedBackendOperationException(BackendCapability capability, String message) {
        super(message + " (requires " + capability + ")");
        this.capability = capability;
    }

    public BackendCapability getCapability() {
        return capability;
    }
}
