package com.yhy.recourse.mip.exception;

/**
 * The solver backend could not be created or returned an abnormal status.
 */
public class MipSolverException extends RecourseException {

    private static final long serialVersionUID = 1L;

    public MipSolverException(String message) {
        super(message);
    }

    public MipSolverException(String message, Throwable cause) {
        super(message, cause);
    }
}
