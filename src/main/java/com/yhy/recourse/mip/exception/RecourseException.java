package com.yhy.recourse.mip.exception;

/**
 * Base type for failures raised by the recourse engine.
 */
public class RecourseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RecourseException(String message) {
        super(message);
    }

    public RecourseException(String message, Throwable cause) {
        super(message, cause);
    }
}
