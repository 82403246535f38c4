package com.yhy.recourse.mip.exception;

/**
 * Invalid shapes, non-finite inputs or item limits outside {@code [0, n]}.
 * Never retried.
 */
public class RecourseConfigurationException extends RecourseException {

    private static final long serialVersionUID = 1L;

    public RecourseConfigurationException(String message) {
        super(message);
    }
}
