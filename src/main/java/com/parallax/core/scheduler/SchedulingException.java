package com.parallax.core.scheduler;

/**
 * Graph-level inconsistency that is fatal to a run: cyclic or dangling group dependencies,
 * or a dispatcher stall.
 */
public class SchedulingException extends RuntimeException {

    public static final String UNKNOWN_DEPENDENCY = "UNKNOWN_DEPENDENCY";
    public static final String DUPLICATE_GROUP = "DUPLICATE_GROUP";
    public static final String INTERRUPTED = "INTERRUPTED";

    private final String errorCode;

    public SchedulingException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
