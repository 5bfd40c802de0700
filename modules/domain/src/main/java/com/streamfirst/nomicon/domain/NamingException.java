package com.streamfirst.nomicon.domain;

/**
 * Base type for every failure the naming engine reports. Failures are deterministic functions of
 * the inputs, so callers should not retry without changing them.
 */
public abstract class NamingException extends RuntimeException {

    protected NamingException(String message) {
        super(message);
    }

    protected NamingException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stable machine-readable code (e.g., "CONSTRAINT_VIOLATION").
     */
    public abstract String errorCode();
}
