package com.flagship.property_acquisition.exception;

/**
 * Base type for every caller-visible failure of an acquisition operation.
 *
 * Each subclass maps to one category of the error taxonomy and carries the
 * HTTP-independent {@link ErrorCategory} the REST layer translates into a status code.
 * Callers decide whether to retry from the category alone:
 * <ul>
 *   <li>VALIDATION - never retried, the input is wrong</li>
 *   <li>CONFLICT - an optimistic write was lost, retry with a fresh read</li>
 *   <li>UNAVAILABLE / INVALID_STATE - the resource is not eligible for the transition</li>
 *   <li>NOT_FOUND - a referenced row does not exist</li>
 *   <li>INTERNAL - store unreachable or an unexpected failure</li>
 * </ul>
 */
public abstract class AcquisitionException extends RuntimeException {

    protected AcquisitionException(String message) {
        super(message);
    }

    protected AcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCategory getCategory();

    public enum ErrorCategory {
        VALIDATION,
        CONFLICT,
        UNAVAILABLE,
        INVALID_STATE,
        NOT_FOUND,
        INTERNAL
    }
}
