package com.flagship.property_acquisition.exception;

/**
 * The store was unreachable or a step failed for a reason the caller cannot act on.
 * Raised after any compensation for the failed operation has run.
 */
public class InternalFailureException extends AcquisitionException {

    public InternalFailureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.INTERNAL;
    }
}
