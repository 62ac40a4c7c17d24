package com.flagship.property_acquisition.exception;

/**
 * The interest or property is in a status from which the requested transition is not allowed.
 */
public class InvalidStateException extends AcquisitionException {

    public InvalidStateException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.INVALID_STATE;
    }
}
