package com.flagship.property_acquisition.exception;

/**
 * The property is not eligible for the requested transition (completed, subdivided,
 * committed to someone else, locked by the subdivision gate).
 */
public class UnavailableException extends AcquisitionException {

    public UnavailableException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.UNAVAILABLE;
    }
}
