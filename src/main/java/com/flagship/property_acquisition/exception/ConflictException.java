package com.flagship.property_acquisition.exception;

/**
 * A conditional write affected zero rows: another request changed the row between
 * our read and our write. Safe to retry after re-reading.
 */
public class ConflictException extends AcquisitionException {

    public ConflictException(String message) {
        super(message);
    }

    public ConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.CONFLICT;
    }
}
