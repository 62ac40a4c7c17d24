package com.flagship.property_acquisition.exception;

public class NotFoundException extends AcquisitionException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.NOT_FOUND;
    }
}
