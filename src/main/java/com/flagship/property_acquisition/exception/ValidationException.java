package com.flagship.property_acquisition.exception;

import lombok.Getter;

/**
 * Malformed or missing input. Carries the offending field so the REST layer can
 * surface a field-specific message.
 */
@Getter
public class ValidationException extends AcquisitionException {

    private final String field;

    public ValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.VALIDATION;
    }
}
