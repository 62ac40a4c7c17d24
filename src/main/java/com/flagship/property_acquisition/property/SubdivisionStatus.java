package com.flagship.property_acquisition.property;

/**
 * Subdivision lifecycle of a property.
 *
 * SUBDIVIDED is terminal: the original listing is replaced by its parts and can no
 * longer be handed over or subdivided again.
 */
public enum SubdivisionStatus {
    NOT_STARTED,
    SUB_DIVISION_STARTED,
    SUBDIVIDED
}
