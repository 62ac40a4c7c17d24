package com.flagship.property_acquisition.handover;

/**
 * Progress marker of one run of the handover saga, used in logs and on failure
 * to tell which writes were compensated.
 */
public enum HandoverSagaState {
    START,
    PROPERTY_UPDATED,
    PIPELINE_CREATED,
    INTEREST_UPDATED,
    DONE
}
