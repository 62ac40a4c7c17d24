package com.flagship.property_acquisition.handover;

import lombok.Value;

import java.util.UUID;

/**
 * Result of {@link HandoverTransitionOrchestrator#startHandover}. A concurrent or repeated
 * start is reported as {@link Outcome#ALREADY_IN_PROGRESS}, which callers treat as success.
 */
@Value
public class HandoverResult {

    public enum Outcome {
        STARTED,
        ALREADY_IN_PROGRESS
    }

    Outcome outcome;
    UUID propertyId;
    UUID pipelineId;

    public static HandoverResult started(UUID propertyId, UUID pipelineId) {
        return new HandoverResult(Outcome.STARTED, propertyId, pipelineId);
    }

    public static HandoverResult alreadyInProgress(UUID propertyId, UUID pipelineId) {
        return new HandoverResult(Outcome.ALREADY_IN_PROGRESS, propertyId, pipelineId);
    }

    public boolean isStarted() {
        return outcome == Outcome.STARTED;
    }
}
