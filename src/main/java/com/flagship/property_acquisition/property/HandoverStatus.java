package com.flagship.property_acquisition.property;

import java.util.EnumSet;
import java.util.Set;

/**
 * Handover status of a property.
 *
 * NOT_STARTED and AWAITING_START both mean "no handover yet" and are the only
 * statuses from which a property can be committed to a client. A handover pipeline
 * row exists exactly when the status is IN_PROGRESS or COMPLETED.
 */
public enum HandoverStatus {
    NOT_STARTED,
    AWAITING_START,
    IN_PROGRESS,
    COMPLETED;

    public static final Set<HandoverStatus> AVAILABLE_FOR_COMMITMENT = EnumSet.of(NOT_STARTED, AWAITING_START);

    public boolean isAvailableForCommitment() {
        return AVAILABLE_FOR_COMMITMENT.contains(this);
    }

    public boolean hasPipeline() {
        return this == IN_PROGRESS || this == COMPLETED;
    }
}
