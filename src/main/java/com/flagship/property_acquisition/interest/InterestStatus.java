package com.flagship.property_acquisition.interest;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one client's interest in one property.
 *
 * <pre>
 * ACTIVE -> RESERVED -> COMMITTED -> CONVERTED -> IN_HANDOVER
 *   \________\__________ INACTIVE (cancellation, or another client committed)
 * </pre>
 *
 * At most one interest per property is ever in a binding status.
 */
public enum InterestStatus {
    ACTIVE,
    RESERVED,
    COMMITTED,
    CONVERTED,
    IN_HANDOVER,
    INACTIVE;

    public static final Set<InterestStatus> CANCELLABLE = EnumSet.of(ACTIVE, RESERVED);

    public static final Set<InterestStatus> BINDING = EnumSet.of(COMMITTED, CONVERTED, IN_HANDOVER);

    public boolean isCancellable() {
        return CANCELLABLE.contains(this);
    }

    public boolean isBinding() {
        return BINDING.contains(this);
    }
}
