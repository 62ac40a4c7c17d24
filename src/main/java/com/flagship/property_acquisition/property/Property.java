package com.flagship.property_acquisition.property;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Snapshot of a property row.
 *
 * Properties are created by the listing side of the platform and never deleted.
 * This service only moves the acquisition fields (reservation, commitment,
 * handover and subdivision status) and always does so with conditional writes
 * in {@link PropertyStore}; a snapshot is therefore only a hint for which write to attempt.
 */
@Value
@Builder(toBuilder = true)
public class Property {
    UUID id;
    String name;
    BigDecimal askingPrice;
    HandoverStatus handoverStatus;
    ReservationStatus reservationStatus;
    UUID reservedBy;
    UUID committedClientId;
    Instant commitmentDate;
    SubdivisionStatus subdivisionStatus;
    Instant createdAt;
    Instant updatedAt;

    public boolean isCommittedTo(UUID clientId) {
        return committedClientId != null && committedClientId.equals(clientId);
    }

    public boolean isCommittedToOther(UUID clientId) {
        return committedClientId != null && !committedClientId.equals(clientId);
    }

    public boolean isReservedBy(UUID clientId) {
        return reservationStatus == ReservationStatus.RESERVED && clientId.equals(reservedBy);
    }

    public boolean isSubdivided() {
        return subdivisionStatus == SubdivisionStatus.SUBDIVIDED;
    }

    public boolean isSubdivisionActive() {
        return subdivisionStatus == SubdivisionStatus.SUB_DIVISION_STARTED;
    }

    public boolean isCompleted() {
        return handoverStatus == HandoverStatus.COMPLETED;
    }
}
