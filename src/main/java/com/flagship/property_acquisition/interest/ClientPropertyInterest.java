package com.flagship.property_acquisition.interest;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One client's relationship to one property. There is a single row per
 * (client, property) pair; re-expressing interest after cancellation reuses it.
 */
@Value
@Builder(toBuilder = true)
public class ClientPropertyInterest {
    UUID id;
    UUID clientId;
    UUID propertyId;
    InterestStatus status;
    Instant reservationDate;
    BigDecimal depositAmount;
    Instant depositPaidAt;
    String paymentReference;
    Instant paymentVerifiedAt;
    Instant agreementGeneratedAt;
    Instant agreementSignedAt;
    String agreementSignature;
    String notes;
    Instant createdAt;
    Instant updatedAt;

    public static ClientPropertyInterest newActive(UUID clientId, UUID propertyId) {
        Instant now = Instant.now();
        return ClientPropertyInterest.builder()
                .id(UUID.randomUUID())
                .clientId(clientId)
                .propertyId(propertyId)
                .status(InterestStatus.ACTIVE)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    public boolean isAgreementSigned() {
        return agreementSignedAt != null;
    }
}
