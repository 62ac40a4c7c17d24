package com.flagship.property_acquisition.payment;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * One entry of the per-property payment ledger. Installments are append-only and
 * numbered 1, 2, 3... per property from a store-side sequence.
 */
@Value
@Builder(toBuilder = true)
public class PaymentInstallment {
    UUID id;
    UUID propertyId;
    UUID interestId;
    UUID clientId;
    int installmentNumber;
    BigDecimal amount;
    PaymentMethod paymentMethod;
    String paymentReference;
    InstallmentStatus status;
    String verifiedBy;
    Instant verifiedAt;
    Instant createdAt;

    public boolean isVerified() {
        return status == InstallmentStatus.VERIFIED;
    }
}
