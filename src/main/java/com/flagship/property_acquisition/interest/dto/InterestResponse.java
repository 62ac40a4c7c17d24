package com.flagship.property_acquisition.interest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_acquisition.interest.ClientPropertyInterest;
import com.flagship.property_acquisition.interest.InterestStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class InterestResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("client_id")
    UUID clientId;

    @JsonProperty("property_id")
    UUID propertyId;

    @JsonProperty("status")
    InterestStatus status;

    @JsonProperty("reservation_date")
    Instant reservationDate;

    @JsonProperty("agreement_signed_at")
    Instant agreementSignedAt;

    @JsonProperty("deposit_amount")
    BigDecimal depositAmount;

    @JsonProperty("deposit_paid_at")
    Instant depositPaidAt;

    @JsonProperty("payment_reference")
    String paymentReference;

    @JsonProperty("payment_verified_at")
    Instant paymentVerifiedAt;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static InterestResponse from(ClientPropertyInterest interest) {
        return InterestResponse.builder()
            .id(interest.getId())
            .clientId(interest.getClientId())
            .propertyId(interest.getPropertyId())
            .status(interest.getStatus())
            .reservationDate(interest.getReservationDate())
            .agreementSignedAt(interest.getAgreementSignedAt())
            .depositAmount(interest.getDepositAmount())
            .depositPaidAt(interest.getDepositPaidAt())
            .paymentReference(interest.getPaymentReference())
            .paymentVerifiedAt(interest.getPaymentVerifiedAt())
            .notes(interest.getNotes())
            .updatedAt(interest.getUpdatedAt())
            .build();
    }
}
