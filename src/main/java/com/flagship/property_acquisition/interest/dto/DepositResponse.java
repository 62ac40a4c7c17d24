package com.flagship.property_acquisition.interest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_acquisition.handover.HandoverResult;
import com.flagship.property_acquisition.interest.DepositResult;
import com.flagship.property_acquisition.payment.PaymentInstallment;
import com.flagship.property_acquisition.payment.SettlementStatus;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class DepositResponse {

    @JsonProperty("interest")
    InterestResponse interest;

    @JsonProperty("installment_id")
    UUID installmentId;

    @JsonProperty("installment_number")
    Integer installmentNumber;

    @JsonProperty("settlement_status")
    SettlementStatus settlementStatus;

    @JsonProperty("duplicate")
    boolean duplicate;

    @JsonProperty("handover_outcome")
    HandoverResult.Outcome handoverOutcome;

    @JsonProperty("handover_pipeline_id")
    UUID handoverPipelineId;

    @JsonProperty("handover_failure")
    String handoverFailure;

    public static DepositResponse from(DepositResult result) {
        PaymentInstallment installment = result.getInstallment();
        HandoverResult handover = result.getHandover();
        return DepositResponse.builder()
            .interest(result.getInterest() != null ? InterestResponse.from(result.getInterest()) : null)
            .installmentId(installment != null ? installment.getId() : null)
            .installmentNumber(installment != null ? installment.getInstallmentNumber() : null)
            .settlementStatus(result.getSettlementStatus())
            .duplicate(result.isDuplicate())
            .handoverOutcome(handover != null ? handover.getOutcome() : null)
            .handoverPipelineId(handover != null ? handover.getPipelineId() : null)
            .handoverFailure(result.getHandoverFailure())
            .build();
    }
}
