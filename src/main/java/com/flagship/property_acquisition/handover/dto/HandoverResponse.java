package com.flagship.property_acquisition.handover.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_acquisition.handover.HandoverPipeline;
import com.flagship.property_acquisition.handover.PipelineStage;
import com.flagship.property_acquisition.handover.TriggerEvent;
import com.flagship.property_acquisition.property.HandoverStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class HandoverResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("property_id")
    UUID propertyId;

    @JsonProperty("client_id")
    UUID clientId;

    @JsonProperty("buyer_name")
    String buyerName;

    @JsonProperty("trigger_event")
    TriggerEvent triggerEvent;

    @JsonProperty("asking_price")
    BigDecimal askingPrice;

    @JsonProperty("deposit_received")
    BigDecimal depositReceived;

    @JsonProperty("current_stage")
    int currentStage;

    @JsonProperty("overall_progress")
    int overallProgress;

    @JsonProperty("handover_status")
    HandoverStatus handoverStatus;

    @JsonProperty("pipeline_stages")
    List<PipelineStage> pipelineStages;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static HandoverResponse from(HandoverPipeline pipeline) {
        return HandoverResponse.builder()
            .id(pipeline.getId())
            .propertyId(pipeline.getPropertyId())
            .clientId(pipeline.getClientId())
            .buyerName(pipeline.getBuyerName())
            .triggerEvent(pipeline.getTriggerEvent())
            .askingPrice(pipeline.getAskingPrice())
            .depositReceived(pipeline.getDepositReceived())
            .currentStage(pipeline.getCurrentStage())
            .overallProgress(pipeline.getOverallProgress())
            .handoverStatus(pipeline.getHandoverStatus())
            .pipelineStages(pipeline.getPipelineStages())
            .createdAt(pipeline.getCreatedAt())
            .updatedAt(pipeline.getUpdatedAt())
            .build();
    }
}
