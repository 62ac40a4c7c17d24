package com.flagship.property_acquisition.handover.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_acquisition.handover.HandoverResult;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

@Value
@Builder
public class HandoverStartResponse {

    @JsonProperty("outcome")
    HandoverResult.Outcome outcome;

    @JsonProperty("property_id")
    UUID propertyId;

    @JsonProperty("pipeline_id")
    UUID pipelineId;

    public static HandoverStartResponse from(HandoverResult result) {
        return HandoverStartResponse.builder()
            .outcome(result.getOutcome())
            .propertyId(result.getPropertyId())
            .pipelineId(result.getPipelineId())
            .build();
    }
}
