package com.flagship.property_acquisition.subdivision.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_acquisition.property.HandoverStatus;
import com.flagship.property_acquisition.property.Property;
import com.flagship.property_acquisition.property.SubdivisionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PropertyResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("name")
    String name;

    @JsonProperty("handover_status")
    HandoverStatus handoverStatus;

    @JsonProperty("subdivision_status")
    SubdivisionStatus subdivisionStatus;

    @JsonProperty("committed_client_id")
    UUID committedClientId;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static PropertyResponse from(Property property) {
        return PropertyResponse.builder()
            .id(property.getId())
            .name(property.getName())
            .handoverStatus(property.getHandoverStatus())
            .subdivisionStatus(property.getSubdivisionStatus())
            .committedClientId(property.getCommittedClientId())
            .updatedAt(property.getUpdatedAt())
            .build();
    }
}
