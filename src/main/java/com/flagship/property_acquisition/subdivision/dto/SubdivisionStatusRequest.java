package com.flagship.property_acquisition.subdivision.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_acquisition.property.SubdivisionStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class SubdivisionStatusRequest {

    @NotNull(message = "Status is required")
    @JsonProperty("status")
    SubdivisionStatus status;
}
