package com.flagship.property_acquisition.handover.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_acquisition.handover.StageStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class UpdateStageRequest {

    @NotNull(message = "Status is required")
    @JsonProperty("status")
    StageStatus status;

    @Size(max = 1000, message = "Notes must be at most 1000 characters")
    @JsonProperty("notes")
    String notes;
}
