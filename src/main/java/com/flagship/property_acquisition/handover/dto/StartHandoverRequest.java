package com.flagship.property_acquisition.handover.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_acquisition.handover.TriggerEvent;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

@Value
public class StartHandoverRequest {

    @NotNull(message = "Client ID is required")
    @JsonProperty("client_id")
    UUID clientId;

    @NotNull(message = "Trigger event is required")
    @JsonProperty("trigger_event")
    TriggerEvent triggerEvent;

    @Size(max = 1000, message = "Notes must be at most 1000 characters")
    @JsonProperty("notes")
    String notes;
}
