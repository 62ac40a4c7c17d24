package com.flagship.property_acquisition.interest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class CancelInterestRequest {

    @Size(max = 500, message = "Reason must be at most 500 characters")
    @JsonProperty("reason")
    String reason;
}
