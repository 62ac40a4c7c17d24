package com.flagship.property_acquisition.interest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class VerifyDepositRequest {

    @NotBlank(message = "Verifier is required")
    @JsonProperty("verified_by")
    String verifiedBy;
}
