package com.flagship.property_acquisition.interest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class SignAgreementRequest {

    @NotBlank(message = "Signature is required")
    @JsonProperty("signature")
    String signature;
}
