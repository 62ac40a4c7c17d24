package com.flagship.property_acquisition.interest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_acquisition.interest.DepositCommand;
import com.flagship.property_acquisition.payment.PaymentMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request body for a deposit payment. The reference is the gateway's transaction id and
 * doubles as the idempotency key of the payment.
 */
@Value
public class PayDepositRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotBlank(message = "Payment reference is required")
    @JsonProperty("payment_reference")
    String paymentReference;

    @NotNull(message = "Payment method is required")
    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    public DepositCommand toCommand() {
        return DepositCommand.builder()
            .amount(amount)
            .paymentReference(paymentReference.trim())
            .paymentMethod(paymentMethod)
            .build();
    }
}
