package com.flagship.property_acquisition.interest;

import com.flagship.property_acquisition.payment.PaymentMethod;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class DepositCommand {
    BigDecimal amount;
    String paymentReference;
    PaymentMethod paymentMethod;
}
