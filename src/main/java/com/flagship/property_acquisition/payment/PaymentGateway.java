package com.flagship.property_acquisition.payment;

/**
 * External payment gateway. Only the settlement lookup is used by the acquisition flow.
 */
public interface PaymentGateway {

    SettlementStatus verify(String paymentReference);
}
