package com.flagship.property_acquisition.payment;

public enum PaymentMethod {
    BANK_TRANSFER,
    CARD,
    MOBILE_MONEY
}
