package com.flagship.property_acquisition.payment;

/**
 * What the payment gateway reports for a payment reference.
 */
public enum SettlementStatus {
    COMPLETED,
    PENDING_VERIFICATION
}
