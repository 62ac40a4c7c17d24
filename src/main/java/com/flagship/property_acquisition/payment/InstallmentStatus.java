package com.flagship.property_acquisition.payment;

/**
 * Verification is additive: a PENDING_VERIFICATION installment may become VERIFIED,
 * and a VERIFIED installment never changes again (enforced by a database trigger).
 */
public enum InstallmentStatus {
    PENDING_VERIFICATION,
    VERIFIED
}
