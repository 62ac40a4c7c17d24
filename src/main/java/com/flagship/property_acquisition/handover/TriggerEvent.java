package com.flagship.property_acquisition.handover;

/**
 * What caused a handover to start. Recorded on the pipeline for audit.
 */
public enum TriggerEvent {
    DEPOSIT_PAID,
    AGREEMENT_SIGNED,
    ADMIN_MANUAL
}
