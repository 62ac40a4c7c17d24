package com.flagship.property_acquisition.notification;

/**
 * Events emitted by the acquisition flow, with the title and priority the admin
 * notification feed shows for them.
 */
public enum AcquisitionEventType {
    INTEREST_EXPRESSED("New interest in property", Priority.LOW),
    PROPERTY_RESERVED("Property reserved", Priority.MEDIUM),
    INTEREST_CANCELLED("Interest cancelled", Priority.LOW),
    PROPERTY_COMMITTED("Client committed to property", Priority.HIGH),
    AGREEMENT_SIGNED("Agreement signed", Priority.HIGH),
    DEPOSIT_PENDING("Deposit awaiting verification", Priority.HIGH),
    DEPOSIT_PAID("Deposit paid", Priority.HIGH),
    HANDOVER_STARTED("Handover started", Priority.HIGH),
    HANDOVER_STAGE_UPDATED("Handover stage updated", Priority.MEDIUM),
    HANDOVER_COMPLETED("Handover completed", Priority.HIGH),
    SUBDIVISION_STATUS_CHANGED("Subdivision status changed", Priority.MEDIUM);

    private final String title;
    private final Priority priority;

    AcquisitionEventType(String title, Priority priority) {
        this.title = title;
        this.priority = priority;
    }

    public String getTitle() {
        return title;
    }

    public Priority getPriority() {
        return priority;
    }

    public enum Priority {
        LOW,
        MEDIUM,
        HIGH
    }
}
