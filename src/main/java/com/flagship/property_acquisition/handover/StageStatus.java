package com.flagship.property_acquisition.handover;

public enum StageStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED
}
