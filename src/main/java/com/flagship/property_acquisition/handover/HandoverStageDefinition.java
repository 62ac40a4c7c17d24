package com.flagship.property_acquisition.handover;

import java.util.Arrays;

/**
 * The five fixed stages every handover pipeline goes through, in order.
 */
public enum HandoverStageDefinition {
    INITIAL_PREPARATION(1, "Initial Handover Preparation"),
    DOCUMENTATION_AND_SURVEY(2, "Property Documentation & Survey"),
    FINANCIAL_VERIFICATION(3, "Financial Verification"),
    LEGAL_DOCUMENTATION(4, "Legal Documentation"),
    FINAL_HANDOVER(5, "Final Handover");

    public static final int STAGE_COUNT = values().length;

    private final int number;
    private final String displayName;

    HandoverStageDefinition(int number, String displayName) {
        this.number = number;
        this.displayName = displayName;
    }

    public int getNumber() {
        return number;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static HandoverStageDefinition ofNumber(int number) {
        return Arrays.stream(values())
                .filter(stage -> stage.number == number)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No handover stage " + number));
    }
}
