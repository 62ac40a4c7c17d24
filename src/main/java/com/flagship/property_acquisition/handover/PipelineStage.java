package com.flagship.property_acquisition.handover;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

/**
 * One stage record inside the pipeline's JSON stage document.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class PipelineStage {

    @JsonProperty("stage_number")
    int stageNumber;

    @JsonProperty("name")
    String name;

    @JsonProperty("status")
    StageStatus status;

    @JsonProperty("completed")
    boolean completed;

    @JsonProperty("started_at")
    Instant startedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("notes")
    String notes;

    /**
     * Returns a copy moved to {@code newStatus}, stamping the start and completion
     * times the first time they are reached.
     */
    public PipelineStage moveTo(StageStatus newStatus, String newNotes, Instant now) {
        PipelineStageBuilder builder = toBuilder()
                .status(newStatus)
                .completed(newStatus == StageStatus.COMPLETED);
        if (newStatus != StageStatus.PENDING && startedAt == null) {
            builder.startedAt(now);
        }
        if (newStatus == StageStatus.COMPLETED) {
            builder.completedAt(completedAt != null ? completedAt : now);
        } else {
            builder.completedAt(null);
        }
        if (newNotes != null) {
            builder.notes(newNotes);
        }
        return builder.build();
    }
}
