package com.flagship.property_acquisition.handover;

import com.flagship.property_acquisition.property.HandoverStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * The handover record of a property. At most one exists per property, and it exists
 * exactly while the property's handover status is IN_PROGRESS or COMPLETED.
 *
 * Key principles:
 * - Stages are immutable values; every change produces a new pipeline
 * - Current stage and overall progress are always derived from the stages, never set directly
 * - {@code version} guards concurrent stage updates
 */
@Value
@Builder(toBuilder = true)
public class HandoverPipeline {
    UUID id;
    UUID propertyId;
    UUID clientId;
    UUID interestId;
    TriggerEvent triggerEvent;
    String buyerName;
    BigDecimal askingPrice;
    BigDecimal depositReceived;
    int currentStage;
    int overallProgress;
    List<PipelineStage> pipelineStages;
    HandoverStatus handoverStatus;
    long version;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Seeds a new pipeline from the milestones already reached.
     * A signed agreement starts the pipeline at stage 3, a paid deposit at stage 2,
     * otherwise at stage 1. Every earlier stage is completed.
     */
    public static HandoverPipeline seed(UUID propertyId, UUID clientId, UUID interestId,
                                        TriggerEvent triggerEvent, String buyerName,
                                        BigDecimal askingPrice, BigDecimal depositReceived,
                                        boolean agreementSigned, boolean depositPaid, String notes) {
        int startStage = agreementSigned ? 3 : depositPaid ? 2 : 1;
        Instant now = Instant.now();

        List<PipelineStage> stages = new ArrayList<>();
        for (HandoverStageDefinition definition : HandoverStageDefinition.values()) {
            int number = definition.getNumber();
            StageStatus status = number < startStage ? StageStatus.COMPLETED
                    : number == startStage ? StageStatus.IN_PROGRESS
                    : StageStatus.PENDING;
            stages.add(PipelineStage.builder()
                    .stageNumber(number)
                    .name(definition.getDisplayName())
                    .status(status)
                    .completed(status == StageStatus.COMPLETED)
                    .startedAt(status != StageStatus.PENDING ? now : null)
                    .completedAt(status == StageStatus.COMPLETED ? now : null)
                    .notes(number == startStage ? notes : null)
                    .build());
        }

        return HandoverPipeline.builder()
                .id(UUID.randomUUID())
                .propertyId(propertyId)
                .clientId(clientId)
                .interestId(interestId)
                .triggerEvent(triggerEvent)
                .buyerName(buyerName)
                .askingPrice(askingPrice)
                .depositReceived(depositReceived)
                .currentStage(startStage)
                .overallProgress(calculateProgress(stages))
                .pipelineStages(List.copyOf(stages))
                .handoverStatus(HandoverStatus.IN_PROGRESS)
                .version(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * round(100 * (completed + 0.5 * inProgress) / stageCount)
     */
    public static int calculateProgress(List<PipelineStage> stages) {
        if (stages.isEmpty()) {
            return 0;
        }
        long completed = stages.stream().filter(s -> s.getStatus() == StageStatus.COMPLETED).count();
        long inProgress = stages.stream().filter(s -> s.getStatus() == StageStatus.IN_PROGRESS).count();
        BigDecimal weighted = BigDecimal.valueOf(completed * 2 + inProgress)
                .multiply(BigDecimal.valueOf(50))
                .divide(BigDecimal.valueOf(stages.size()), 0, RoundingMode.HALF_UP);
        return weighted.intValue();
    }

    /**
     * Returns a copy with one stage moved to {@code status}. Current stage becomes the
     * first stage that is not completed; when every stage is completed the pipeline
     * itself is COMPLETED.
     */
    public HandoverPipeline withStage(int stageNumber, StageStatus status, String notes, Instant now) {
        List<PipelineStage> updated = new ArrayList<>(pipelineStages.size());
        for (PipelineStage stage : pipelineStages) {
            updated.add(stage.getStageNumber() == stageNumber ? stage.moveTo(status, notes, now) : stage);
        }

        boolean allCompleted = updated.stream().allMatch(PipelineStage::isCompleted);
        int current = updated.stream()
                .filter(stage -> !stage.isCompleted())
                .mapToInt(PipelineStage::getStageNumber)
                .findFirst()
                .orElse(HandoverStageDefinition.STAGE_COUNT);

        return toBuilder()
                .pipelineStages(List.copyOf(updated))
                .currentStage(current)
                .overallProgress(calculateProgress(updated))
                .handoverStatus(allCompleted ? HandoverStatus.COMPLETED : HandoverStatus.IN_PROGRESS)
                .updatedAt(now)
                .build();
    }

    public boolean isCompleted() {
        return handoverStatus == HandoverStatus.COMPLETED;
    }
}
