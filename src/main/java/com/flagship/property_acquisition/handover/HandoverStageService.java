package com.flagship.property_acquisition.handover;

import com.flagship.property_acquisition.exception.ConflictException;
import com.flagship.property_acquisition.exception.InvalidStateException;
import com.flagship.property_acquisition.exception.NotFoundException;
import com.flagship.property_acquisition.exception.ValidationException;
import com.flagship.property_acquisition.notification.AcquisitionEvent;
import com.flagship.property_acquisition.notification.AcquisitionEventType;
import com.flagship.property_acquisition.notification.NotificationSink;
import com.flagship.property_acquisition.observability.AcquisitionMetrics;
import com.flagship.property_acquisition.observability.CorrelationContext;
import com.flagship.property_acquisition.property.HandoverStatus;
import com.flagship.property_acquisition.property.PropertyStore;
import com.flagship.property_acquisition.saga.Saga;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

/**
 * Moves individual stages of a running handover and completes the property once the
 * last stage is done.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HandoverStageService {

    private final HandoverPipelineStore pipelineStore;
    private final PropertyStore propertyStore;
    private final NotificationSink notificationSink;
    private final AcquisitionMetrics metrics;

    public HandoverPipeline getHandover(UUID propertyId) {
        return pipelineStore.findByPropertyId(propertyId)
                .orElseThrow(() -> new NotFoundException("No handover for property " + propertyId));
    }

    /**
     * Sets one stage's status. Current stage and progress are recomputed; when every
     * stage is completed the pipeline and the property both become COMPLETED.
     *
     * @throws ConflictException if the pipeline was updated concurrently (stale version)
     */
    public HandoverPipeline updateHandoverStage(UUID propertyId, int stageNumber, StageStatus status, String notes) {
        if (stageNumber < 1 || stageNumber > HandoverStageDefinition.STAGE_COUNT) {
            throw new ValidationException("stageNumber",
                "Stage must be between 1 and " + HandoverStageDefinition.STAGE_COUNT);
        }
        if (status == null) {
            throw new ValidationException("status", "Stage status is required");
        }

        HandoverPipeline current = getHandover(propertyId);
        try (var scope = CorrelationContext.bind(propertyId, current.getClientId())) {
            if (current.isCompleted()) {
                throw new InvalidStateException("Handover is already completed");
            }

            Instant now = Instant.now();
            HandoverPipeline updated = current.withStage(stageNumber, status, notes, now);
            long version = current.getVersion();

            Saga saga = new Saga("update-handover-stage", metrics);
            saga.run("update-pipeline",
                    () -> {
                        if (pipelineStore.update(updated, version) == 0) {
                            metrics.recordConflict("update-handover-stage");
                            throw new ConflictException("Handover was updated by someone else, please reload");
                        }
                    },
                    () -> pipelineStore.update(current.toBuilder().updatedAt(Instant.now()).build(), version + 1));

            if (updated.isCompleted()) {
                saga.run("complete-property",
                        () -> {
                            int rows = propertyStore.transitionHandoverStatus(propertyId,
                                    HandoverStatus.IN_PROGRESS, HandoverStatus.COMPLETED, false);
                            if (rows == 0) {
                                metrics.recordConflict("complete-handover");
                                throw new ConflictException("Property is no longer IN_PROGRESS");
                            }
                        },
                        null);
                log.info("Handover completed");
                notificationSink.notify(AcquisitionEvent.of(AcquisitionEventType.HANDOVER_COMPLETED,
                        propertyId, current.getClientId(), "Handover completed"));
            } else {
                log.info("Handover stage {} set to {}, now at stage {} ({}%)",
                        stageNumber, status, updated.getCurrentStage(), updated.getOverallProgress());
                notificationSink.notify(AcquisitionEvent.of(AcquisitionEventType.HANDOVER_STAGE_UPDATED,
                        propertyId, current.getClientId(),
                        HandoverStageDefinition.ofNumber(stageNumber).getDisplayName() + " is now " + status));
            }

            return getHandover(propertyId);
        }
    }
}
