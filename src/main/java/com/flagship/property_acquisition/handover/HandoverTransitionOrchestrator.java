package com.flagship.property_acquisition.handover;

import com.flagship.property_acquisition.client.Client;
import com.flagship.property_acquisition.client.ClientStore;
import com.flagship.property_acquisition.exception.ConflictException;
import com.flagship.property_acquisition.exception.InvalidStateException;
import com.flagship.property_acquisition.exception.NotFoundException;
import com.flagship.property_acquisition.exception.UnavailableException;
import com.flagship.property_acquisition.exception.ValidationException;
import com.flagship.property_acquisition.interest.ClientPropertyInterest;
import com.flagship.property_acquisition.interest.InterestStatus;
import com.flagship.property_acquisition.interest.InterestStore;
import com.flagship.property_acquisition.notification.AcquisitionEvent;
import com.flagship.property_acquisition.notification.AcquisitionEventType;
import com.flagship.property_acquisition.notification.NotificationSink;
import com.flagship.property_acquisition.observability.AcquisitionMetrics;
import com.flagship.property_acquisition.observability.CorrelationContext;
import com.flagship.property_acquisition.property.HandoverStatus;
import com.flagship.property_acquisition.property.Property;
import com.flagship.property_acquisition.property.PropertyStore;
import com.flagship.property_acquisition.saga.Saga;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;

/**
 * Takes a committed or converted property into an active handover pipeline.
 *
 * Saga steps, in write order:
 * <ol>
 *   <li>A: property handover status to IN_PROGRESS (conditional on the prior status and
 *       on no subdivision)</li>
 *   <li>B: insert the pipeline row; failure reverts step A</li>
 *   <li>C: interest to IN_HANDOVER; failure is only logged</li>
 *   <li>D: notification; never fatal</li>
 * </ol>
 *
 * Key principles:
 * - A pipeline exists exactly while the property is IN_PROGRESS or COMPLETED
 * - Starting twice, or concurrently, yields ALREADY_IN_PROGRESS for everyone but the winner
 * - The unique pipeline-per-property constraint settles races that the reads cannot
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HandoverTransitionOrchestrator {

    private static final EnumSet<InterestStatus> HANDOVER_READY = EnumSet.of(InterestStatus.COMMITTED, InterestStatus.CONVERTED);

    private final PropertyStore propertyStore;
    private final HandoverPipelineStore pipelineStore;
    private final InterestStore interestStore;
    private final ClientStore clientStore;
    private final NotificationSink notificationSink;
    private final AcquisitionMetrics metrics;

    /**
     * Starts the handover of a property for the client holding it.
     *
     * @return STARTED, or ALREADY_IN_PROGRESS when a pipeline exists (no write is made)
     * @throws NotFoundException if the property, client or interest does not exist
     * @throws UnavailableException if a subdivision is active or done, or the handover already completed
     * @throws InvalidStateException if the client's interest is not committed or converted
     * @throws ConflictException if another request moved the property mid-way
     */
    public HandoverResult startHandover(UUID propertyId, UUID clientId, TriggerEvent triggerEvent, String notes) {
        if (propertyId == null) {
            throw new ValidationException("propertyId", "Property id is required");
        }
        if (clientId == null) {
            throw new ValidationException("clientId", "Client id is required");
        }
        if (triggerEvent == null) {
            throw new ValidationException("triggerEvent", "Trigger event is required");
        }
        try (var scope = CorrelationContext.bind(propertyId, clientId)) {
            HandoverResult result = metrics.timeHandover(() -> runSaga(propertyId, clientId, triggerEvent, notes));
            metrics.recordHandoverOutcome(result.getOutcome().name());
            return result;
        }
    }

    private HandoverResult runSaga(UUID propertyId, UUID clientId, TriggerEvent triggerEvent, String notes) {
        Property property = propertyStore.findById(propertyId)
                .orElseThrow(() -> new NotFoundException("Property not found: " + propertyId));

        Optional<HandoverPipeline> existing = pipelineStore.findByPropertyId(propertyId);
        if (existing.isPresent()) {
            log.info("Handover already in progress (pipeline {})", existing.get().getId());
            return HandoverResult.alreadyInProgress(propertyId, existing.get().getId());
        }

        checkPropertyEligible(property, clientId);
        Client client = clientStore.findById(clientId)
                .orElseThrow(() -> new NotFoundException("Client not found: " + clientId));
        ClientPropertyInterest interest = interestStore.findByClientAndProperty(clientId, propertyId)
                .orElseThrow(() -> new NotFoundException("Client has no interest in this property"));
        if (!HANDOVER_READY.contains(interest.getStatus())) {
            throw new InvalidStateException(
                "Handover needs a committed or converted interest, current status " + interest.getStatus());
        }

        Saga saga = new Saga("start-handover", metrics);
        HandoverSagaState state = HandoverSagaState.START;
        HandoverStatus prior = property.getHandoverStatus();
        boolean propertyMoved = prior != HandoverStatus.IN_PROGRESS;

        // Step A
        if (propertyMoved) {
            int updated = propertyStore.transitionHandoverStatus(propertyId, prior, HandoverStatus.IN_PROGRESS, true);
            if (updated == 0) {
                return resolveLostPropertyRace(propertyId);
            }
            saga.onRollback("property-in-progress",
                    () -> revertPropertyStatus(propertyId, prior));
        } else {
            log.warn("Property already IN_PROGRESS without a pipeline, resuming at pipeline creation");
        }
        state = HandoverSagaState.PROPERTY_UPDATED;

        // Step B
        HandoverPipeline pipeline = HandoverPipeline.seed(
                propertyId,
                clientId,
                interest.getId(),
                triggerEvent,
                client.getFullName(),
                property.getAskingPrice(),
                interest.getDepositAmount(),
                interest.isAgreementSigned(),
                interest.getPaymentVerifiedAt() != null,
                notes);
        try {
            pipelineStore.insert(pipeline);
        } catch (DuplicateKeyException e) {
            // The winner's pipeline needs the property IN_PROGRESS, so step A is kept
            log.info("Concurrent handover start won the pipeline insert");
            saga.forget();
            UUID winner = pipelineStore.findByPropertyId(propertyId).map(HandoverPipeline::getId).orElse(null);
            return HandoverResult.alreadyInProgress(propertyId, winner);
        } catch (RuntimeException e) {
            log.error("Pipeline insert failed in state {}, compensating", state, e);
            throw saga.compensate(e);
        }
        saga.onRollback("pipeline-created", () -> pipelineStore.delete(pipeline.getId()));

        if (!propertyMoved) {
            // Nobody reverted the property while we were inserting
            int confirmed = propertyStore.transitionHandoverStatus(propertyId,
                    HandoverStatus.IN_PROGRESS, HandoverStatus.IN_PROGRESS, false);
            if (confirmed == 0) {
                saga.rollback();
                metrics.recordConflict("start-handover");
                throw new ConflictException("Property changed while the handover was starting, please retry");
            }
        }
        state = HandoverSagaState.PIPELINE_CREATED;

        // Step C
        try {
            int updated = interestStore.transition(interest.getId(), HANDOVER_READY, InterestStatus.IN_HANDOVER,
                    "Handover started (" + triggerEvent + ")");
            if (updated == 0) {
                log.warn("Interest {} moved on before it could be marked IN_HANDOVER", interest.getId());
            } else {
                state = HandoverSagaState.INTEREST_UPDATED;
            }
        } catch (RuntimeException e) {
            log.warn("Failed to mark interest {} IN_HANDOVER: {}", interest.getId(), e.getMessage());
        }

        // Step D
        notificationSink.notify(AcquisitionEvent.of(AcquisitionEventType.HANDOVER_STARTED, propertyId, clientId,
                "Handover started for " + client.getFullName() + " at stage " + pipeline.getCurrentStage()));

        state = HandoverSagaState.DONE;
        log.info("Handover started: pipeline={}, stage={}, progress={}%, trigger={}, state={}",
                pipeline.getId(), pipeline.getCurrentStage(), pipeline.getOverallProgress(), triggerEvent, state);
        return HandoverResult.started(propertyId, pipeline.getId());
    }

    private void checkPropertyEligible(Property property, UUID clientId) {
        if (property.isSubdivisionActive() || property.isSubdivided()) {
            throw new UnavailableException("Property is being subdivided and cannot be handed over");
        }
        if (property.isCompleted()) {
            throw new UnavailableException("Property handover is already completed");
        }
        if (property.isCommittedToOther(clientId)) {
            throw new UnavailableException("Property is committed to another client");
        }
    }

    /**
     * Step A affected no rows. Decide from a fresh read what the caller should see.
     */
    private HandoverResult resolveLostPropertyRace(UUID propertyId) {
        Optional<HandoverPipeline> pipeline = pipelineStore.findByPropertyId(propertyId);
        if (pipeline.isPresent()) {
            return HandoverResult.alreadyInProgress(propertyId, pipeline.get().getId());
        }
        Property current = propertyStore.findById(propertyId)
                .orElseThrow(() -> new NotFoundException("Property not found: " + propertyId));
        if (current.isSubdivisionActive() || current.isSubdivided()) {
            throw new UnavailableException("Property is being subdivided and cannot be handed over");
        }
        if (current.isCompleted()) {
            throw new UnavailableException("Property handover is already completed");
        }
        metrics.recordConflict("start-handover");
        throw new ConflictException("Property handover is being started by another request, please retry");
    }

    private void revertPropertyStatus(UUID propertyId, HandoverStatus prior) {
        int reverted = propertyStore.transitionHandoverStatus(propertyId, HandoverStatus.IN_PROGRESS, prior, false);
        if (reverted == 0) {
            log.warn("Property was no longer IN_PROGRESS, handover status left as is");
        }
    }
}
