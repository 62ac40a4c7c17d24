package com.flagship.property_acquisition.property;

import com.flagship.property_acquisition.exception.ConflictException;
import com.flagship.property_acquisition.exception.NotFoundException;
import com.flagship.property_acquisition.exception.UnavailableException;
import com.flagship.property_acquisition.observability.AcquisitionMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.UUID;

/**
 * Guards the "one binding commitment per property" and "one reservation per property"
 * invariants.
 *
 * Key principles:
 * - The snapshot read only decides which error to report; the decision itself is
 *   taken by the conditional UPDATE in {@link PropertyStore}
 * - Zero affected rows means another writer won: fail with {@link ConflictException}
 *   and never touch the interest row
 * - Release methods only clear values held by the given client, so they are safe as
 *   saga compensations
 * - No in-memory locks; any number of instances may run side by side
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PropertyLockManager {

    private final PropertyStore propertyStore;
    private final AcquisitionMetrics metrics;

    /**
     * Binds the property to the client.
     *
     * @return {@code true} if this call took the commitment, {@code false} if the client
     *         already held it (idempotent repeat)
     * @throws ConflictException if another client holds the commitment or won the race
     * @throws UnavailableException if the property is subdivided or its handover started
     */
    public boolean commit(UUID propertyId, UUID clientId) {
        Property property = load(propertyId);

        if (property.isCommittedTo(clientId)) {
            log.debug("Property {} already committed to client {}", propertyId, clientId);
            return false;
        }
        if (property.isCommittedToOther(clientId)) {
            metrics.recordConflict("commit");
            throw new ConflictException("This property was just taken by another client");
        }
        if (property.isSubdivided()) {
            throw new UnavailableException("Property has been subdivided");
        }
        if (!property.getHandoverStatus().isAvailableForCommitment()) {
            throw new UnavailableException(
                "Property is not available for commitment (handover " + property.getHandoverStatus() + ")");
        }

        int updated = propertyStore.commit(propertyId, clientId, Instant.now());
        if (updated == 0) {
            metrics.recordConflict("commit");
            log.warn("Lost commitment race on property {} for client {}", propertyId, clientId);
            throw new ConflictException("This property was just taken by another client");
        }

        log.info("Property {} committed to client {}", propertyId, clientId);
        return true;
    }

    /**
     * Compensation for {@link #commit}. Only clears a commitment held by this client.
     */
    public void release(UUID propertyId, UUID clientId) {
        int updated = propertyStore.releaseCommitment(propertyId, clientId);
        if (updated == 0) {
            log.warn("Commitment on property {} was not held by client {}, nothing released", propertyId, clientId);
        } else {
            log.info("Released commitment on property {} for client {}", propertyId, clientId);
        }
    }

    /**
     * Places a reservation for the client.
     *
     * @return {@code true} if this call placed the reservation, {@code false} if the client
     *         already held it
     */
    public boolean reserve(UUID propertyId, UUID clientId) {
        Property property = load(propertyId);

        if (property.isReservedBy(clientId)) {
            return false;
        }
        if (property.isCommittedToOther(clientId)) {
            throw new UnavailableException("Property is committed to another client");
        }
        if (property.isSubdivided() || property.isCompleted()) {
            throw new UnavailableException("Property is no longer available");
        }
        if (!property.getHandoverStatus().isAvailableForCommitment()) {
            throw new UnavailableException("Property handover has already started");
        }

        int updated = propertyStore.reserve(propertyId, clientId);
        if (updated == 0) {
            metrics.recordConflict("reserve");
            throw new ConflictException("Property was just reserved by another client");
        }

        log.info("Property {} reserved by client {}", propertyId, clientId);
        return true;
    }

    /**
     * @return {@code true} if a reservation held by the client was released
     */
    public boolean releaseReservation(UUID propertyId, UUID clientId) {
        boolean released = propertyStore.releaseReservation(propertyId, clientId) > 0;
        if (released) {
            log.info("Released reservation on property {} for client {}", propertyId, clientId);
        }
        return released;
    }

    /**
     * Compensation for {@link #releaseReservation}.
     */
    public void restoreReservation(UUID propertyId, UUID clientId) {
        if (propertyStore.restoreReservation(propertyId, clientId) == 0) {
            log.warn("Could not restore reservation on property {} for client {}: property moved on",
                    propertyId, clientId);
        }
    }

    private Property load(UUID propertyId) {
        return propertyStore.findById(propertyId)
                .orElseThrow(() -> new NotFoundException("Property not found: " + propertyId));
    }
}
