package com.flagship.property_acquisition.subdivision;

import com.flagship.property_acquisition.exception.ConflictException;
import com.flagship.property_acquisition.exception.InvalidStateException;
import com.flagship.property_acquisition.exception.NotFoundException;
import com.flagship.property_acquisition.exception.UnavailableException;
import com.flagship.property_acquisition.exception.ValidationException;
import com.flagship.property_acquisition.notification.AcquisitionEvent;
import com.flagship.property_acquisition.notification.AcquisitionEventType;
import com.flagship.property_acquisition.notification.NotificationSink;
import com.flagship.property_acquisition.observability.AcquisitionMetrics;
import com.flagship.property_acquisition.observability.CorrelationContext;
import com.flagship.property_acquisition.property.Property;
import com.flagship.property_acquisition.property.PropertyStore;
import com.flagship.property_acquisition.property.SubdivisionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Keeps subdivision and handover mutually exclusive.
 *
 * Allowed edges:
 * <pre>
 * NOT_STARTED          -> SUB_DIVISION_STARTED   (only while no handover is running or done)
 * SUB_DIVISION_STARTED -> SUBDIVIDED             (terminal)
 * SUB_DIVISION_STARTED -> NOT_STARTED            (abandoned)
 * </pre>
 * The write restates both the current subdivision status and the handover statuses
 * that allow it, so a handover starting concurrently makes exactly one of the two fail.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SubdivisionGate {

    private static final Map<SubdivisionStatus, Set<SubdivisionStatus>> ALLOWED = Map.of(
        SubdivisionStatus.NOT_STARTED, Set.of(SubdivisionStatus.SUB_DIVISION_STARTED),
        SubdivisionStatus.SUB_DIVISION_STARTED, Set.of(SubdivisionStatus.SUBDIVIDED, SubdivisionStatus.NOT_STARTED),
        SubdivisionStatus.SUBDIVIDED, Set.of()
    );

    private final PropertyStore propertyStore;
    private final NotificationSink notificationSink;
    private final AcquisitionMetrics metrics;

    /**
     * @return the property after the change (unchanged if it already had {@code newStatus})
     * @throws UnavailableException for any change on a subdivided property, including SUBDIVIDED again
     */
    public Property setSubdivisionStatus(UUID propertyId, SubdivisionStatus newStatus) {
        if (newStatus == null) {
            throw new ValidationException("status", "Subdivision status is required");
        }
        try (var scope = CorrelationContext.bind(propertyId, null)) {
            Property property = load(propertyId);
            SubdivisionStatus current = property.getSubdivisionStatus();

            if (current == SubdivisionStatus.SUBDIVIDED) {
                throw new UnavailableException("Property has already been subdivided");
            }
            if (current == newStatus) {
                return property;
            }
            if (!ALLOWED.get(current).contains(newStatus)) {
                throw new InvalidStateException("Cannot move subdivision from " + current + " to " + newStatus);
            }

            boolean starting = newStatus == SubdivisionStatus.SUB_DIVISION_STARTED;
            if (starting && property.getHandoverStatus().hasPipeline()) {
                throw new UnavailableException("Property handover is " + property.getHandoverStatus()
                        + ", subdivision cannot start");
            }

            int updated = propertyStore.transitionSubdivisionStatus(propertyId, current, newStatus, starting);
            if (updated == 0) {
                Property reread = load(propertyId);
                if (starting && reread.getHandoverStatus().hasPipeline()) {
                    throw new UnavailableException("A handover started on this property, subdivision cannot start");
                }
                metrics.recordConflict("subdivision");
                throw new ConflictException("Subdivision status was changed by another request, please retry");
            }

            log.info("Subdivision status {} -> {}", current, newStatus);
            notificationSink.notify(AcquisitionEvent.of(AcquisitionEventType.SUBDIVISION_STATUS_CHANGED,
                    propertyId, null, "Subdivision " + current + " -> " + newStatus));
            return load(propertyId);
        }
    }

    private Property load(UUID propertyId) {
        return propertyStore.findById(propertyId)
                .orElseThrow(() -> new NotFoundException("Property not found: " + propertyId));
    }
}
