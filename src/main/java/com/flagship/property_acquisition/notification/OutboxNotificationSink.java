package com.flagship.property_acquisition.notification;

import com.flagship.property_acquisition.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Writes acquisition events to the transactional outbox, from where the
 * {@link com.flagship.property_acquisition.outbox.OutboxPublisher} ships them to Kafka.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxNotificationSink implements NotificationSink {

    static final String AGGREGATE_TYPE = "Property";

    private final OutboxService outboxService;

    @Override
    public void notify(AcquisitionEvent event) {
        try {
            outboxService.saveEvent(AGGREGATE_TYPE, event.getPropertyId(), event.getEventType().name(), event);
        } catch (RuntimeException e) {
            log.warn("Dropped {} notification for property {}: {}",
                    event.getEventType(), event.getPropertyId(), e.getMessage());
        }
    }
}
