package com.flagship.property_acquisition.consumer;

import com.flagship.property_acquisition.notification.AcquisitionEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Turns acquisition events into rows of the admin notification feed.
 * Already protected by {@link IdempotentEventProcessor}; the unique event id on the
 * feed table is the last line against duplicates.
 */
@Service
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AdminNotificationHandler {

    private final JdbcTemplate jdbcTemplate;

    public void onAcquisitionEvent(AcquisitionEvent event) {
        int inserted = jdbcTemplate.update("""
                INSERT INTO admin_notifications (id, event_id, type, title, message, property_id, client_id, priority)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (event_id) DO NOTHING
                """,
                UUID.randomUUID(),
                event.getEventId(),
                event.getEventType().name(),
                event.getEventType().getTitle(),
                event.getMessage() != null ? event.getMessage() : event.getEventType().getTitle(),
                event.getPropertyId(),
                event.getClientId(),
                event.getEventType().getPriority().name());

        if (inserted == 1) {
            log.info("Admin notification {} for property {} ({})",
                    event.getEventType(), event.getPropertyId(), event.getEventType().getPriority());
        } else {
            log.debug("Admin notification for event {} already present", event.getEventId());
        }
    }

    public long countForProperty(UUID propertyId) {
        Long count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM admin_notifications WHERE property_id = ?", Long.class, propertyId);
        return count != null ? count : 0L;
    }
}
