package com.flagship.property_acquisition.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An acquisition event waiting in (or already shipped from) the outbox table.
 *
 * Rows are appended by {@link OutboxService#saveEvent} and drained by the
 * {@link OutboxPublisher}. The aggregate id is the Kafka record key, so events for
 * one property stay ordered on one partition.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}
