package com.flagship.property_acquisition.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record of an acquisition event a consumer group has already handled, so that a
 * redelivered or replayed event is not applied twice.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED
    }

    public static ProcessedEvent success(UUID eventId, String eventType,
                                         String aggregateType, UUID aggregateId,
                                         String consumerGroup) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            Instant.now(), ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType,
                                         String aggregateType, UUID aggregateId,
                                         String consumerGroup, String reason) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
            Instant.now(), ProcessingResult.SKIPPED, reason);
    }
}
