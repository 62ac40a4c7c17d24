package com.flagship.property_acquisition.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.property_acquisition.exception.InternalFailureException;
import com.flagship.property_acquisition.notification.AcquisitionEvent;
import com.flagship.property_acquisition.notification.AcquisitionEventType;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.UUID;

/**
 * Feeds acquisition events from Kafka into the admin notification feed.
 *
 * Offsets are acknowledged manually after the event was applied or recognised as a
 * replay; a failing handler leaves the offset uncommitted so the event is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class AcquisitionEventConsumer {

    static final String CONSUMER_GROUP = "admin-notification-feed";
    private static final String AGGREGATE_TYPE = "Property";

    private final IdempotentEventProcessor eventProcessor;
    private final AdminNotificationHandler notificationHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.acquisition-events:acquisition-events}",
        groupId = "${spring.kafka.consumer.group-id:property-acquisition-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record.value());
        if (envelope == null) {
            log.warn("Could not parse event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        try {
            boolean processed = route(envelope, record.value());
            ack.acknowledge();
            if (processed) {
                log.info("Processed event: type={}, eventId={}, propertyId={}",
                        envelope.eventType(), envelope.eventId(), envelope.propertyId());
            }
        } catch (RuntimeException e) {
            log.error("Error processing message at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        }
    }

    private boolean route(EventEnvelope envelope, String rawPayload) {
        if (!isKnownType(envelope.eventType())) {
            eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(), AGGREGATE_TYPE,
                    envelope.propertyId(), CONSUMER_GROUP, "Unknown event type");
            return false;
        }
        return eventProcessor.processEvent(
            envelope.eventId(), envelope.eventType(),
            AGGREGATE_TYPE, envelope.propertyId(),
            CONSUMER_GROUP,
            () -> notificationHandler.onAcquisitionEvent(deserialize(rawPayload))
        );
    }

    private static boolean isKnownType(String eventType) {
        return Arrays.stream(AcquisitionEventType.values()).anyMatch(type -> type.name().equals(eventType));
    }

    private EventEnvelope parseEnvelope(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.hasNonNull("eventId") || !node.hasNonNull("propertyId")) {
                return null;
            }
            return new EventEnvelope(
                UUID.fromString(node.get("eventId").asText()),
                UUID.fromString(node.get("propertyId").asText()),
                node.hasNonNull("eventType") ? node.get("eventType").asText() : "Unknown");
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private AcquisitionEvent deserialize(String json) {
        try {
            return objectMapper.readValue(json, AcquisitionEvent.class);
        } catch (JsonProcessingException e) {
            throw new InternalFailureException("Failed to deserialize acquisition event", e);
        }
    }

    private record EventEnvelope(UUID eventId, UUID propertyId, String eventType) {}
}
