package com.flagship.property_acquisition.notification;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.property_acquisition.observability.CorrelationContext;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.UUID;

/**
 * Audit/notification event describing one completed acquisition step.
 * Serialized as the outbox payload and consumed from Kafka by the admin feed.
 */
@Value
@Builder
@Jacksonized
public class AcquisitionEvent {

    @JsonProperty("eventId")
    UUID eventId;

    @JsonProperty("eventType")
    AcquisitionEventType eventType;

    @JsonProperty("propertyId")
    UUID propertyId;

    @JsonProperty("clientId")
    UUID clientId;

    @JsonProperty("message")
    String message;

    @JsonProperty("correlationId")
    String correlationId;

    @JsonProperty("occurredAt")
    Instant occurredAt;

    public static AcquisitionEvent of(AcquisitionEventType type, UUID propertyId, UUID clientId, String message) {
        return AcquisitionEvent.builder()
                .eventId(UUID.randomUUID())
                .eventType(type)
                .propertyId(propertyId)
                .clientId(clientId)
                .message(message)
                .correlationId(CorrelationContext.getCorrelationId())
                .occurredAt(Instant.now())
                .build();
    }
}
