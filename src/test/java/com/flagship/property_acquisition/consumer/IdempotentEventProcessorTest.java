package com.flagship.property_acquisition.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.property_acquisition.IntegrationTestSupport;
import com.flagship.property_acquisition.notification.AcquisitionEvent;
import com.flagship.property_acquisition.notification.AcquisitionEventType;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.kafka.support.Acknowledgment;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Consumer side of the acquisition event stream.
 *
 * The Kafka listener is disabled in tests, so the feed handler and the consumer are
 * built by hand on top of the real processor and database.
 */
class IdempotentEventProcessorTest extends IntegrationTestSupport {

    private static final String GROUP = "test-group";

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository processedEventRepository;

    @Autowired
    private ObjectMapper objectMapper;

    private AdminNotificationHandler notificationHandler;

    @BeforeEach
    void setUp() {
        notificationHandler = new AdminNotificationHandler(jdbcTemplate);
    }

    @Nested
    @DisplayName("Processor")
    class Processor {

        @Test
        @DisplayName("A handler runs once per event id and consumer group")
        void runsOnce() {
            UUID eventId = UUID.randomUUID();
            AtomicInteger calls = new AtomicInteger();

            assertTrue(eventProcessor.processEvent(eventId, "DEPOSIT_PAID", "Property", UUID.randomUUID(),
                    GROUP, calls::incrementAndGet));
            assertFalse(eventProcessor.processEvent(eventId, "DEPOSIT_PAID", "Property", UUID.randomUUID(),
                    GROUP, calls::incrementAndGet));

            assertEquals(1, calls.get());
            assertTrue(eventProcessor.isAlreadyProcessed(eventId, GROUP));
        }

        @Test
        @DisplayName("A failing handler leaves no record and its writes are rolled back")
        void failureRecordsNothing() {
            UUID eventId = UUID.randomUUID();
            UUID propertyId = UUID.randomUUID();
            AcquisitionEvent event = AcquisitionEvent.builder()
                    .eventId(eventId)
                    .eventType(AcquisitionEventType.HANDOVER_STARTED)
                    .propertyId(propertyId)
                    .build();

            assertThrows(IllegalStateException.class, () ->
                    eventProcessor.processEvent(eventId, "HANDOVER_STARTED", "Property", propertyId, GROUP, () -> {
                        notificationHandler.onAcquisitionEvent(event);
                        throw new IllegalStateException("feed unavailable");
                    }));

            assertFalse(eventProcessor.isAlreadyProcessed(eventId, GROUP));
            assertEquals(0, notificationHandler.countForProperty(propertyId));
        }

        @Test
        @DisplayName("Skipped events are recorded with the reason")
        void skipIsRecorded() {
            UUID eventId = UUID.randomUUID();

            eventProcessor.skipEvent(eventId, "SOMETHING_NEW", "Property", UUID.randomUUID(), GROUP, "Unknown event type");
            eventProcessor.skipEvent(eventId, "SOMETHING_NEW", "Property", UUID.randomUUID(), GROUP, "Unknown event type");

            ProcessedEventEntity entity = processedEventRepository.findById(eventId).orElseThrow();
            assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, entity.getProcessingResult());
            assertEquals("Unknown event type", entity.getErrorMessage());
        }
    }

    @Nested
    @DisplayName("Admin notification feed")
    class Feed {

        private AcquisitionEventConsumer consumer;

        @BeforeEach
        void setUpConsumer() {
            consumer = new AcquisitionEventConsumer(eventProcessor, notificationHandler, objectMapper);
        }

        @Test
        @DisplayName("A redelivered event produces one notification and is acknowledged both times")
        void redeliveryIsIdempotent() throws Exception {
            UUID propertyId = UUID.randomUUID();
            AcquisitionEvent event = AcquisitionEvent.of(
                    AcquisitionEventType.DEPOSIT_PAID, propertyId, UUID.randomUUID(), "Deposit paid");
            String json = objectMapper.writeValueAsString(event);
            Acknowledgment ack = mock(Acknowledgment.class);

            consumer.consume(record(propertyId, json), ack);
            consumer.consume(record(propertyId, json), ack);

            verify(ack, times(2)).acknowledge();
            assertEquals(1, notificationHandler.countForProperty(propertyId));
            assertEquals("HIGH", jdbcTemplate.queryForObject(
                    "SELECT priority FROM admin_notifications WHERE property_id = ?", String.class, propertyId));
        }

        @Test
        @DisplayName("Unknown event types are skipped and unreadable messages are acknowledged")
        void unknownAndMalformed() {
            UUID propertyId = UUID.randomUUID();
            UUID eventId = UUID.randomUUID();
            String unknown = "{\"eventId\":\"" + eventId + "\",\"propertyId\":\"" + propertyId
                    + "\",\"eventType\":\"PROPERTY_DEMOLISHED\"}";
            Acknowledgment ack = mock(Acknowledgment.class);

            consumer.consume(record(propertyId, unknown), ack);
            consumer.consume(record(propertyId, "not json"), ack);

            verify(ack, times(2)).acknowledge();
            assertTrue(eventProcessor.isAlreadyProcessed(eventId, AcquisitionEventConsumer.CONSUMER_GROUP));
            assertEquals(0, notificationHandler.countForProperty(propertyId));
        }

        private ConsumerRecord<String, String> record(UUID propertyId, String value) {
            return new ConsumerRecord<>("acquisition-events", 0, 0L, propertyId.toString(), value);
        }
    }
}
