package com.flagship.property_acquisition.outbox;

import com.flagship.property_acquisition.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Background publisher that drains the outbox into the acquisition events topic.
 *
 * Key design decisions:
 * - Sends synchronously, one event at a time, so per-property order is kept
 * - Property id is the record key for partition affinity
 * - A failed send bumps the retry count; after {@code max-retries} the event is
 *   dead-lettered and left for manual intervention
 * - Published events are purged after the retention period
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.acquisition-events:acquisition-events}")
    private String acquisitionEventsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Value("${outbox.retention-days:30}")
    private int retentionDays;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishableEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }

        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    @Scheduled(cron = "${outbox.retention-cron:0 30 3 * * *}")
    public void purgePublishedEvents() {
        Instant cutoff = Instant.now().minus(Duration.ofDays(retentionDays));
        int purged = outboxService.purgePublishedBefore(cutoff);
        if (purged > 0) {
            log.info("Purged {} published outbox events older than {}", purged, cutoff);
        }
    }

    private void publishEvent(OutboxEvent event) {
        String key = event.getAggregateId().toString();

        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(acquisitionEventsTopic, key, event.getPayload())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "Interrupted while publishing");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());

            if (event.getRetryCount() + 1 >= maxRetries) {
                log.warn("Event {} reached max retries ({}) and is dead-lettered. eventType={}, propertyId={}",
                        event.getId(), maxRetries, event.getEventType(), event.getAggregateId());
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }

    /**
     * Runs one publishing pass immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
