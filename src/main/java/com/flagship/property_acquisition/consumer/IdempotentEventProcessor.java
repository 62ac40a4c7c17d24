package com.flagship.property_acquisition.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Applies each acquisition event at most once per consumer group.
 *
 * The handler and the processed-event record share one transaction: if the handler
 * fails nothing is recorded and the event is redelivered; if it succeeds a replay of
 * the same event id is skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event had already been processed
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType,
                                String aggregateType, UUID aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        try {
            handler.run();
        } catch (RuntimeException e) {
            log.error("Failed to process event {} by consumer group {}: {}",
                    eventId, consumerGroup, e.getMessage(), e);
            throw e;
        }

        repository.save(ProcessedEventEntity.fromDomain(
            ProcessedEvent.success(eventId, eventType, aggregateType, aggregateId, consumerGroup)));
        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    /**
     * Records an event this consumer has no handler for, so it is not looked at again.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType,
                          String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(
            ProcessedEvent.skipped(eventId, eventType, aggregateType, aggregateId, consumerGroup, reason)));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}
