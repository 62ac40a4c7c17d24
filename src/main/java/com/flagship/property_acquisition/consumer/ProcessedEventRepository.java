package com.flagship.property_acquisition.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, UUID> {

    /**
     * Primary deduplication check.
     */
    boolean existsByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    long countByConsumerGroup(String consumerGroup);
}
