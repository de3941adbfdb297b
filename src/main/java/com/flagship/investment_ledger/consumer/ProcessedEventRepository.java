package com.flagship.investment_ledger.consumer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface ProcessedEventRepository extends JpaRepository<ProcessedEventEntity, UUID> {

    /**
     * Primary deduplication check.
     */
    boolean existsByEventIdAndConsumerGroup(UUID eventId, String consumerGroup);

    List<ProcessedEventEntity> findByAggregateTypeAndAggregateIdOrderByProcessedAtAsc(
        String aggregateType, UUID aggregateId);

    long countByConsumerGroupAndProcessingResult(String consumerGroup,
                                                 ProcessedEvent.ProcessingResult processingResult);

    @Modifying
    @Query("DELETE FROM ProcessedEventEntity e WHERE e.processedAt < :before")
    int deleteProcessedBefore(@Param("before") Instant before);
}
