package com.flagship.investment_ledger.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Runs an event handler at most once per event and consumer group.
 *
 * The handler and the processed_events row commit together. If the handler
 * throws, nothing is recorded and the redelivered event runs the handler again.
 *
 * <pre>
 * processor.processEvent(eventId, eventType, aggregateType, aggregateId, group,
 *     () -> updateService.record(...));
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event was a duplicate
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType,
                                String aggregateType, UUID aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        // Flushed first: a concurrent delivery of the same event blocks on the key and then fails.
        // A failing handler rolls the record back so the event is retried.
        repository.saveAndFlush(ProcessedEventEntity.fromDomain(
            ProcessedEvent.success(eventId, eventType, aggregateType, aggregateId, consumerGroup)));

        try {
            handler.run();
        } catch (RuntimeException e) {
            log.error("Failed to process event {} ({}) by consumer group {}: {}",
                    eventId, eventType, consumerGroup, e.getMessage(), e);
            throw e;
        }

        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    /**
     * Records an event this consumer does not handle so replays skip it quietly.
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

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    @Transactional(readOnly = true)
    public List<ProcessedEvent> historyFor(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderByProcessedAtAsc(aggregateType, aggregateId)
            .stream()
            .map(ProcessedEventEntity::toDomain)
            .toList();
    }
}
