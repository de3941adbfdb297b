package com.flagship.investment_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Transactional outbox.
 *
 * {@link #saveEvent} joins the caller's transaction, so an event exists if and only if
 * the state change it describes committed. Publishing happens later in
 * {@link OutboxPublisher}; the bookkeeping methods below run in their own transactions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    /**
     * Serializes {@code payload} and stores it in the caller's transaction.
     *
     * @throws org.springframework.transaction.IllegalTransactionStateException without an active transaction
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId,
                                 String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType, serialize(payload));
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
                eventType, aggregateType, aggregateId);
        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishable(int limit) {
        return repository.findPublishableForUpdate(limit, maxRetries).stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
        });
    }

    /**
     * Records a failed publish attempt.
     *
     * @return true if the event has now reached the retry limit
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean markFailed(UUID eventId, String errorMessage) {
        return repository.findById(eventId).map(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Outbox event {} failed to publish (attempt {}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
            return entity.getRetryCount() >= maxRetries;
        }).orElse(false);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    @Transactional(readOnly = true)
    public long countDeadLettered() {
        return repository.countDeadLettered(maxRetries);
    }

    private String serialize(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
