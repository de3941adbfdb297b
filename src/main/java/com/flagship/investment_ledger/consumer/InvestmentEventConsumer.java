package com.flagship.investment_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.investment_ledger.investment.event.InvestmentActivatedEvent;
import com.flagship.investment_ledger.investment.event.InvestmentCancelledEvent;
import com.flagship.investment_ledger.investment.event.InvestmentCompletedEvent;
import com.flagship.investment_ledger.outbox.AggregateTypes;
import com.flagship.investment_ledger.withdrawal.event.WithdrawalStatusChangedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Kafka consumer for investment and withdrawal events.
 *
 * Offsets are acknowledged manually after the handler and its processed_events row
 * have committed. A failure leaves the offset uncommitted so the record is redelivered.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class InvestmentEventConsumer {

    static final String CONSUMER_GROUP = "investment-timeline";

    private final IdempotentEventProcessor eventProcessor;
    private final InvestmentEventHandler eventHandler;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.investments:investment-events}",
        groupId = "${spring.kafka.consumer.group-id:investment-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record);
        if (envelope == null) {
            log.warn("Unreadable event at offset {}, acknowledging to skip", record.offset());
            ack.acknowledge();
            return;
        }

        boolean processed = route(envelope, record.value());
        ack.acknowledge();

        if (processed) {
            log.info("Processed event: type={}, eventId={}, aggregateId={}",
                    envelope.eventType(), envelope.eventId(), envelope.aggregateId());
        }
    }

    boolean route(EventEnvelope envelope, String payload) {
        return switch (envelope.eventType()) {
            case InvestmentActivatedEvent.EVENT_TYPE -> process(envelope, AggregateTypes.INVESTMENT,
                () -> eventHandler.onActivated(deserialize(payload, InvestmentActivatedEvent.class)));
            case InvestmentCompletedEvent.EVENT_TYPE -> process(envelope, AggregateTypes.INVESTMENT,
                () -> eventHandler.onCompleted(deserialize(payload, InvestmentCompletedEvent.class)));
            case InvestmentCancelledEvent.EVENT_TYPE -> process(envelope, AggregateTypes.INVESTMENT,
                () -> eventHandler.onCancelled(deserialize(payload, InvestmentCancelledEvent.class)));
            case WithdrawalStatusChangedEvent.EVENT_TYPE -> process(envelope, AggregateTypes.WITHDRAWAL,
                () -> eventHandler.onWithdrawalStatusChanged(deserialize(payload, WithdrawalStatusChangedEvent.class)));
            default -> {
                eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(), "Unknown",
                    envelope.aggregateId(), CONSUMER_GROUP, "Unknown event type");
                yield false;
            }
        };
    }

    private boolean process(EventEnvelope envelope, String aggregateType, Runnable handler) {
        return eventProcessor.processEvent(envelope.eventId(), envelope.eventType(),
            aggregateType, envelope.aggregateId(), CONSUMER_GROUP, handler);
    }

    /**
     * The aggregate id is the record key; event id and type come from the payload.
     *
     * @return null if the record is not a well-formed event
     */
    EventEnvelope parseEnvelope(ConsumerRecord<String, String> record) {
        try {
            JsonNode node = objectMapper.readTree(record.value());
            if (node == null || !node.hasNonNull("eventId") || !node.hasNonNull("eventType") || record.key() == null) {
                return null;
            }
            return new EventEnvelope(
                UUID.fromString(node.get("eventId").asText()),
                UUID.fromString(record.key()),
                node.get("eventType").asText());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse event envelope at offset {}: {}", record.offset(), e.getMessage());
            return null;
        }
    }

    private <T> T deserialize(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize " + type.getSimpleName() + ": " + e.getMessage(), e);
        }
    }

    record EventEnvelope(UUID eventId, UUID aggregateId, String eventType) {}
}
