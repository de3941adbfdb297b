package com.flagship.investment_ledger.outbox;

import com.flagship.investment_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Polls the outbox and publishes events to Kafka.
 *
 * - Events go out in sequence order, keyed by aggregate id so one investment's
 *   events stay on one partition
 * - Each send is awaited before the event is marked published
 * - A failed send increments the retry count; events at the limit are left for
 *   manual intervention and no longer selected
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.investments:investment-events}")
    private String investmentsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        List<OutboxEvent> events;
        try {
            events = outboxService.findPublishable(batchSize);
        } catch (RuntimeException e) {
            log.error("Outbox poll failed", e);
            return;
        }

        if (!events.isEmpty()) {
            log.debug("Publishing {} outbox event(s)", events.size());
        }
        for (OutboxEvent event : events) {
            publish(event);
        }
    }

    private void publish(OutboxEvent event) {
        String key = event.getAggregateId().toString();
        try {
            SendResult<String, String> result = kafkaTemplate
                .send(investmentsTopic, key, event.getPayload())
                .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

            log.debug("Published event: eventId={}, type={}, partition={}, offset={}",
                    event.getId(), event.getEventType(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted");
        } catch (ExecutionException | TimeoutException | RuntimeException e) {
            recordFailure(event, e.getMessage());
        }
    }

    private void recordFailure(OutboxEvent event, String error) {
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        boolean deadLettered = outboxService.markFailed(event.getId(), error);
        if (deadLettered) {
            outboxMetrics.recordEventDeadLettered(event.getEventType());
            log.error("Outbox event {} reached the retry limit and needs manual intervention: type={}, aggregateId={}",
                    event.getId(), event.getEventType(), event.getAggregateId());
        }
    }

    /**
     * Runs one publishing pass immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
