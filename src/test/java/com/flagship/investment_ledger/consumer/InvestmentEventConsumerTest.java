package com.flagship.investment_ledger.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.investment_ledger.config.JacksonConfig;
import com.flagship.investment_ledger.investment.Investment;
import com.flagship.investment_ledger.investment.event.InvestmentActivatedEvent;
import com.flagship.investment_ledger.outbox.AggregateTypes;
import com.flagship.investment_ledger.withdrawal.WithdrawalRequest;
import com.flagship.investment_ledger.withdrawal.WithdrawalStatus;
import com.flagship.investment_ledger.withdrawal.WithdrawalType;
import com.flagship.investment_ledger.withdrawal.event.WithdrawalStatusChangedEvent;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.support.Acknowledgment;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class InvestmentEventConsumerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-01-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private IdempotentEventProcessor eventProcessor;
    @Mock
    private InvestmentEventHandler eventHandler;
    @Mock
    private Acknowledgment ack;

    private final ObjectMapper objectMapper = new JacksonConfig().objectMapper();
    private InvestmentEventConsumer consumer;

    @BeforeEach
    void setUp() {
        consumer = new InvestmentEventConsumer(eventProcessor, eventHandler, objectMapper);
    }

    private ConsumerRecord<String, String> record(UUID key, Object payload) throws Exception {
        return new ConsumerRecord<>("investment-events", 0, 7L, key.toString(),
            objectMapper.writeValueAsString(payload));
    }

    private void runHandlerWhenProcessed() {
        when(eventProcessor.processEvent(any(), anyString(), anyString(), any(), eq(InvestmentEventConsumer.CONSUMER_GROUP), any()))
            .thenAnswer(call -> {
                Runnable handler = call.getArgument(5);
                handler.run();
                return true;
            });
    }

    @Test
    @DisplayName("InvestmentActivated is routed to the handler and acknowledged")
    void activatedRouted() throws Exception {
        Investment active = Investment.pending(UUID.randomUUID(), UUID.randomUUID(), new BigDecimal("100"), 1, false, null, CLOCK)
            .activate(CLOCK, 30);
        InvestmentActivatedEvent event = InvestmentActivatedEvent.from(active, "INV_x", UUID.randomUUID());
        runHandlerWhenProcessed();

        consumer.consume(record(active.getId(), event), ack);

        ArgumentCaptor<InvestmentActivatedEvent> captor = ArgumentCaptor.forClass(InvestmentActivatedEvent.class);
        verify(eventHandler).onActivated(captor.capture());
        assertEquals(event.getEventId(), captor.getValue().getEventId());
        assertEquals(LocalDate.of(2024, 1, 31), captor.getValue().getEndDate());
        verify(eventProcessor).processEvent(eq(event.getEventId()), eq(InvestmentActivatedEvent.EVENT_TYPE),
            eq(AggregateTypes.INVESTMENT), eq(active.getId()), eq(InvestmentEventConsumer.CONSUMER_GROUP), any());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("WithdrawalStatusChanged is routed with the withdrawal aggregate")
    void withdrawalRouted() throws Exception {
        WithdrawalRequest request = WithdrawalRequest.create(UUID.randomUUID(), WithdrawalType.FULL,
            new BigDecimal("185.00"), List.of(UUID.randomUUID()), CLOCK.instant());
        runHandlerWhenProcessed();

        consumer.consume(record(request.getId(), WithdrawalStatusChangedEvent.from(request)), ack);

        ArgumentCaptor<WithdrawalStatusChangedEvent> captor = ArgumentCaptor.forClass(WithdrawalStatusChangedEvent.class);
        verify(eventHandler).onWithdrawalStatusChanged(captor.capture());
        assertEquals(WithdrawalStatus.PENDING, captor.getValue().getStatus());
        assertEquals(request.getInvestmentIds(), captor.getValue().getInvestmentIds());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Unknown event types are recorded as skipped")
    void unknownSkipped() {
        UUID key = UUID.randomUUID();
        UUID eventId = UUID.randomUUID();
        String json = "{\"eventId\":\"" + eventId + "\",\"eventType\":\"SomethingElse\"}";

        consumer.consume(new ConsumerRecord<>("investment-events", 0, 1L, key.toString(), json), ack);

        verify(eventProcessor).skipEvent(eq(eventId), eq("SomethingElse"), anyString(), eq(key),
            eq(InvestmentEventConsumer.CONSUMER_GROUP), anyString());
        verifyNoInteractions(eventHandler);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Unreadable records are acknowledged and dropped")
    void unreadableDropped() {
        consumer.consume(new ConsumerRecord<>("investment-events", 0, 2L, "not-a-uuid", "{oops"), ack);

        verifyNoInteractions(eventProcessor, eventHandler);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Handler failure leaves the offset unacknowledged for redelivery")
    void failureNotAcknowledged() throws Exception {
        Investment inv = Investment.pending(UUID.randomUUID(), UUID.randomUUID(), new BigDecimal("100"), 1, false, null, CLOCK)
            .activate(CLOCK, 30);
        runHandlerWhenProcessed();
        doThrow(new IllegalStateException("db down")).when(eventHandler).onActivated(any());

        assertThrows(IllegalStateException.class,
            () -> consumer.consume(record(inv.getId(), InvestmentActivatedEvent.from(inv, "INV_y", UUID.randomUUID())), ack));
        verify(ack, never()).acknowledge();
    }
}
