package com.cognisync.service;

import com.cognisync.dto.DomainEventMessage;
import com.cognisync.exception.UnknownMessageTypeException;
import com.cognisync.exception.UnrecoverableApplyException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.kafka.support.Acknowledgment;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for GraphEventListener.
 *
 * Every record must end in exactly one of: acknowledge, or dead-letter then
 * acknowledge. The only nack is a failed DLQ write.
 */
@ExtendWith(MockitoExtension.class)
class GraphEventListenerTest {

    private static final String CREATE_U1 = "{\"messageId\":\"evt-1-user\",\"tenantId\":\"acme\",\"source\":\"jira\","
            + "\"body\":{\"messageType\":\"CREATE_ENTITY\",\"payload\":{\"id\":\"u1\",\"type\":\"Person\",\"name\":\"Bob\"}}}";

    @Mock private GraphApplier applier;
    @Mock private DeduplicationService deduplicationService;
    @Mock private DeadLetterQueueService deadLetterQueueService;
    @Mock private PipelineMetrics metrics;
    @Mock private Acknowledgment ack;
    @Spy  private ObjectMapper objectMapper = new ObjectMapper();

    @InjectMocks
    private GraphEventListener listener;

    @Test
    @DisplayName("Applied message should be acknowledged")
    void appliedMessage_shouldAck() {
                when(applier.apply(any())).thenReturn(GraphApplier.ApplyOutcome.APPLIED);

        listener.onMessage(record(CREATE_U1), ack);

        ArgumentCaptor<DomainEventMessage> captor = ArgumentCaptor.forClass(DomainEventMessage.class);
        verify(applier).apply(captor.capture());
        assertEquals("acme", captor.getValue().getTenantId());
        assertEquals("u1", captor.getValue().getBody().getPayload().get("id"));
        verify(deduplicationService).markProcessed("evt-1-user");
        verify(ack).acknowledge();
        verify(metrics).incrementMessagesApplied();
        verifyNoInteractions(deadLetterQueueService);
    }

    @Test
    @DisplayName("Message already in the ledger should be acknowledged as a duplicate")
    void alreadyAppliedMessage_shouldAck() {
                when(applier.apply(any())).thenReturn(GraphApplier.ApplyOutcome.ALREADY_APPLIED);

        listener.onMessage(record(CREATE_U1), ack);

        verify(ack).acknowledge();
        verify(metrics).incrementMessagesDuplicate();
        verify(metrics, never()).incrementMessagesApplied();
    }

    @Test
    @DisplayName("Redelivery of a processed messageId should be acknowledged without applying")
    void redelivery_shouldAckWithoutApplying() {
        when(deduplicationService.isProcessed("evt-1-user")).thenReturn(true);

        listener.onMessage(record(CREATE_U1), ack);

        verifyNoInteractions(applier);
        verify(ack).acknowledge();
        verify(metrics).incrementMessagesDuplicate();
    }

    @Test
    @DisplayName("Redis outage should fall through to the applier")
    void dedupUnavailable_shouldStillApply() {
        when(deduplicationService.isProcessed("evt-1-user"))
                .thenThrow(new RedisConnectionFailureException("connection refused"));
        when(applier.apply(any())).thenReturn(GraphApplier.ApplyOutcome.APPLIED);

        listener.onMessage(record(CREATE_U1), ack);

        verify(applier).apply(any());
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Apply failure should dead-letter the original record, then acknowledge")
    void applyFailure_shouldDeadLetterAndAck() {
                when(applier.apply(any())).thenThrow(new UnrecoverableApplyException("No entity mapped for acme/jira/u2"));

        listener.onMessage(record(CREATE_U1), ack);

        verify(deadLetterQueueService).sendToDlq("evt-1-user", CREATE_U1,
                GraphEventListener.REASON_PROCESSING, "No entity mapped for acme/jira/u2");
        verify(deduplicationService, never()).markProcessed(anyString());
        verify(ack).acknowledge();
        verify(ack, never()).nack(any(Duration.class));
        verify(metrics).incrementMessagesDeadLettered();
    }

    @Test
    @DisplayName("Unknown messageType should be dead-lettered with its own reason")
    void unknownType_shouldDeadLetterWithReason() {
                when(applier.apply(any())).thenThrow(new UnknownMessageTypeException("DELETE_ENTITY"));

        listener.onMessage(record(CREATE_U1), ack);

        verify(deadLetterQueueService).sendToDlq(eq("evt-1-user"), eq(CREATE_U1),
                eq(GraphEventListener.REASON_UNKNOWN_TYPE), eq("Unknown messageType: DELETE_ENTITY"));
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Unparseable record should be dead-lettered without reaching the applier")
    void unparseableRecord_shouldDeadLetter() {
        listener.onMessage(record("{not json"), ack);

        verify(deadLetterQueueService).sendToDlq(eq("evt-1"), eq("{not json"),
                eq(GraphEventListener.REASON_UNPARSEABLE), anyString());
        verifyNoInteractions(applier, deduplicationService);
        verify(ack).acknowledge();
    }

    @Test
    @DisplayName("Failed DLQ write should nack so the record is redelivered")
    void dlqWriteFailure_shouldNack() {
                when(applier.apply(any())).thenThrow(new UnrecoverableApplyException("boom"));
        doThrow(new IllegalStateException("broker down"))
                .when(deadLetterQueueService).sendToDlq(anyString(), anyString(), anyString(), anyString());

        listener.onMessage(record(CREATE_U1), ack);

        verify(ack).nack(any(Duration.class));
        verify(ack, never()).acknowledge();
        verify(metrics, never()).incrementMessagesDeadLettered();
    }

    @Test
    @DisplayName("Delivery that dies mid-apply should leave no dedup mark, so its redelivery is applied")
    void applyAbortedByError_redeliveryShouldApply() {
        Map<String, String> processed = new HashMap<>();
        when(deduplicationService.isProcessed(anyString()))
                .thenAnswer(inv -> processed.containsKey(inv.<String>getArgument(0)));
        doAnswer(inv -> processed.put(inv.getArgument(0), "1"))
                .when(deduplicationService).markProcessed(anyString());
        when(applier.apply(any()))
                .thenThrow(new StackOverflowError())
                .thenReturn(GraphApplier.ApplyOutcome.APPLIED);

        // First delivery: the Error escapes the handler and nothing is acked
        assertThrows(StackOverflowError.class, () -> listener.onMessage(record(CREATE_U1), ack));
        verify(ack, never()).acknowledge();
        assertTrue(processed.isEmpty());

        // Redelivery after the container recovers
        listener.onMessage(record(CREATE_U1), ack);

        verify(applier, times(2)).apply(any());
        verify(metrics).incrementMessagesApplied();
        verify(metrics, never()).incrementMessagesDuplicate();
        verify(ack).acknowledge();
        assertTrue(processed.containsKey("evt-1-user"));
    }

    @Test
    @DisplayName("Redis failure while marking should not undo an applied message")
    void markFailure_shouldStillAck() {
        when(applier.apply(any())).thenReturn(GraphApplier.ApplyOutcome.APPLIED);
        doThrow(new RedisConnectionFailureException("connection refused"))
                .when(deduplicationService).markProcessed("evt-1-user");

        listener.onMessage(record(CREATE_U1), ack);

        verify(ack).acknowledge();
        verifyNoInteractions(deadLetterQueueService);
    }

    private static ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>("cognisync.domain-events", 0, 42L, "evt-1", value);
    }
}
