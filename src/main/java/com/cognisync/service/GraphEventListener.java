package com.cognisync.service;

import com.cognisync.dto.DomainEventMessage;
import com.cognisync.exception.UnknownMessageTypeException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.dao.DataAccessException;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Kafka consumer that applies domain events to the graph.
 *
 * FLOW:
 *   cognisync.domain-events → GraphEventListener reads the record
 *                                  ↓
 *                            Deserialize JSON → DomainEventMessage
 *                                  ↓
 *                            Redis check on messageId (duplicate → ack)
 *                                  ↓
 *                            GraphApplier.apply()
 *                    ┌─── success ───┴─── exception ───┐
 *                    ↓                                 ↓
 *         mark messageId, ack                DLQ topic, then ack
 *
 * Every delivered record is either acknowledged or dead-lettered exactly once.
 * There is no consumer-side retry: apply failures are data problems that a
 * redelivery will not fix. The only nack is when the DLQ write itself fails,
 * so the record is redelivered instead of being lost.
 *
 * The container runs a bounded pool of consumers (spring.kafka.listener.concurrency)
 * in the "cognisync-graph-applier" group; records of one sync event share a
 * partition and arrive in publish order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GraphEventListener {

    static final String REASON_PROCESSING = "ProcessingError";
    static final String REASON_UNKNOWN_TYPE = "UnknownMessageType";
    static final String REASON_UNPARSEABLE = "UnparseableMessage";
    private static final Duration REDELIVERY_BACKOFF = Duration.ofSeconds(5);

    private final GraphApplier applier;
    private final DeduplicationService deduplicationService;
    private final DeadLetterQueueService deadLetterQueueService;
    private final PipelineMetrics metrics;
    private final ObjectMapper objectMapper;

    @KafkaListener(topics = "${cognisync.topics.domain-events}", groupId = "cognisync-graph-applier")
    public void onMessage(ConsumerRecord<String, String> record, Acknowledgment ack) {
        String raw = record.value();
        DomainEventMessage message;
        try {
            message = objectMapper.readValue(raw, DomainEventMessage.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Unparseable domain event at offset {}: {}", record.offset(), e.getMessage());
            deadLetter(record.key(), raw, REASON_UNPARSEABLE, e.getMessage(), ack);
            return;
        }

        String messageId = message.getMessageId();
        log.info("Received domain event: messageId={}, partition={}, offset={}",
                messageId, record.partition(), record.offset());

        if (alreadyProcessed(messageId)) {
            metrics.incrementMessagesDuplicate();
            ack.acknowledge();
            return;
        }

        try {
            GraphApplier.ApplyOutcome outcome = applier.apply(message);
            markProcessed(messageId);
            if (outcome == GraphApplier.ApplyOutcome.APPLIED) {
                metrics.incrementMessagesApplied();
            } else {
                metrics.incrementMessagesDuplicate();
            }
            ack.acknowledge();
            log.info("Message processed and acknowledged: messageId={}, outcome={}", messageId, outcome);
        } catch (Exception e) {
            log.error("Failed to apply message, moving to DLQ: messageId={}, error={}", messageId, e.getMessage(), e);
            String reason = e instanceof UnknownMessageTypeException ? REASON_UNKNOWN_TYPE : REASON_PROCESSING;
            deadLetter(messageId, raw, reason, e.getMessage(), ack);
        }
    }

    private void deadLetter(String messageId, String raw, String reason, String error, Acknowledgment ack) {
        try {
            deadLetterQueueService.sendToDlq(messageId, raw, reason, error);
        } catch (RuntimeException e) {
            log.error("CRITICAL: DLQ write failed, record will be redelivered: messageId={}, error={}",
                    messageId, e.getMessage(), e);
            ack.nack(REDELIVERY_BACKOFF);
            return;
        }
        metrics.incrementMessagesDeadLettered();
        ack.acknowledge();
    }

    private boolean alreadyProcessed(String messageId) {
        try {
            return deduplicationService.isProcessed(messageId);
        } catch (DataAccessException e) {
            log.warn("Dedup store unavailable, relying on the mapping ledger: messageId={}, error={}",
                    messageId, e.getMessage());
            return false;
        }
    }

    // Runs after apply() has committed
    private void markProcessed(String messageId) {
        try {
            deduplicationService.markProcessed(messageId);
        } catch (DataAccessException e) {
            log.warn("Could not record processed messageId: messageId={}, error={}", messageId, e.getMessage());
        }
    }
}
