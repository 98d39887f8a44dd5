package com.cognisync.service;

import com.cognisync.config.CognisyncProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dead-letter handler for domain events the graph applier could not apply.
 *
 * The message is parked on the DLQ topic with:
 *   - the original record value, untouched
 *   - a reason (ProcessingError, UnknownMessageType, UnparseableMessage)
 *   - the error description
 *
 * There is no automatic retry from this topic: a parked message needs an
 * operator to fix the data and replay it. The send is awaited so the caller
 * only acknowledges the original delivery once the DLQ copy is safely written.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeadLetterQueueService {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final CognisyncProperties properties;

    public void sendToDlq(String messageId, String rawMessage, String reason, String errorDescription) {
        Map<String, Object> dlqMessage = new LinkedHashMap<>();
        dlqMessage.put("messageId", messageId);
        dlqMessage.put("originalMessage", rawMessage);
        dlqMessage.put("deadLetterReason", reason);
        dlqMessage.put("deadLetterErrorDescription", errorDescription);
        dlqMessage.put("timestamp", System.currentTimeMillis());

        String topic = properties.getTopics().getDlq();
        try {
            String message = objectMapper.writeValueAsString(dlqMessage);
            kafkaTemplate.send(topic, messageId, message)
                    .get(properties.getBroker().getSendTimeoutMs(), TimeUnit.MILLISECONDS);
            log.error("CRITICAL: Message moved to DLQ: messageId={}, reason={}, error={}",
                    messageId, reason, errorDescription);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while dead-lettering " + messageId, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Failed to dead-letter " + messageId + ": " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to build DLQ message for " + messageId, e);
        }
    }
}
