package com.cognisync.service;

import com.cognisync.config.CognisyncProperties;
import com.cognisync.dto.DomainEventMessage;
import com.cognisync.exception.BrokerPublishException;
import com.cognisync.model.SyncEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Hands domain events to Kafka one at a time, in the order produced.
 *
 * Each send is awaited for at most broker.send-timeout-ms. The first send that
 * fails or times out aborts the rest of the batch and surfaces as a
 * BrokerPublishException, which the worker records as a retryable failure.
 * Messages sent before the failure stay published; the consumer's idempotency
 * ledger absorbs them when the event is retried.
 *
 * All messages of one sync event share the record key (the event id), so they
 * land on the same partition and are consumed in publish order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DomainEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final CognisyncProperties properties;

    public void publish(SyncEvent event, List<DomainEventMessage> messages) {
        String topic = properties.getTopics().getDomainEvents();
        long timeoutMs = properties.getBroker().getSendTimeoutMs();
        String key = event.getId().toString();

        for (DomainEventMessage message : messages) {
            String value = serialize(message);
            try {
                kafkaTemplate.send(topic, key, value).get(timeoutMs, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BrokerPublishException("Interrupted while publishing " + message.getMessageId(), e);
            } catch (TimeoutException e) {
                throw new BrokerPublishException("Timed out after " + timeoutMs + "ms publishing "
                        + message.getMessageId(), e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                throw new BrokerPublishException("Broker rejected " + message.getMessageId() + ": "
                        + cause.getMessage(), cause);
            }
            log.info("Published domain event: messageId={}, type={}, topic={}",
                    message.getMessageId(), message.getBody().getMessageType(), topic);
        }
    }

    private String serialize(DomainEventMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize domain event " + message.getMessageId(), e);
        }
    }
}
