package com.cognisync.service;

import com.cognisync.config.CognisyncProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeadLetterQueueServiceTest {

    @Mock private KafkaTemplate<String, String> kafkaTemplate;
    @Mock private SendResult<String, String> sendResult;
    @Spy  private ObjectMapper objectMapper = new ObjectMapper();

    private DeadLetterQueueService service;

    @BeforeEach
    void setUp() {
        CognisyncProperties properties = new CognisyncProperties();
        properties.getBroker().setSendTimeoutMs(200);
        service = new DeadLetterQueueService(kafkaTemplate, objectMapper, properties);
    }

    @Test
    @DisplayName("DLQ message should carry the untouched original record and the reason")
    void sendToDlq_shouldWrapOriginal() throws Exception {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(sendResult));

        service.sendToDlq("evt-1-user", "{\"raw\":true}", "ProcessingError", "No entity mapped");

        ArgumentCaptor<String> value = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("cognisync.domain-events.dlq"), eq("evt-1-user"), value.capture());
        JsonNode dlq = objectMapper.readTree(value.getValue());
        assertEquals("evt-1-user", dlq.get("messageId").asText());
        assertEquals("{\"raw\":true}", dlq.get("originalMessage").asText());
        assertEquals("ProcessingError", dlq.get("deadLetterReason").asText());
        assertEquals("No entity mapped", dlq.get("deadLetterErrorDescription").asText());
        assertTrue(dlq.get("timestamp").asLong() > 0);
    }

    @Test
    @DisplayName("Broker failure should surface so the caller can nack")
    void sendToDlq_brokerFailure_shouldThrow() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("broker down")));

        assertThrows(IllegalStateException.class,
                () -> service.sendToDlq("evt-1-user", "{}", "ProcessingError", "boom"));
    }

    @Test
    @DisplayName("Unacknowledged DLQ write should time out as a failure")
    void sendToDlq_timeout_shouldThrow() {
        when(kafkaTemplate.send(anyString(), anyString(), anyString())).thenReturn(new CompletableFuture<>());

        assertThrows(IllegalStateException.class,
                () -> service.sendToDlq("evt-1-user", "{}", "ProcessingError", "boom"));
    }
}
