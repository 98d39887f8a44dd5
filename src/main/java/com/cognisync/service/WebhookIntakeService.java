package com.cognisync.service;

import com.cognisync.exception.InvalidWebhookPayloadException;
import com.cognisync.exception.SignatureVerificationException;
import com.cognisync.model.SyncConfiguration;
import com.cognisync.model.SyncEvent;
import com.cognisync.repository.SyncConfigurationRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.UUID;

/**
 * Entry point for webhook deliveries.
 *
 *   1. Look up the enabled configuration for configId (404 otherwise)
 *   2. Verify the HMAC signature over the raw body (401 otherwise)
 *   3. Parse the body; it must be a JSON object (400 otherwise)
 *   4. Enqueue as PENDING and return; processing happens in SyncWorker
 *
 * Nothing is persisted unless all three checks pass.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WebhookIntakeService {

    private final SyncConfigurationRepository configurationRepository;
    private final SignatureVerifier signatureVerifier;
    private final SyncEventStore eventStore;
    private final PipelineMetrics metrics;
    private final ObjectMapper objectMapper;

    public SyncEvent accept(UUID configId, byte[] rawBody, String signature) {
        SyncConfiguration config = configurationRepository.findByIdAndEnabledTrue(configId)
                .orElseThrow(() -> new EntityNotFoundException(
                        "Sync configuration not found or disabled: " + configId));

        if (signature == null || signature.isBlank()) {
            log.warn("Webhook rejected, missing signature: configId={}", configId);
            throw new SignatureVerificationException("Missing webhook signature");
        }
        if (!signatureVerifier.verify(config.getSecret(), rawBody, signature)) {
            log.warn("Webhook rejected, invalid signature: configId={}", configId);
            throw new SignatureVerificationException("Invalid webhook signature");
        }

        JsonNode payload = parse(rawBody);
        SyncEvent event = eventStore.enqueue(config, payload);
        metrics.incrementEventsReceived();
        return event;
    }

    private JsonNode parse(byte[] rawBody) {
        JsonNode payload;
        try {
            payload = objectMapper.readTree(rawBody);
        } catch (IOException e) {
            throw new InvalidWebhookPayloadException("Webhook body is not valid JSON", e);
        }
        if (payload == null || !payload.isObject()) {
            throw new InvalidWebhookPayloadException("Webhook body must be a JSON object", null);
        }
        return payload;
    }
}
