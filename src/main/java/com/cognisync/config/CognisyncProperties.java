package com.cognisync.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralizes topic, worker and retry configuration for the sync pipeline.
 *
 * Bound from application.yml under "cognisync" prefix:
 *   cognisync:
 *     topics:
 *       domain-events: cognisync.domain-events
 *       dlq: cognisync.domain-events.dlq
 *     worker:
 *       interval-ms: 10000
 *       batch-size: 10
 *       lease-timeout-ms: 300000
 *     broker:
 *       send-timeout-ms: 10000
 *     retry:
 *       default-limit: 3
 *
 * Validated on startup: a blank topic name or a non-positive batch size
 * stops the context before the webhook endpoint starts taking traffic.
 */
@Component
@ConfigurationProperties(prefix = "cognisync")
@Validated
@Getter
@Setter
public class CognisyncProperties {

    @Valid
    private Topics topics = new Topics();
    @Valid
    private Worker worker = new Worker();
    @Valid
    private Broker broker = new Broker();
    @Valid
    private Retry retry = new Retry();
    private Dedup dedup = new Dedup();
    @Valid
    private Signature signature = new Signature();

    @Getter
    @Setter
    public static class Topics {
        @NotBlank
        private String domainEvents = "cognisync.domain-events";
        @NotBlank
        private String dlq = "cognisync.domain-events.dlq";
    }

    @Getter
    @Setter
    public static class Worker {
        @Min(1)
        private long intervalMs = 10_000;
        @Min(1)
        private int batchSize = 10;
        @Min(1)
        private long leaseTimeoutMs = 300_000;
        @Min(0)
        private long shutdownTimeoutMs = 30_000;
    }

    @Getter
    @Setter
    public static class Broker {
        @Min(1)
        private long sendTimeoutMs = 10_000;
    }

    @Getter
    @Setter
    public static class Retry {
        // Used when the owning configuration has been deleted
        @Min(0)
        private int defaultLimit = 3;
    }

    @Getter
    @Setter
    public static class Dedup {
        private Duration ttl = Duration.ofHours(24);
    }

    @Getter
    @Setter
    public static class Signature {
        @NotEmpty
        private List<String> headers = new ArrayList<>(
                List.of("X-Hub-Signature-256", "X-Atlassian-Webhook-Signature"));
    }
}
