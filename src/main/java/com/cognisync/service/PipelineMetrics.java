package com.cognisync.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * Fire-and-forget counters for both halves of the pipeline.
 *
 * Producer side:
 *   cognisync.events.received       webhooks accepted and enqueued
 *   cognisync.events.succeeded      events published and COMPLETED
 *   cognisync.events.skipped        events COMPLETED with nothing to publish
 *   cognisync.events.retried        failures moved to RETRYING
 *   cognisync.events.dead_lettered  failures moved to DEAD_LETTER
 *
 * Consumer side:
 *   cognisync.messages.applied        domain events applied to the graph
 *   cognisync.messages.duplicate      redeliveries short-circuited
 *   cognisync.messages.dead_lettered  messages parked on the DLQ topic
 */
@Component
public class PipelineMetrics {

    private final Counter eventsReceived;
    private final Counter eventsSucceeded;
    private final Counter eventsSkipped;
    private final Counter eventsRetried;
    private final Counter eventsDeadLettered;
    private final Counter messagesApplied;
    private final Counter messagesDuplicate;
    private final Counter messagesDeadLettered;

    public PipelineMetrics(MeterRegistry registry) {
        this.eventsReceived = counter(registry, "cognisync.events.received", "Webhooks accepted and enqueued");
        this.eventsSucceeded = counter(registry, "cognisync.events.succeeded", "Events published and completed");
        this.eventsSkipped = counter(registry, "cognisync.events.skipped", "Events completed with nothing to publish");
        this.eventsRetried = counter(registry, "cognisync.events.retried", "Event failures scheduled for retry");
        this.eventsDeadLettered = counter(registry, "cognisync.events.dead_lettered", "Events that exhausted their retries");
        this.messagesApplied = counter(registry, "cognisync.messages.applied", "Domain events applied to the graph");
        this.messagesDuplicate = counter(registry, "cognisync.messages.duplicate", "Redelivered domain events skipped");
        this.messagesDeadLettered = counter(registry, "cognisync.messages.dead_lettered", "Domain events moved to the DLQ topic");
    }

    private static Counter counter(MeterRegistry registry, String name, String description) {
        return Counter.builder(name).description(description).register(registry);
    }

    public void incrementEventsReceived() {
        eventsReceived.increment();
    }

    public void incrementEventsSucceeded() {
        eventsSucceeded.increment();
    }

    public void incrementEventsSkipped() {
        eventsSkipped.increment();
    }

    public void incrementEventsRetried() {
        eventsRetried.increment();
    }

    public void incrementEventsDeadLettered() {
        eventsDeadLettered.increment();
    }

    public void incrementMessagesApplied() {
        messagesApplied.increment();
    }

    public void incrementMessagesDuplicate() {
        messagesDuplicate.increment();
    }

    public void incrementMessagesDeadLettered() {
        messagesDeadLettered.increment();
    }
}
