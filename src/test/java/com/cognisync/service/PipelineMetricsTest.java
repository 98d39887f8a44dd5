package com.cognisync.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PipelineMetricsTest {

    @Test
    @DisplayName("Each increment should land on its own counter")
    void increments_shouldBeCountedSeparately() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        PipelineMetrics metrics = new PipelineMetrics(registry);

        metrics.incrementEventsReceived();
        metrics.incrementEventsReceived();
        metrics.incrementEventsRetried();
        metrics.incrementMessagesDuplicate();

        assertEquals(2.0, registry.get("cognisync.events.received").counter().count());
        assertEquals(1.0, registry.get("cognisync.events.retried").counter().count());
        assertEquals(1.0, registry.get("cognisync.messages.duplicate").counter().count());
        assertEquals(0.0, registry.get("cognisync.events.dead_lettered").counter().count());
        assertEquals(0.0, registry.get("cognisync.messages.applied").counter().count());
    }
}
