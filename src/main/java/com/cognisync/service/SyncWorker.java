package com.cognisync.service;

import com.cognisync.config.CognisyncProperties;
import com.cognisync.dto.TransformResult;
import com.cognisync.model.SyncEvent;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Background worker driving the producer side of the pipeline.
 *
 * FLOW (one tick):
 *   reclaim expired leases
 *        ↓
 *   leaseBatch(batchSize) → PROCESSING, owned by this worker
 *        ↓
 *   for each event, sequentially:
 *       renew lease (lost → skip the event)
 *       transform → publish → stateMachine.onSuccess
 *       any exception       → stateMachine.onFailure (RETRYING / DEAD_LETTER)
 *
 * Ticks are single-flight: a tick that finds the previous one still running
 * skips instead of overlapping. One event failing never stops the batch.
 *
 * On shutdown no new tick starts; the running tick finishes its current event
 * and releases the rest of its batch back to PENDING/RETRYING.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SyncWorker {

    private final SyncEventStore eventStore;
    private final DomainEventTransformer transformer;
    private final DomainEventPublisher publisher;
    private final SyncEventStateMachine stateMachine;
    private final CognisyncProperties properties;

    private final ReentrantLock tickLock = new ReentrantLock();
    private volatile boolean stopping;

    @Scheduled(fixedRateString = "${cognisync.worker.interval-ms:10000}",
               initialDelayString = "${cognisync.worker.interval-ms:10000}")
    public void tick() {
        if (stopping) {
            return;
        }
        if (!tickLock.tryLock()) {
            log.debug("Previous tick still running, skipping this one");
            return;
        }
        try {
            runCycle();
        } catch (Exception e) {
            // Store unavailable; the next tick tries again
            log.error("Worker tick failed: {}", e.getMessage(), e);
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * Runs one lease-and-process cycle. Returns the number of events taken.
     */
    int runCycle() {
        int reclaimed = eventStore.reclaimExpiredLeases();
        if (reclaimed > 0) {
            log.warn("Reclaimed {} events from expired leases", reclaimed);
        }

        List<SyncEvent> batch = eventStore.leaseBatch(properties.getWorker().getBatchSize());
        if (batch.isEmpty()) {
            return 0;
        }
        log.info("Worker leased {} events for processing", batch.size());

        for (int i = 0; i < batch.size(); i++) {
            if (stopping) {
                List<SyncEvent> remaining = batch.subList(i, batch.size());
                log.info("Shutdown requested, releasing {} unprocessed events", remaining.size());
                eventStore.release(remaining);
                break;
            }
            SyncEvent event = batch.get(i);
            if (renewSafely(event)) {
                processSafely(event);
            }
        }
        return batch.size();
    }

    private boolean renewSafely(SyncEvent event) {
        try {
            return eventStore.renewLease(event);
        } catch (Exception e) {
            // Ownership unknown; leave the event to lease expiry
            log.error("Could not renew lease for eventId={}: {}", event.getId(), e.getMessage(), e);
            return false;
        }
    }

    private void processSafely(SyncEvent event) {
        try {
            process(event);
        } catch (Exception e) {
            // Outcome could not be recorded; the lease expires and the event is reclaimed
            log.error("Failed to record outcome for eventId={}: {}", event.getId(), e.getMessage(), e);
        }
    }

    void process(SyncEvent event) {
        TransformResult result;
        try {
            result = transformer.transform(event);
            if (!result.isSkipped()) {
                publisher.publish(event, result.getMessages());
            }
        } catch (Exception e) {
            log.warn("Event processing failed: eventId={}, error={}", event.getId(), e.getMessage());
            stateMachine.onFailure(event, e);
            return;
        }
        stateMachine.onSuccess(event, result.getSkipReason());
    }

    @PreDestroy
    public void stop() {
        stopping = true;
        long timeoutMs = properties.getWorker().getShutdownTimeoutMs();
        try {
            if (tickLock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                tickLock.unlock();
                log.info("Sync worker stopped");
            } else {
                log.warn("Sync worker still busy after {}ms; its leases will be reclaimed after expiry", timeoutMs);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for the sync worker to stop");
        }
    }

    boolean isStopping() {
        return stopping;
    }
}
