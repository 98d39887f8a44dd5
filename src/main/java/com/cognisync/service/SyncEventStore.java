package com.cognisync.service;

import com.cognisync.config.CognisyncProperties;
import com.cognisync.exception.InvalidStateTransitionException;
import com.cognisync.model.ProcessingStatus;
import com.cognisync.model.SyncConfiguration;
import com.cognisync.model.SyncEvent;
import com.cognisync.repository.SyncEventRepository;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Durable queue of received webhooks and the lease manager over it.
 *
 * FLOW:
 *   enqueue()            → row inserted as PENDING, retryCount 0
 *   leaseBatch(limit)    → oldest PENDING/RETRYING rows (past their nextAttemptAt)
 *                          are flipped to PROCESSING one by one with a conditional
 *                          UPDATE ... WHERE id = ? AND status = <observed status>
 *   renewLease(event)    → leasedAt restamped just before the event is worked on;
 *                          false once the lease has been reclaimed elsewhere
 *   release(events)      → unprocessed leased rows go back to PENDING/RETRYING
 *   reclaimExpiredLeases → rows stuck in PROCESSING past the lease timeout
 *                          (crashed worker) go back to PENDING/RETRYING
 *
 * Only the rows whose conditional UPDATE affected exactly one row are returned
 * from leaseBatch, so two pollers racing over the same candidates never both
 * win the same event.
 */
@Service
@Slf4j
public class SyncEventStore {

    private static final Set<ProcessingStatus> LEASABLE =
            EnumSet.of(ProcessingStatus.PENDING, ProcessingStatus.RETRYING);
    private static final int RECLAIM_PAGE = 100;

    private final SyncEventRepository repository;
    private final CognisyncProperties properties;
    private final String ownerId;

    public SyncEventStore(SyncEventRepository repository, CognisyncProperties properties) {
        this.repository = repository;
        this.properties = properties;
        this.ownerId = "worker-" + UUID.randomUUID();
    }

    String getOwnerId() {
        return ownerId;
    }

    @Transactional
    public SyncEvent enqueue(SyncConfiguration config, JsonNode payload) {
        SyncEvent event = SyncEvent.builder()
                .configId(config.getId())
                .tenantId(config.getTenantId())
                .source(config.getSource())
                .type(extractType(payload))
                .externalId(extractExternalId(payload))
                .payload(payload.toString())
                .processingStatus(ProcessingStatus.PENDING)
                .retryCount(0)
                .build();

        SyncEvent saved = repository.save(event);
        log.info("Event enqueued: eventId={}, configId={}, type={}, externalId={}",
                saved.getId(), config.getId(), saved.getType(), saved.getExternalId());
        return saved;
    }

    /**
     * Claims up to {@code limit} events for this worker. The returned snapshots
     * already carry status PROCESSING and this worker's lease.
     */
    @Transactional
    public List<SyncEvent> leaseBatch(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        Instant now = Instant.now();
        List<SyncEvent> candidates = repository.findLeaseCandidates(LEASABLE, now, PageRequest.of(0, limit));

        List<SyncEvent> leased = new ArrayList<>(candidates.size());
        for (SyncEvent candidate : candidates) {
            int updated = repository.tryLease(candidate.getId(), candidate.getProcessingStatus(), ownerId, now);
            if (updated == 1) {
                candidate.setProcessingStatus(ProcessingStatus.PROCESSING);
                candidate.setLeaseOwner(ownerId);
                candidate.setLeasedAt(now);
                leased.add(candidate);
            } else {
                log.debug("Lease lost to another worker: eventId={}", candidate.getId());
            }
        }

        if (!leased.isEmpty()) {
            log.info("Leased {} of {} candidate events: owner={}", leased.size(), candidates.size(), ownerId);
        }
        return leased;
    }

    /**
     * Restarts the lease clock of one held event. A batch can outlive the lease
     * timeout, so each event is renewed right before it is processed; the
     * caller must drop the event when this returns false.
     */
    @Transactional
    public boolean renewLease(SyncEvent event) {
        Instant now = Instant.now();
        if (repository.renewLease(event.getId(), ownerId, now) == 1) {
            event.setLeasedAt(now);
            return true;
        }
        log.warn("Lease lost before processing, skipping event: eventId={}, owner={}", event.getId(), ownerId);
        return false;
    }

    /**
     * Hands leased-but-unprocessed events back to the queue, e.g. on shutdown.
     */
    @Transactional
    public int release(List<SyncEvent> events) {
        Instant now = Instant.now();
        int released = 0;
        for (SyncEvent event : events) {
            released += repository.releaseLease(event.getId(), ownerId, requeueStatus(event), now);
        }
        if (released > 0) {
            log.info("Released {} leased events back to the queue: owner={}", released, ownerId);
        }
        return released;
    }

    @Transactional
    public int reclaimExpiredLeases() {
        Instant now = Instant.now();
        Instant cutoff = now.minus(Duration.ofMillis(properties.getWorker().getLeaseTimeoutMs()));

        int reclaimed = 0;
        for (SyncEvent stale : repository.findExpiredLeases(cutoff, PageRequest.of(0, RECLAIM_PAGE))) {
            if (repository.reclaimExpiredLease(stale.getId(), requeueStatus(stale), cutoff, now) == 1) {
                reclaimed++;
                log.warn("Reclaimed expired lease: eventId={}, owner={}, leasedAt={}",
                        stale.getId(), stale.getLeaseOwner(), stale.getLeasedAt());
            }
        }
        return reclaimed;
    }

    /**
     * Manual replay of a dead-lettered event. The dead-letter record is kept.
     */
    @Transactional
    public SyncEvent requeueDeadLetter(UUID id) {
        SyncEvent event = findById(id);
        if (event.getProcessingStatus() != ProcessingStatus.DEAD_LETTER) {
            throw new InvalidStateTransitionException(
                    "Event is not in the dead-letter queue. Current status: " + event.getProcessingStatus());
        }
        if (repository.requeueDeadLetter(id, Instant.now()) != 1) {
            throw new InvalidStateTransitionException("Event changed status while being re-queued: " + id);
        }
        log.info("Dead-lettered event re-queued for processing: eventId={}", id);
        return findById(id);
    }

    @Transactional(readOnly = true)
    public SyncEvent findById(UUID id) {
        return repository.findById(id)
                .orElseThrow(() -> new EntityNotFoundException("Sync event not found: " + id));
    }

    @Transactional(readOnly = true)
    public List<SyncEvent> findByStatus(ProcessingStatus status, int limit) {
        return repository.findByProcessingStatusOrderByReceivedAtAsc(status, PageRequest.of(0, limit));
    }

    private static ProcessingStatus requeueStatus(SyncEvent event) {
        return event.getRetryCount() == 0 ? ProcessingStatus.PENDING : ProcessingStatus.RETRYING;
    }

    // --- Payload helpers ---

    static String extractType(JsonNode payload) {
        String type = payload.path("webhookEvent").asText("");
        if (type.isBlank()) {
            type = payload.path("eventType").asText("");
        }
        return type.isBlank() ? "unknown" : type;
    }

    static String extractExternalId(JsonNode payload) {
        for (JsonNode candidate : List.of(
                payload.path("issue").path("key"),
                payload.path("issue").path("id"),
                payload.path("page").path("id"))) {
            if ((candidate.isTextual() || candidate.isNumber()) && !candidate.asText().isBlank()) {
                return candidate.asText();
            }
        }
        return null;
    }
}
