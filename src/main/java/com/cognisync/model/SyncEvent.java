package com.cognisync.model;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;
import java.util.UUID;

/**
 * One received webhook, queued for transformation and publish.
 *
 * Status transitions happen only through SyncEventStore (lease, release,
 * reclaim, replay) and SyncEventStateMachine (outcome of a leased attempt).
 * leaseOwner/leasedAt identify the worker currently holding PROCESSING.
 */
@Entity
@Table(name = "sync_events", indexes = {
    @Index(name = "sync_events_status_received_idx", columnList = "processing_status, received_at"),
    @Index(name = "sync_events_config_idx", columnList = "config_id")
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SyncEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "config_id", nullable = false)
    private UUID configId;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String source;

    @Column(nullable = false)
    private String type;

    @Column(name = "external_id")
    private String externalId;

    /** Raw webhook body as received. */
    @Column(name = "changes", columnDefinition = "TEXT", nullable = false)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(name = "processing_status", nullable = false)
    @Builder.Default
    private ProcessingStatus processingStatus = ProcessingStatus.PENDING;

    @Column(name = "retry_count", nullable = false)
    private int retryCount;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    /** Set when the event completed without publishing anything. */
    @Column(name = "skip_reason")
    private String skipReason;

    @Embedded
    private DeadLetterRecord deadLetter;

    @Column(name = "received_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant receivedAt = Instant.now();

    /** Earliest time a RETRYING event may be leased again. */
    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "lease_owner")
    private String leaseOwner;

    @Column(name = "leased_at")
    private Instant leasedAt;

    @Column(name = "updated_at", nullable = false)
    @Builder.Default
    private Instant updatedAt = Instant.now();

    @Version
    private long version;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
