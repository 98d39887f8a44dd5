package com.cognisync.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.*;

import java.time.Instant;

/**
 * Snapshot written when an event exhausts its retries. Never cleared,
 * so a manually replayed event keeps the record of its last terminal failure.
 */
@Embeddable
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class DeadLetterRecord {

    @Column(name = "dlq_payload", columnDefinition = "TEXT")
    private String payload;

    @Column(name = "dlq_error", columnDefinition = "TEXT")
    private String error;

    @Column(name = "dlq_failed_at")
    private Instant failedAt;

    @Column(name = "dlq_attempts")
    private Integer attempts;
}
