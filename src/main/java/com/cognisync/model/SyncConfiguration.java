package com.cognisync.model;

import jakarta.persistence.*;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.*;
import java.util.UUID;

/**
 * A tenant's webhook registration for one upstream system.
 *
 * Owned by the configuration API; the pipeline only reads it to
 * verify signatures and to look up the retry policy at failure time.
 * Bean Validation runs on persist, so a negative retry limit or delay is
 * rejected before it reaches the table.
 *
 * Example:
 *   tenantId     = "acme"
 *   source       = "jira"
 *   secret       = "s3cr3t"
 *   retryLimit   = 3
 *   retryDelayMs = 30000
 */
@Entity
@Table(name = "sync_configurations")
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SyncConfiguration {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String source;

    @NotBlank
    @Column(name = "webhook_secret", nullable = false)
    private String secret;

    @Min(0)
    @Column(name = "retry_limit", nullable = false)
    @Builder.Default
    private int retryLimit = 3;

    @Min(0)
    @Column(name = "retry_delay_ms", nullable = false)
    @Builder.Default
    private long retryDelayMs = 30_000;

    @Column(nullable = false)
    @Builder.Default
    private boolean enabled = true;
}
