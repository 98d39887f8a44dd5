package com.cognisync.model;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Idempotency ledger: which graph entity an upstream object became.
 *
 * Example:
 *   tenantId    = "acme"
 *   source      = "jira"
 *   externalId  = "JIRA-1"
 *   kgEntityId  = 5b0c...
 *
 * Rows are inserted with ON CONFLICT DO NOTHING against the unique key,
 * so concurrent deliveries of the same CREATE_ENTITY resolve to one row.
 */
@Entity
@Table(name = "entity_mappings", uniqueConstraints = {
    @UniqueConstraint(name = "entity_mappings_tenant_source_external_key",
            columnNames = {"tenant_id", "source", "external_id"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class EntityMapping {

    @Id
    private UUID id;

    @Column(name = "tenant_id", nullable = false)
    private String tenantId;

    @Column(nullable = false)
    private String source;

    @Column(name = "external_id", nullable = false)
    private String externalId;

    @Column(name = "external_type", nullable = false)
    private String externalType;

    @Column(name = "kg_entity_id", nullable = false)
    private UUID kgEntityId;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();
}
