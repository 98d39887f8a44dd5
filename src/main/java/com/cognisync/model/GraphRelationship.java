package com.cognisync.model;

import jakarta.persistence.*;
import lombok.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Directed edge between two graph entities, unique per (source, target, type).
 */
@Entity
@Table(name = "graph_relationships", uniqueConstraints = {
    @UniqueConstraint(name = "graph_relationships_edge_key",
            columnNames = {"source_entity_id", "target_entity_id", "relationship_type"})
})
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class GraphRelationship {

    @Id
    private UUID id;

    @Column(name = "source_entity_id", nullable = false)
    private UUID sourceEntityId;

    @Column(name = "target_entity_id", nullable = false)
    private UUID targetEntityId;

    @Column(name = "relationship_type", nullable = false)
    private String relationshipType;

    @Column(name = "created_at", nullable = false, updatable = false)
    @Builder.Default
    private Instant createdAt = Instant.now();
}
