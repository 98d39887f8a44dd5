package com.cognisync.repository;

import com.cognisync.model.GraphRelationship;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.UUID;

public interface GraphRelationshipRepository extends JpaRepository<GraphRelationship, UUID> {

    // 0 when the edge already exists
    @Modifying(flushAutomatically = true)
    @Query(value = "INSERT INTO graph_relationships " +
                   "(id, source_entity_id, target_entity_id, relationship_type, created_at) " +
                   "VALUES (:id, :sourceId, :targetId, :relationshipType, now()) " +
                   "ON CONFLICT (source_entity_id, target_entity_id, relationship_type) DO NOTHING",
           nativeQuery = true)
    int insertIfAbsent(@Param("id") UUID id,
                       @Param("sourceId") UUID sourceId,
                       @Param("targetId") UUID targetId,
                       @Param("relationshipType") String relationshipType);
}
