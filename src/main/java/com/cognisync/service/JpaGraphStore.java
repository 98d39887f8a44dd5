package com.cognisync.service;

import com.cognisync.model.GraphEntity;
import com.cognisync.repository.GraphEntityRepository;
import com.cognisync.repository.GraphRelationshipRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * GraphStore over the graph_entities / graph_relationships tables.
 */
@Component
@RequiredArgsConstructor
@Transactional(propagation = Propagation.MANDATORY)
public class JpaGraphStore implements GraphStore {

    private final GraphEntityRepository entityRepository;
    private final GraphRelationshipRepository relationshipRepository;

    @Override
    public GraphEntity createEntity(UUID id, String type, String name, String metadata) {
        return entityRepository.save(GraphEntity.builder()
                .id(id)
                .type(type)
                .name(name)
                .metadata(metadata == null ? "{}" : metadata)
                .build());
    }

    @Override
    public boolean linkIfAbsent(UUID sourceId, UUID targetId, String relationshipType) {
        return relationshipRepository.insertIfAbsent(UUID.randomUUID(), sourceId, targetId, relationshipType) == 1;
    }
}
