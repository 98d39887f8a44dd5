package com.cognisync.service;

import com.cognisync.model.GraphEntity;

import java.util.UUID;

/**
 * Downstream graph the applier writes into. Calls join the caller's transaction.
 */
public interface GraphStore {

    GraphEntity createEntity(UUID id, String type, String name, String metadata);

    /**
     * Creates the edge unless the identical (source, target, type) edge exists.
     *
     * @return true if this call created it
     */
    boolean linkIfAbsent(UUID sourceId, UUID targetId, String relationshipType);
}
