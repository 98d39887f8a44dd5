package com.cognisync.service;

import com.cognisync.dto.CreateEntityPayload;
import com.cognisync.dto.DomainEventMessage;
import com.cognisync.dto.LinkEntitiesPayload;
import com.cognisync.exception.UnknownMessageTypeException;
import com.cognisync.exception.UnrecoverableApplyException;
import com.cognisync.model.EntityMapping;
import com.cognisync.model.MessageType;
import com.cognisync.repository.EntityMappingRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Map;
import java.util.UUID;

/**
 * Applies one domain event to the graph, idempotently.
 *
 * CREATE_ENTITY:
 *   1. Ledger lookup by (tenantId, source, payload.id) → found: already applied
 *   2. INSERT mapping ... ON CONFLICT DO NOTHING      → 0 rows: a concurrent
 *      delivery won the race, already applied
 *   3. Create the graph entity in the same transaction as the mapping row
 *
 * LINK_ENTITIES:
 *   Both ends are resolved through the ledger, then the edge is inserted unless
 *   the identical (source, target, relationshipType) edge exists.
 *
 * Anything else, or a payload of the wrong shape, is an UnrecoverableApplyException.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GraphApplier {

    static final String DEFAULT_TENANT = "default";
    static final String DEFAULT_SOURCE = "jira";

    public enum ApplyOutcome {
        APPLIED,
        ALREADY_APPLIED
    }

    private final EntityMappingRepository mappingRepository;
    private final GraphStore graphStore;
    private final ObjectMapper objectMapper;

    @Transactional
    public ApplyOutcome apply(DomainEventMessage message) {
        if (message.getBody() == null) {
            throw new UnrecoverableApplyException("Message has no body");
        }
        String rawType = message.getBody().getMessageType();
        MessageType type = MessageType.fromWire(rawType)
                .orElseThrow(() -> new UnknownMessageTypeException(rawType));

        String tenantId = orDefault(message.getTenantId(), DEFAULT_TENANT);
        String source = orDefault(message.getSource(), DEFAULT_SOURCE);

        return switch (type) {
            case CREATE_ENTITY -> createEntity(tenantId, source,
                    read(message, CreateEntityPayload.class));
            case LINK_ENTITIES -> linkEntities(tenantId, source,
                    read(message, LinkEntitiesPayload.class));
        };
    }

    private ApplyOutcome createEntity(String tenantId, String source, CreateEntityPayload payload) {
        requireText(payload.getId(), "id");
        requireText(payload.getType(), "type");
        requireText(payload.getName(), "name");

        if (mappingRepository.findByTenantIdAndSourceAndExternalId(tenantId, source, payload.getId()).isPresent()) {
            log.info("Entity already mapped, skipping create: tenant={}, source={}, externalId={}",
                    tenantId, source, payload.getId());
            return ApplyOutcome.ALREADY_APPLIED;
        }

        UUID entityId = UUID.randomUUID();
        int inserted = mappingRepository.insertIfAbsent(
                UUID.randomUUID(), tenantId, source, payload.getId(), payload.getType(), entityId);
        if (inserted == 0) {
            log.info("Entity mapped by a concurrent delivery: tenant={}, source={}, externalId={}",
                    tenantId, source, payload.getId());
            return ApplyOutcome.ALREADY_APPLIED;
        }

        graphStore.createEntity(entityId, payload.getType(), payload.getName(), payload.getMetadata());
        log.info("Entity created: externalId={}, entityId={}, type={}",
                payload.getId(), entityId, payload.getType());
        return ApplyOutcome.APPLIED;
    }

    private ApplyOutcome linkEntities(String tenantId, String source, LinkEntitiesPayload payload) {
        requireText(payload.getSourceEntityId(), "sourceEntityId");
        requireText(payload.getTargetEntityId(), "targetEntityId");
        requireText(payload.getRelationshipType(), "relationshipType");

        UUID sourceId = resolve(tenantId, source, payload.getSourceEntityId());
        UUID targetId = resolve(tenantId, source, payload.getTargetEntityId());

        if (!graphStore.linkIfAbsent(sourceId, targetId, payload.getRelationshipType())) {
            log.info("Relationship already exists: {} -[{}]-> {}",
                    payload.getSourceEntityId(), payload.getRelationshipType(), payload.getTargetEntityId());
            return ApplyOutcome.ALREADY_APPLIED;
        }
        log.info("Relationship created: {} -[{}]-> {}",
                payload.getSourceEntityId(), payload.getRelationshipType(), payload.getTargetEntityId());
        return ApplyOutcome.APPLIED;
    }

    private UUID resolve(String tenantId, String source, String externalId) {
        return mappingRepository.findByTenantIdAndSourceAndExternalId(tenantId, source, externalId)
                .map(EntityMapping::getKgEntityId)
                .orElseThrow(() -> new UnrecoverableApplyException(
                        "No entity mapped for " + tenantId + "/" + source + "/" + externalId));
    }

    private <T> T read(DomainEventMessage message, Class<T> payloadType) {
        Map<String, Object> payload = message.getBody().getPayload();
        if (payload == null) {
            throw new UnrecoverableApplyException("Message has no payload: " + message.getMessageId());
        }
        try {
            return objectMapper.convertValue(payload, payloadType);
        } catch (IllegalArgumentException e) {
            throw new UnrecoverableApplyException("Malformed " + payloadType.getSimpleName()
                    + " in " + message.getMessageId(), e);
        }
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new UnrecoverableApplyException("Payload field '" + field + "' is required");
        }
    }

    private static String orDefault(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }
}
