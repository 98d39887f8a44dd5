package com.cognisync.service;

import com.cognisync.dto.CreateEntityPayload;
import com.cognisync.dto.DomainEventMessage;
import com.cognisync.dto.LinkEntitiesPayload;
import com.cognisync.dto.TransformResult;
import com.cognisync.model.MessageType;
import com.cognisync.model.SyncEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps a raw webhook payload into graph domain events.
 *
 * ISSUE payloads ("issue" present):
 *   CREATE_ENTITY  {id: issue.key, type: mapped issue type, name: summary}   role "issue"
 *   actor = user, else issue.fields.reporter:
 *     CREATE_ENTITY {id: accountId, type: Person, name: displayName}        role "user"
 *     LINK_ENTITIES issue → actor, REPORTED_BY                             role "link"
 *   assignee:
 *     CREATE_ENTITY Person                                                  role "assignee"
 *     LINK_ENTITIES issue → assignee, ASSIGNED_TO                          role "assignee-link"
 *
 * PAGE payloads ("page" present):
 *   CREATE_ENTITY  {id: page.id, type: Document, name: title}               role "page"
 *   page.version.by → Person + AUTHORED_BY                                  roles "author", "author-link"
 *
 * messageId = "{syncEventId}-{role}", so a republish of the same event is
 * recognisable downstream.
 *
 * A payload missing its required fields, a deletion, or a payload with no
 * supported object is not an error: the result is skipped with a reason and
 * the event still completes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DomainEventTransformer {

    static final String REPORTED_BY = "REPORTED_BY";
    static final String ASSIGNED_TO = "ASSIGNED_TO";
    static final String AUTHORED_BY = "AUTHORED_BY";

    private static final Map<String, String> ISSUE_TYPES = Map.of(
            "Story", "Requirement",
            "Task", "Task",
            "Bug", "Issue",
            "Epic", "Epic",
            "Sub-task", "Task");

    private final ObjectMapper objectMapper;

    public TransformResult transform(SyncEvent event) {
        JsonNode payload;
        try {
            payload = objectMapper.readTree(event.getPayload());
        } catch (JsonProcessingException e) {
            // Intake only stores JSON objects, so this is a corrupted row
            return TransformResult.skipped("payload is not valid JSON");
        }
        if (payload == null || !payload.isObject()) {
            return TransformResult.skipped("payload is not a JSON object");
        }

        String kind = event.getType() == null ? "" : event.getType();
        if (kind.endsWith("_deleted") || kind.endsWith("_removed")) {
            return TransformResult.skipped("deletion not propagated: " + kind);
        }

        if (payload.hasNonNull("issue")) {
            return transformIssue(event, payload);
        }
        if (payload.hasNonNull("page")) {
            return transformPage(event, payload);
        }
        return TransformResult.skipped("no supported object in payload");
    }

    private TransformResult transformIssue(SyncEvent event, JsonNode payload) {
        JsonNode issue = payload.path("issue");
        JsonNode fields = issue.path("fields");
        String key = text(issue, "key");
        String summary = text(fields, "summary");
        String status = text(fields.path("status"), "name");

        List<String> missing = new ArrayList<>();
        if (key == null) missing.add("issue.key");
        if (summary == null) missing.add("issue.fields.summary");
        if (status == null) missing.add("issue.fields.status.name");
        if (!missing.isEmpty()) {
            return TransformResult.skipped("missing fields: " + String.join(", ", missing));
        }

        ObjectNode metadata = objectMapper.createObjectNode();
        metadata.put("status", status);
        putIfPresent(metadata, "project", text(fields.path("project"), "key"));
        putIfPresent(metadata, "jiraId", text(issue, "id"));
        String issueType = text(fields.path("issuetype"), "name");
        putIfPresent(metadata, "issueType", issueType);
        putIfPresent(metadata, "priority", text(fields.path("priority"), "name"));
        if (fields.path("labels").isArray() && fields.path("labels").size() > 0) {
            metadata.set("labels", fields.path("labels"));
        }

        List<DomainEventMessage> messages = new ArrayList<>();
        messages.add(createEntity(event, "issue", CreateEntityPayload.builder()
                .id(key)
                .type(issueType == null ? "Issue" : ISSUE_TYPES.getOrDefault(issueType, "Task"))
                .name(summary)
                .metadata(metadata.toString())
                .build()));

        JsonNode actor = payload.hasNonNull("user") ? payload.path("user") : fields.path("reporter");
        addPersonLink(event, messages, key, actor, REPORTED_BY, "user", "link");
        addPersonLink(event, messages, key, fields.path("assignee"), ASSIGNED_TO, "assignee", "assignee-link");

        return TransformResult.publish(messages);
    }

    private TransformResult transformPage(SyncEvent event, JsonNode payload) {
        JsonNode page = payload.path("page");
        String id = text(page, "id");
        String title = text(page, "title");

        List<String> missing = new ArrayList<>();
        if (id == null) missing.add("page.id");
        if (title == null) missing.add("page.title");
        if (!missing.isEmpty()) {
            return TransformResult.skipped("missing fields: " + String.join(", ", missing));
        }

        ObjectNode metadata = objectMapper.createObjectNode();
        putIfPresent(metadata, "spaceKey", text(page.path("space"), "key"));
        putIfPresent(metadata, "version", text(page.path("version"), "number"));

        List<DomainEventMessage> messages = new ArrayList<>();
        messages.add(createEntity(event, "page", CreateEntityPayload.builder()
                .id(id)
                .type("Document")
                .name(title)
                .metadata(metadata.toString())
                .build()));
        addPersonLink(event, messages, id, page.path("version").path("by"), AUTHORED_BY, "author", "author-link");

        return TransformResult.publish(messages);
    }

    private void addPersonLink(SyncEvent event, List<DomainEventMessage> messages, String sourceKey,
                               JsonNode person, String relationshipType, String personRole, String linkRole) {
        String accountId = text(person, "accountId");
        if (accountId == null) {
            return;
        }
        String displayName = text(person, "displayName");
        messages.add(createEntity(event, personRole, CreateEntityPayload.builder()
                .id(accountId)
                .type("Person")
                .name(displayName == null ? accountId : displayName)
                .build()));
        messages.add(message(event, linkRole, MessageType.LINK_ENTITIES, LinkEntitiesPayload.builder()
                .sourceEntityId(sourceKey)
                .targetEntityId(accountId)
                .relationshipType(relationshipType)
                .build()));
    }

    private DomainEventMessage createEntity(SyncEvent event, String role, CreateEntityPayload payload) {
        return message(event, role, MessageType.CREATE_ENTITY, payload);
    }

    private DomainEventMessage message(SyncEvent event, String role, MessageType type, Object payload) {
        return DomainEventMessage.builder()
                .messageId(event.getId() + "-" + role)
                .tenantId(event.getTenantId())
                .source(event.getSource())
                .body(DomainEventMessage.Body.builder()
                        .messageType(type.name())
                        .payload(objectMapper.convertValue(payload, new TypeReference<Map<String, Object>>() {}))
                        .build())
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (!(value.isTextual() || value.isNumber())) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    private static void putIfPresent(ObjectNode node, String field, String value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
