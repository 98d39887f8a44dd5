package com.cognisync.service;

import com.cognisync.dto.DomainEventMessage;
import com.cognisync.dto.TransformResult;
import com.cognisync.model.SyncEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DomainEventTransformerTest {

    private static final String ISSUE_CREATED = "{"
            + "\"webhookEvent\":\"issue_created\","
            + "\"issue\":{\"id\":\"1\",\"key\":\"JIRA-1\",\"fields\":{"
            + "\"summary\":\"S\",\"status\":{\"name\":\"Open\"},\"project\":{\"key\":\"P\"}}},"
            + "\"user\":{\"accountId\":\"u1\",\"displayName\":\"Bob\"}}";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private DomainEventTransformer transformer;
    private UUID eventId;

    @BeforeEach
    void setUp() {
        transformer = new DomainEventTransformer(objectMapper);
        eventId = UUID.randomUUID();
    }

    @Test
    @DisplayName("Issue with a user should produce issue, person and REPORTED_BY link in order")
    void issueCreated_shouldProduceThreeMessages() throws Exception {
        TransformResult result = transformer.transform(event("issue_created", ISSUE_CREATED));

        assertFalse(result.isSkipped());
        List<DomainEventMessage> messages = result.getMessages();
        assertEquals(List.of(eventId + "-issue", eventId + "-user", eventId + "-link"),
                messages.stream().map(DomainEventMessage::getMessageId).collect(Collectors.toList()));
        assertEquals(List.of("CREATE_ENTITY", "CREATE_ENTITY", "LINK_ENTITIES"),
                messages.stream().map(m -> m.getBody().getMessageType()).collect(Collectors.toList()));

        Map<String, Object> issue = messages.get(0).getBody().getPayload();
        assertEquals("JIRA-1", issue.get("id"));
        assertEquals("Issue", issue.get("type"));
        assertEquals("S", issue.get("name"));
        JsonNode metadata = objectMapper.readTree((String) issue.get("metadata"));
        assertEquals("Open", metadata.get("status").asText());
        assertEquals("P", metadata.get("project").asText());
        assertEquals("1", metadata.get("jiraId").asText());

        Map<String, Object> person = messages.get(1).getBody().getPayload();
        assertEquals("u1", person.get("id"));
        assertEquals("Person", person.get("type"));
        assertEquals("Bob", person.get("name"));

        Map<String, Object> link = messages.get(2).getBody().getPayload();
        assertEquals("JIRA-1", link.get("sourceEntityId"));
        assertEquals("u1", link.get("targetEntityId"));
        assertEquals("REPORTED_BY", link.get("relationshipType"));

        messages.forEach(m -> {
            assertEquals("acme", m.getTenantId());
            assertEquals("jira", m.getSource());
        });
    }

    @Test
    @DisplayName("Issue missing its summary should be skipped with the missing field named")
    void issueWithoutSummary_shouldBeSkipped() {
        String payload = "{\"webhookEvent\":\"issue_created\","
                + "\"issue\":{\"key\":\"JIRA-1\",\"fields\":{\"status\":{\"name\":\"Open\"}}}}";

        TransformResult result = transformer.transform(event("issue_created", payload));

        assertTrue(result.isSkipped());
        assertTrue(result.getMessages().isEmpty());
        assertEquals("missing fields: issue.fields.summary", result.getSkipReason());
    }

    @Test
    @DisplayName("Issue without a user should produce only the issue entity")
    void issueWithoutActor_shouldProduceIssueOnly() {
        String payload = "{\"issue\":{\"key\":\"JIRA-2\",\"fields\":{"
                + "\"summary\":\"S\",\"status\":{\"name\":\"Done\"}}}}";

        TransformResult result = transformer.transform(event("issue_updated", payload));

        assertEquals(1, result.getMessages().size());
        assertEquals(eventId + "-issue", result.getMessages().get(0).getMessageId());
    }

    @Test
    @DisplayName("Reporter and assignee should be linked when no user is present")
    void issueWithReporterAndAssignee_shouldLinkBoth() {
        String payload = "{\"issue\":{\"key\":\"JIRA-3\",\"fields\":{"
                + "\"summary\":\"S\",\"status\":{\"name\":\"Open\"},\"issuetype\":{\"name\":\"Story\"},"
                + "\"reporter\":{\"accountId\":\"r1\",\"displayName\":\"Rita\"},"
                + "\"assignee\":{\"accountId\":\"a1\"}}}}";

        TransformResult result = transformer.transform(event("issue_updated", payload));

        List<DomainEventMessage> messages = result.getMessages();
        assertEquals(5, messages.size());
        assertEquals("Requirement", messages.get(0).getBody().getPayload().get("type"));
        assertEquals("r1", messages.get(1).getBody().getPayload().get("id"));
        assertEquals("REPORTED_BY", messages.get(2).getBody().getPayload().get("relationshipType"));
        // No display name: the account id stands in
        assertEquals("a1", messages.get(3).getBody().getPayload().get("name"));
        assertEquals(eventId + "-assignee-link", messages.get(4).getMessageId());
        assertEquals("ASSIGNED_TO", messages.get(4).getBody().getPayload().get("relationshipType"));
    }

    @Test
    @DisplayName("Page should become a Document linked to its author")
    void pageCreated_shouldProduceDocument() {
        String payload = "{\"eventType\":\"page_created\",\"page\":{\"id\":\"42\",\"title\":\"Runbook\","
                + "\"space\":{\"key\":\"OPS\"},\"version\":{\"number\":3,"
                + "\"by\":{\"accountId\":\"u9\",\"displayName\":\"Ann\"}}}}";

        TransformResult result = transformer.transform(event("page_created", payload));

        List<DomainEventMessage> messages = result.getMessages();
        assertEquals(List.of(eventId + "-page", eventId + "-author", eventId + "-author-link"),
                messages.stream().map(DomainEventMessage::getMessageId).collect(Collectors.toList()));
        assertEquals("Document", messages.get(0).getBody().getPayload().get("type"));
        assertEquals("Runbook", messages.get(0).getBody().getPayload().get("name"));
        assertEquals("AUTHORED_BY", messages.get(2).getBody().getPayload().get("relationshipType"));
    }

    @Test
    @DisplayName("Deletions should be skipped, not propagated")
    void deletion_shouldBeSkipped() {
        TransformResult result = transformer.transform(event("issue_deleted", ISSUE_CREATED));

        assertTrue(result.isSkipped());
        assertEquals("deletion not propagated: issue_deleted", result.getSkipReason());
    }

    @Test
    @DisplayName("Payload with no issue or page should be skipped")
    void unsupportedPayload_shouldBeSkipped() {
        TransformResult result = transformer.transform(event("sprint_started", "{\"sprint\":{\"id\":1}}"));

        assertTrue(result.isSkipped());
        assertEquals("no supported object in payload", result.getSkipReason());
    }

    @Test
    @DisplayName("Corrupted payload should be skipped instead of throwing")
    void corruptedPayload_shouldBeSkipped() {
        assertTrue(transformer.transform(event("issue_created", "{not json")).isSkipped());
        assertTrue(transformer.transform(event("issue_created", "[1,2]")).isSkipped());
    }

    private SyncEvent event(String type, String payload) {
        return SyncEvent.builder()
                .id(eventId)
                .tenantId("acme")
                .source("jira")
                .type(type)
                .payload(payload)
                .build();
    }
}
