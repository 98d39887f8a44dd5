package com.cognisync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

import java.util.Map;

/**
 * Wire envelope published to the domain-events topic.
 *
 * Example JSON:
 * {
 *   "messageId": "6f1c...-issue",
 *   "tenantId": "acme",
 *   "source": "jira",
 *   "body": {
 *     "messageType": "CREATE_ENTITY",
 *     "payload": {"id": "JIRA-1", "type": "Issue", "name": "Fix login"}
 *   }
 * }
 *
 * - messageId: "{syncEventId}-{role}", stable across republishes of the same event
 * - tenantId/source: key of the idempotency ledger on the consumer side
 * - body.messageType: CREATE_ENTITY or LINK_ENTITIES; kept as a string so that
 *   unknown kinds still deserialize and can be dead-lettered
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class DomainEventMessage {

    private String messageId;
    private String tenantId;
    private String source;
    private Body body;

    @Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Body {
        private String messageType;
        private Map<String, Object> payload;
    }
}
