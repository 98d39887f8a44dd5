package com.cognisync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.*;

/**
 * LINK_ENTITIES payload. Both ids are upstream keys, resolved through the
 * entity mapping ledger on the consumer side.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class LinkEntitiesPayload {

    private String sourceEntityId;
    private String targetEntityId;
    private String relationshipType;
}
