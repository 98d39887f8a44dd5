package com.cognisync.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

/**
 * CREATE_ENTITY payload. id is the upstream key (issue key, account id, page id);
 * metadata is a JSON-encoded string of side attributes.
 */
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CreateEntityPayload {

    private String id;
    private String type;
    private String name;
    private String metadata;
}
