package com.cognisync.dto;

import com.cognisync.model.ProcessingStatus;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class SyncEventResponse {
    private UUID id;
    private UUID configId;
    private String tenantId;
    private String source;
    private String type;
    private String externalId;
    private ProcessingStatus status;
    private int retryCount;
    private String errorMessage;
    private String skipReason;
    private String dlqError;
    private Instant dlqFailedAt;
    private Integer dlqAttempts;
    private Instant receivedAt;
    private Instant nextAttemptAt;
    private Instant updatedAt;
}
