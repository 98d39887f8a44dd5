package com.cognisync.controller;

import com.cognisync.dto.SyncEventResponse;
import com.cognisync.model.DeadLetterRecord;
import com.cognisync.model.ProcessingStatus;
import com.cognisync.model.SyncEvent;
import com.cognisync.service.SyncEventStore;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Operator view of the event store.
 *
 * GET  /api/events?status=DEAD_LETTER   events in a status, oldest first
 * GET  /api/events/{id}                 one event with its dead-letter record
 * POST /api/events/{id}/retry           replay a dead-lettered event
 */
@RestController
@RequestMapping("/api/events")
@RequiredArgsConstructor
public class SyncEventController {

    private final SyncEventStore eventStore;

    @GetMapping
    public ResponseEntity<List<SyncEventResponse>> listByStatus(
            @RequestParam(defaultValue = "DEAD_LETTER") ProcessingStatus status,
            @RequestParam(defaultValue = "50") int limit) {
        List<SyncEventResponse> events = eventStore.findByStatus(status, Math.max(1, Math.min(limit, 500)))
                .stream()
                .map(this::toResponse)
                .collect(Collectors.toList());
        return ResponseEntity.ok(events);
    }

    @GetMapping("/{id}")
    public ResponseEntity<SyncEventResponse> getById(@PathVariable UUID id) {
        return ResponseEntity.ok(toResponse(eventStore.findById(id)));
    }

    @PostMapping("/{id}/retry")
    public ResponseEntity<Map<String, Object>> retry(@PathVariable UUID id) {
        SyncEvent event = eventStore.requeueDeadLetter(id);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Event has been re-queued for processing.",
                "data", toResponse(event)));
    }

    // --- Mapping helpers ---

    private SyncEventResponse toResponse(SyncEvent e) {
        DeadLetterRecord dlq = e.getDeadLetter();
        return SyncEventResponse.builder()
                .id(e.getId())
                .configId(e.getConfigId())
                .tenantId(e.getTenantId())
                .source(e.getSource())
                .type(e.getType())
                .externalId(e.getExternalId())
                .status(e.getProcessingStatus())
                .retryCount(e.getRetryCount())
                .errorMessage(e.getErrorMessage())
                .skipReason(e.getSkipReason())
                .dlqError(dlq == null ? null : dlq.getError())
                .dlqFailedAt(dlq == null ? null : dlq.getFailedAt())
                .dlqAttempts(dlq == null ? null : dlq.getAttempts())
                .receivedAt(e.getReceivedAt())
                .nextAttemptAt(e.getNextAttemptAt())
                .updatedAt(e.getUpdatedAt())
                .build();
    }
}
