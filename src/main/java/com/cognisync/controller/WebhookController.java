package com.cognisync.controller;

import com.cognisync.config.CognisyncProperties;
import com.cognisync.model.SyncEvent;
import com.cognisync.service.WebhookIntakeService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/**
 * Webhook intake for upstream issue/collaboration tools.
 *
 * POST /webhooks/{configId}
 * X-Hub-Signature-256: sha256=<hex HMAC-SHA256 of the raw body>
 * {
 *   "webhookEvent": "issue_created",
 *   "issue": {"id": "1", "key": "JIRA-1", "fields": {...}},
 *   "user": {"accountId": "u1", "displayName": "Bob"}
 * }
 *
 * 202 once the event is durably queued. The caller never learns the
 * downstream outcome.
 */
@RestController
@RequestMapping("/webhooks")
@RequiredArgsConstructor
public class WebhookController {

    private final WebhookIntakeService intakeService;
    private final CognisyncProperties properties;

    @PostMapping("/{configId}")
    public ResponseEntity<Map<String, String>> receive(@PathVariable UUID configId,
                                                       @RequestBody byte[] rawBody,
                                                       HttpServletRequest request) {
        SyncEvent event = intakeService.accept(configId, rawBody, signatureHeader(request));
        return ResponseEntity.accepted()
                .body(Map.of("status", "accepted", "eventId", event.getId().toString()));
    }

    private String signatureHeader(HttpServletRequest request) {
        for (String header : properties.getSignature().getHeaders()) {
            String value = request.getHeader(header);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
