package com.cognisync.dto;

import lombok.Getter;

import java.util.List;

/**
 * Output of DomainEventTransformer: the messages to publish, or the reason
 * nothing is published for this event.
 */
@Getter
public class TransformResult {

    private final List<DomainEventMessage> messages;
    private final String skipReason;

    private TransformResult(List<DomainEventMessage> messages, String skipReason) {
        this.messages = messages;
        this.skipReason = skipReason;
    }

    public static TransformResult publish(List<DomainEventMessage> messages) {
        return new TransformResult(List.copyOf(messages), null);
    }

    public static TransformResult skipped(String reason) {
        return new TransformResult(List.of(), reason);
    }

    public boolean isSkipped() {
        return skipReason != null;
    }
}
