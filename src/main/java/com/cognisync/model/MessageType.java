package com.cognisync.model;

import java.util.Optional;

/**
 * Domain event kinds understood by the graph applier.
 */
public enum MessageType {
    CREATE_ENTITY,
    LINK_ENTITIES;

    public static Optional<MessageType> fromWire(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (MessageType type : values()) {
            if (type.name().equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
