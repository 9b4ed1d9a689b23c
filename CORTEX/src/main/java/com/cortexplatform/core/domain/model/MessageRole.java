package com.cortexplatform.core.domain.model;

import java.util.Locale;

/**
 * Author role of a conversation message.
 */
public enum MessageRole {
    USER,
    ASSISTANT,
    SYSTEM,
    TOOL;

    /**
     * Lower-case name used in payloads.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MessageRole fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Message role is required");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown message role: " + value, e);
        }
    }
}
