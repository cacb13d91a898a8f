package me.golemcore.reasoning.domain.model;

import java.util.Locale;

/**
 * Role tag of a conversation message.
 */
public enum MessageRole {
    SYSTEM, USER, ASSISTANT, TOOL;

    /**
     * Lowercase role name as used on provider wires.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
