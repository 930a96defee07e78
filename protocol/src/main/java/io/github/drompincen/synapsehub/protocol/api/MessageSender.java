package io.github.drompincen.synapsehub.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MessageSender {
    USER("user"),
    CURSOR("cursor"),
    GEMINI("gemini"),
    SYSTEM("system");

    private final String value;

    MessageSender(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }

    /** Whether this sender may post while the task is on the given turn. The user may interrupt an agent. */
    public boolean canSendDuring(TaskTurn turn) {
        return switch (this) {
            case SYSTEM, USER -> true;
            case CURSOR -> turn == TaskTurn.CURSOR;
            case GEMINI -> turn == TaskTurn.GEMINI;
        };
    }

    public boolean isAgent() {
        return this == CURSOR || this == GEMINI;
    }

    @JsonCreator
    public static MessageSender fromValue(String value) {
        for (MessageSender s : values()) {
            if (s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown message sender: " + value);
    }
}
