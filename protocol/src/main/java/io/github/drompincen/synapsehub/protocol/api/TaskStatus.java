package io.github.drompincen.synapsehub.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

public enum TaskStatus {
    PENDING("pending"),
    PROCESSING_CURSOR("processing_cursor"),
    AWAITING_USER_GEMINI("awaiting_user_gemini"),
    PROCESSING_GEMINI("processing_gemini"),
    AWAITING_USER_CURSOR("awaiting_user_cursor"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled");

    private final String value;

    TaskStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }

    /** Statuses reachable in one step. {@code FAILED -> PENDING} is only taken by an explicit retry. */
    public Set<TaskStatus> allowedTransitions() {
        return switch (this) {
            case PENDING -> EnumSet.of(PROCESSING_CURSOR, CANCELLED);
            case PROCESSING_CURSOR -> EnumSet.of(AWAITING_USER_GEMINI, COMPLETED, FAILED, CANCELLED);
            case AWAITING_USER_GEMINI -> EnumSet.of(PROCESSING_GEMINI, CANCELLED);
            case PROCESSING_GEMINI -> EnumSet.of(AWAITING_USER_CURSOR, COMPLETED, FAILED, CANCELLED);
            case AWAITING_USER_CURSOR -> EnumSet.of(PROCESSING_CURSOR, CANCELLED);
            case FAILED -> EnumSet.of(PENDING);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(TaskStatus.class);
        };
    }

    public boolean canTransitionTo(TaskStatus next) {
        return allowedTransitions().contains(next);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean isProcessing() {
        return this == PROCESSING_CURSOR || this == PROCESSING_GEMINI;
    }

    @JsonCreator
    public static TaskStatus fromValue(String value) {
        for (TaskStatus s : values()) {
            if (s.value.equalsIgnoreCase(value) || s.name().equalsIgnoreCase(value)) return s;
        }
        throw new IllegalArgumentException("Unknown task status: " + value);
    }
}
