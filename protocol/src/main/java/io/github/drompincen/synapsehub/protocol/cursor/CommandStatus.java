package io.github.drompincen.synapsehub.protocol.cursor;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CommandStatus {
    QUEUED("queued"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed"),
    TIMEOUT("timeout"),
    CANCELLED("cancelled");

    private final String value;

    CommandStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }

    public boolean isRetryable() {
        return this == FAILED || this == TIMEOUT;
    }

    public boolean isFinished() {
        return switch (this) {
            case COMPLETED, FAILED, TIMEOUT, CANCELLED -> true;
            case QUEUED, PROCESSING -> false;
        };
    }
}
