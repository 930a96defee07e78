package io.github.drompincen.synapsehub.protocol.api;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskTurn {
    USER("user"),
    CURSOR("cursor"),
    GEMINI("gemini");

    private final String value;

    TaskTurn(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }

    @JsonCreator
    public static TaskTurn fromValue(String value) {
        for (TaskTurn t : values()) {
            if (t.value.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value)) return t;
        }
        throw new IllegalArgumentException("Unknown task turn: " + value);
    }
}
