package io.github.drompincen.synapsehub.protocol.cursor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CommandType {
    PROMPT("prompt"),
    FILE_OPERATION("file_operation"),
    SEARCH("search"),
    REFACTOR("refactor"),
    DEBUG("debug"),
    TERMINAL("terminal"),
    SSH_CONTEXT("ssh_context");

    private final String value;

    CommandType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }

    @JsonCreator
    public static CommandType fromValue(String value) {
        for (CommandType t : values()) {
            if (t.value.equalsIgnoreCase(value) || t.name().equalsIgnoreCase(value)) return t;
        }
        throw new IllegalArgumentException("Unknown command type: " + value);
    }
}
