package io.github.drompincen.synapsehub.protocol.ws;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum WsMessageType {
    // Client -> Server
    PING("ping"),
    AUTHENTICATE("authenticate"),
    SUBSCRIBE("subscribe"),
    UNSUBSCRIBE("unsubscribe"),
    GET_STATUS("get_status"),

    // Server -> Client
    CONNECTION_ESTABLISHED("connection_established"),
    PONG("pong"),
    AUTHENTICATED("authenticated"),
    UNAUTHORIZED("unauthorized"),
    SUBSCRIBED("subscribed"),
    UNSUBSCRIBED("unsubscribed"),
    STATUS("status"),
    TASK_UPDATE("task_update"),
    NEW_MESSAGE("new_message"),
    AGENT_STATUS("agent_status"),
    NOTIFICATION("notification"),
    ERROR("error");

    private final String value;

    WsMessageType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }

    public static Optional<WsMessageType> find(String value) {
        if (value == null) return Optional.empty();
        for (WsMessageType t : values()) {
            if (t.value.equals(value)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
