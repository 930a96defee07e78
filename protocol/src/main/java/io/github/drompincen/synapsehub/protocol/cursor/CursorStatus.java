package io.github.drompincen.synapsehub.protocol.cursor;

import com.fasterxml.jackson.annotation.JsonValue;

/** Reachability of the external Cursor connector as seen by the hub. */
public enum CursorStatus {
    DISCONNECTED("disconnected"),
    CONNECTING("connecting"),
    CONNECTED("connected"),
    PROCESSING("processing"),
    ERROR("error"),
    TIMEOUT("timeout");

    private final String value;

    CursorStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() { return value; }

    /** Commands are only dispatched while reachable. */
    public boolean isReachable() {
        return switch (this) {
            case CONNECTED, PROCESSING -> true;
            case DISCONNECTED, CONNECTING, ERROR, TIMEOUT -> false;
        };
    }
}
