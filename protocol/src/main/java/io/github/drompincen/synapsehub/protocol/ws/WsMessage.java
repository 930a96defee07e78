package io.github.drompincen.synapsehub.protocol.ws;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record WsMessage(
        WsMessageType type,
        JsonNode data,
        String correlationId,
        Instant timestamp
) {
    public static WsMessage of(WsMessageType type, JsonNode data) {
        return new WsMessage(type, data, null, Instant.now());
    }

    public static WsMessage reply(WsMessageType type, JsonNode data, String correlationId) {
        return new WsMessage(type, data, correlationId, Instant.now());
    }

    public static WsMessage error(JsonNode data, String correlationId) {
        return reply(WsMessageType.ERROR, data, correlationId);
    }

    /** Topic of a resource type, optionally narrowed to one instance: {@code tasks} or {@code tasks:T1}. */
    public static String topic(String resourceType, String resourceId) {
        return resourceId == null || resourceId.isBlank() ? resourceType : resourceType + ":" + resourceId;
    }
}
