package io.github.drompincen.synapsehub.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.synapsehub.protocol.ws.WsMessage;
import io.github.drompincen.synapsehub.protocol.ws.WsMessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.List;
import java.util.Optional;

/**
 * Client-facing protocol: each text frame is {@code {"type": ..., "data": {...}, "correlation_id": ...}}.
 * Replies echo the correlation id of the request they answer.
 */
@Component
public class SynapseHubWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(SynapseHubWebSocketHandler.class);

    static final String CONNECTION_ID_ATTRIBUTE = "synapsehub.connectionId";
    private static final String WS_PATH_SEGMENT = "ws";

    private final ObjectMapper objectMapper;
    private final WebSocketConnectionManager connections;
    private final WebSocketAuthenticator authenticator;

    public SynapseHubWebSocketHandler(ObjectMapper objectMapper,
                                      WebSocketConnectionManager connections,
                                      WebSocketAuthenticator authenticator) {
        this.objectMapper = objectMapper;
        this.connections = connections;
        this.authenticator = authenticator;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String requestedId = null;
        String userId = null;
        URI uri = session.getUri();
        if (uri != null) {
            UriComponents components = UriComponentsBuilder.fromUri(uri).build();
            List<String> segments = components.getPathSegments();
            if (!segments.isEmpty() && !WS_PATH_SEGMENT.equals(segments.get(segments.size() - 1))) {
                requestedId = segments.get(segments.size() - 1);
            }
            userId = components.getQueryParams().getFirst("user_id");
        }
        String connectionId = connections.connect(session, requestedId, userId);
        session.getAttributes().put(CONNECTION_ID_ATTRIBUTE, connectionId);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        connectionId(session).ifPresent(connections::disconnect);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.warn("Transport error on WebSocket {}: {}", connectionId(session).orElse("?"), exception.getMessage());
        connectionId(session).ifPresent(connections::disconnect);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Optional<String> maybeId = connectionId(session);
        if (maybeId.isEmpty()) {
            log.warn("Frame on unregistered WebSocket session {}", session.getId());
            return;
        }
        String connectionId = maybeId.get();
        connections.touch(connectionId);

        JsonNode frame;
        try {
            frame = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            sendError(connectionId, "Invalid JSON format", null);
            return;
        }
        if (frame == null || !frame.isObject()) {
            sendError(connectionId, "Invalid JSON format", null);
            return;
        }

        String correlationId = text(frame, "correlation_id");
        String type = text(frame, "type");
        JsonNode data = frame.path("data");
        try {
            Optional<WsMessageType> known = WsMessageType.find(type);
            if (known.isEmpty()) {
                sendError(connectionId, "Unknown message type: " + type, correlationId);
                return;
            }
            switch (known.get()) {
                case PING -> handlePing(connectionId, correlationId);
                case AUTHENTICATE -> handleAuthenticate(connectionId, data, correlationId);
                case SUBSCRIBE -> handleSubscription(connectionId, data, correlationId, true);
                case UNSUBSCRIBE -> handleSubscription(connectionId, data, correlationId, false);
                case GET_STATUS -> handleStatus(connectionId, correlationId);
                default -> sendError(connectionId, "Unknown message type: " + type, correlationId);
            }
        } catch (Exception e) {
            log.error("Error handling {} frame on WebSocket {}", type, connectionId, e);
            sendError(connectionId, "Internal server error", correlationId);
        }
    }

    private void handlePing(String connectionId, String correlationId) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("connection_count", connections.connectionCount());
        connections.sendPersonal(connectionId, WsMessage.reply(WsMessageType.PONG, data, correlationId));
    }

    private void handleAuthenticate(String connectionId, JsonNode request, String correlationId) {
        Optional<String> userId = authenticator.authenticate(text(request, "token"));
        if (userId.isEmpty()) {
            ObjectNode data = objectMapper.createObjectNode();
            data.put("error", "Invalid authentication token");
            connections.sendPersonal(connectionId, WsMessage.reply(WsMessageType.UNAUTHORIZED, data, correlationId));
            return;
        }
        connections.authenticate(connectionId, userId.get());
        log.info("WebSocket {} authenticated as {}", connectionId, userId.get());
        ObjectNode data = objectMapper.createObjectNode();
        data.put("user_id", userId.get());
        connections.sendPersonal(connectionId, WsMessage.reply(WsMessageType.AUTHENTICATED, data, correlationId));
    }

    private void handleSubscription(String connectionId, JsonNode request, String correlationId, boolean subscribe) {
        String resourceType = text(request, "resource_type");
        if (resourceType == null || resourceType.isBlank()) {
            sendError(connectionId, "resource_type is required", correlationId);
            return;
        }
        String resourceId = text(request, "resource_id");
        String topic = WsMessage.topic(resourceType, resourceId);
        if (subscribe) {
            connections.subscribe(connectionId, topic);
        } else {
            connections.unsubscribe(connectionId, topic);
        }
        ObjectNode data = objectMapper.createObjectNode();
        data.put("topic", topic);
        data.put("resource_type", resourceType);
        data.put("resource_id", resourceId);
        connections.sendPersonal(connectionId, WsMessage.reply(
                subscribe ? WsMessageType.SUBSCRIBED : WsMessageType.UNSUBSCRIBED, data, correlationId));
    }

    private void handleStatus(String connectionId, String correlationId) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("connection_id", connectionId);
        data.put("user_id", connections.userOf(connectionId).orElse(null));
        data.put("authenticated", connections.isAuthenticated(connectionId));
        data.put("active_connections", connections.connectionCount());
        ArrayNode topics = data.putArray("subscribed_topics");
        connections.topicsOf(connectionId).forEach(topics::add);
        connections.sendPersonal(connectionId, WsMessage.reply(WsMessageType.STATUS, data, correlationId));
    }

    private void sendError(String connectionId, String error, String correlationId) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("error", error);
        connections.sendPersonal(connectionId, WsMessage.error(data, correlationId));
    }

    private static Optional<String> connectionId(WebSocketSession session) {
        return Optional.ofNullable((String) session.getAttributes().get(CONNECTION_ID_ATTRIBUTE));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
