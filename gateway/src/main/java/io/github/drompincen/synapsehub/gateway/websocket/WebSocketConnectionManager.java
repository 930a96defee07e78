package io.github.drompincen.synapsehub.gateway.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.synapsehub.protocol.ws.WsMessage;
import io.github.drompincen.synapsehub.protocol.ws.WsMessageType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connection, user and topic tables for WebSocket clients. Index updates happen under one lock so a
 * disconnected id never lingers in a topic or user set; sends are serialized per connection.
 */
@Component
public class WebSocketConnectionManager {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConnectionManager.class);

    static final class Connection {
        final String id;
        final WebSocketSession session;
        final Set<String> topics = ConcurrentHashMap.newKeySet();
        volatile String userId;
        volatile boolean authenticated;
        volatile Instant lastActivity;

        Connection(String id, WebSocketSession session, String userId, Instant now) {
            this.id = id;
            this.session = session;
            this.userId = userId;
            this.lastActivity = now;
        }
    }

    private final Object lock = new Object();
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> userConnections = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> topicSubscribers = new ConcurrentHashMap<>();

    private final ObjectMapper objectMapper;
    private final WebSocketProperties properties;
    private final Clock clock;

    public WebSocketConnectionManager(ObjectMapper objectMapper, WebSocketProperties properties, Clock clock) {
        properties.validate();
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Records the transport under {@code requestedId}, or a fresh id when none is given or the id is
     * taken, then acknowledges with {@code connection_established}.
     */
    public String connect(WebSocketSession session, String requestedId, String userId) {
        String id;
        synchronized (lock) {
            id = requestedId != null && !requestedId.isBlank() && !connections.containsKey(requestedId)
                    ? requestedId : UUID.randomUUID().toString();
            if (requestedId != null && !requestedId.equals(id)) {
                log.warn("Connection id {} already in use, allocated {}", requestedId, id);
            }
            connections.put(id, new Connection(id, session, userId, clock.instant()));
            if (userId != null) userConnections.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(id);
        }
        log.info("WebSocket connection {} established for user {}", id, userId);

        ObjectNode data = objectMapper.createObjectNode();
        data.put("connection_id", id);
        data.put("user_id", userId);
        data.put("authenticated", false);
        data.put("heartbeat_interval_seconds", properties.getHeartbeatInterval().getSeconds());
        sendPersonal(id, WsMessage.of(WsMessageType.CONNECTION_ESTABLISHED, data));
        return id;
    }

    /** Idempotent. Removes the id from its user and from every topic, then closes the transport. */
    public boolean disconnect(String connectionId) {
        Connection removed;
        synchronized (lock) {
            removed = connections.remove(connectionId);
            if (removed == null) return false;
            if (removed.userId != null) detachFromUser(removed.userId, connectionId);
            for (String topic : removed.topics) {
                Set<String> subscribers = topicSubscribers.get(topic);
                if (subscribers != null) {
                    subscribers.remove(connectionId);
                    if (subscribers.isEmpty()) topicSubscribers.remove(topic);
                }
            }
        }
        if (removed.session.isOpen()) {
            try {
                removed.session.close(CloseStatus.GOING_AWAY);
            } catch (IOException e) {
                log.debug("Closing transport of {} failed: {}", connectionId, e.getMessage());
            }
        }
        log.info("WebSocket connection {} disconnected", connectionId);
        return true;
    }

    public boolean subscribe(String connectionId, String topic) {
        synchronized (lock) {
            Connection connection = connections.get(connectionId);
            if (connection == null) return false;
            connection.topics.add(topic);
            return topicSubscribers.computeIfAbsent(topic, k -> ConcurrentHashMap.newKeySet()).add(connectionId);
        }
    }

    public boolean unsubscribe(String connectionId, String topic) {
        synchronized (lock) {
            Connection connection = connections.get(connectionId);
            if (connection == null || !connection.topics.remove(topic)) return false;
            Set<String> subscribers = topicSubscribers.get(topic);
            if (subscribers != null) {
                subscribers.remove(connectionId);
                if (subscribers.isEmpty()) topicSubscribers.remove(topic);
            }
            return true;
        }
    }

    /** Attaches a user identity after the handshake, moving the connection to that user's set. */
    public boolean authenticate(String connectionId, String userId) {
        synchronized (lock) {
            Connection connection = connections.get(connectionId);
            if (connection == null) return false;
            if (connection.userId != null && !connection.userId.equals(userId)) {
                detachFromUser(connection.userId, connectionId);
            }
            connection.userId = userId;
            connection.authenticated = true;
            userConnections.computeIfAbsent(userId, k -> ConcurrentHashMap.newKeySet()).add(connectionId);
            return true;
        }
    }

    public void touch(String connectionId) {
        Connection connection = connections.get(connectionId);
        if (connection != null) connection.lastActivity = clock.instant();
    }

    // ---------------------------------------------------------------------------
    // Delivery
    // ---------------------------------------------------------------------------

    /** A failed send marks the connection dead and disconnects it. */
    public boolean sendPersonal(String connectionId, WsMessage message) {
        Connection connection = connections.get(connectionId);
        if (connection == null) return false;
        return deliver(connection, serialize(message));
    }

    public int sendToUser(String userId, WsMessage message) {
        Set<String> ids = userConnections.get(userId);
        if (ids == null || ids.isEmpty()) return 0;
        return deliverAll(List.copyOf(ids), serialize(message));
    }

    public int broadcastToTopic(String topic, WsMessage message, String excludeConnectionId) {
        return broadcastToTopics(List.of(topic), message, excludeConnectionId);
    }

    /** Each subscriber receives the message once, however many of the topics it follows. */
    public int broadcastToTopics(Collection<String> topics, WsMessage message, String excludeConnectionId) {
        Set<String> targets = new LinkedHashSet<>();
        for (String topic : topics) {
            Set<String> subscribers = topicSubscribers.get(topic);
            if (subscribers != null) targets.addAll(subscribers);
        }
        if (excludeConnectionId != null) targets.remove(excludeConnectionId);
        if (targets.isEmpty()) return 0;
        return deliverAll(targets, serialize(message));
    }

    public int broadcastToAll(WsMessage message, boolean authenticatedOnly) {
        List<String> targets = connections.values().stream()
                .filter(c -> !authenticatedOnly || c.authenticated)
                .map(c -> c.id)
                .toList();
        if (targets.isEmpty()) return 0;
        return deliverAll(targets, serialize(message));
    }

    private int deliverAll(Collection<String> connectionIds, TextMessage payload) {
        int delivered = 0;
        for (String id : connectionIds) {
            Connection connection = connections.get(id);
            if (connection != null && deliver(connection, payload)) delivered++;
        }
        return delivered;
    }

    private boolean deliver(Connection connection, TextMessage payload) {
        try {
            synchronized (connection) {
                if (!connection.session.isOpen()) throw new IOException("transport closed");
                connection.session.sendMessage(payload);
            }
            return true;
        } catch (IOException | IllegalStateException e) {
            log.warn("Send to WebSocket {} failed, disconnecting: {}", connection.id, e.getMessage());
            disconnect(connection.id);
            return false;
        }
    }

    private TextMessage serialize(WsMessage message) {
        try {
            return new TextMessage(objectMapper.writeValueAsString(message));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + message.type().value() + " message", e);
        }
    }

    // ---------------------------------------------------------------------------
    // Sweep
    // ---------------------------------------------------------------------------

    @Scheduled(fixedDelayString = "${synapsehub.websocket.sweep-interval-ms:30000}")
    public void reapStaleConnections() {
        Instant cutoff = clock.instant().minus(properties.effectiveStaleAfter());
        List<String> stale = connections.values().stream()
                .filter(c -> c.lastActivity.isBefore(cutoff))
                .map(c -> c.id)
                .toList();
        stale.forEach(id -> {
            log.warn("Reaping stale WebSocket connection {}", id);
            disconnect(id);
        });
    }

    // ---------------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------------

    public int connectionCount() {
        return connections.size();
    }

    public boolean isConnected(String connectionId) {
        return connections.containsKey(connectionId);
    }

    public Optional<String> userOf(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId)).map(c -> c.userId);
    }

    public boolean isAuthenticated(String connectionId) {
        Connection connection = connections.get(connectionId);
        return connection != null && connection.authenticated;
    }

    public Set<String> topicsOf(String connectionId) {
        Connection connection = connections.get(connectionId);
        return connection == null ? Set.of() : new TreeSet<>(connection.topics);
    }

    public Set<String> subscribersOf(String topic) {
        return Set.copyOf(topicSubscribers.getOrDefault(topic, Set.of()));
    }

    public Set<String> connectionsOfUser(String userId) {
        return Set.copyOf(userConnections.getOrDefault(userId, Set.of()));
    }

    public Duration staleAfter() {
        return properties.effectiveStaleAfter();
    }

    private void detachFromUser(String userId, String connectionId) {
        Set<String> ids = userConnections.get(userId);
        if (ids == null) return;
        ids.remove(connectionId);
        if (ids.isEmpty()) userConnections.remove(userId);
    }
}
