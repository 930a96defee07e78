package io.github.drompincen.synapsehub.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.synapsehub.gateway.config.JacksonConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.net.URI;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class SynapseHubWebSocketHandlerTest {

    @Mock private WebSocketSession wsSession;
    @Mock private WebSocketAuthenticator authenticator;

    private final Map<String, Object> attributes = new HashMap<>();
    private ObjectMapper objectMapper;
    private WebSocketConnectionManager connections;
    private SynapseHubWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        objectMapper = new JacksonConfig().objectMapper();
        connections = new WebSocketConnectionManager(objectMapper, new WebSocketProperties(), Clock.systemUTC());
        handler = new SynapseHubWebSocketHandler(objectMapper, connections, authenticator);
        when(wsSession.isOpen()).thenReturn(true);
        when(wsSession.getAttributes()).thenReturn(attributes);
        when(wsSession.getUri()).thenReturn(URI.create("ws://localhost:8080/ws/conn-1?user_id=alice"));
    }

    private JsonNode lastFrame() throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(wsSession, atLeastOnce()).sendMessage(captor.capture());
        return objectMapper.readTree(captor.getValue().getPayload());
    }

    private JsonNode send(String json) throws Exception {
        handler.handleTextMessage(wsSession, new TextMessage(json));
        return lastFrame();
    }

    @Test
    void connectionIdAndUserComeFromHandshakeUri() throws Exception {
        handler.afterConnectionEstablished(wsSession);

        assertThat(attributes).containsEntry(SynapseHubWebSocketHandler.CONNECTION_ID_ATTRIBUTE, "conn-1");
        assertThat(connections.userOf("conn-1")).contains("alice");
        assertThat(lastFrame().path("type").asText()).isEqualTo("connection_established");
    }

    @Test
    void bareEndpointAllocatesId() {
        when(wsSession.getUri()).thenReturn(URI.create("ws://localhost:8080/ws"));

        handler.afterConnectionEstablished(wsSession);

        String id = (String) attributes.get(SynapseHubWebSocketHandler.CONNECTION_ID_ATTRIBUTE);
        assertThat(id).isNotBlank().isNotEqualTo("ws");
        assertThat(connections.isConnected(id)).isTrue();
    }

    @Test
    void pingRepliesWithPongAndCorrelationId() throws Exception {
        handler.afterConnectionEstablished(wsSession);

        JsonNode reply = send("{\"type\":\"ping\",\"correlation_id\":\"r1\"}");

        assertThat(reply.path("type").asText()).isEqualTo("pong");
        assertThat(reply.path("correlation_id").asText()).isEqualTo("r1");
        assertThat(reply.path("data").path("connection_count").asInt()).isEqualTo(1);
    }

    @Test
    void subscribeBuildsTopicFromResource() throws Exception {
        handler.afterConnectionEstablished(wsSession);

        JsonNode reply = send("{\"type\":\"subscribe\",\"data\":{\"resource_type\":\"tasks\",\"resource_id\":\"T1\"}}");

        assertThat(reply.path("type").asText()).isEqualTo("subscribed");
        assertThat(reply.path("data").path("topic").asText()).isEqualTo("tasks:T1");
        assertThat(connections.subscribersOf("tasks:T1")).containsExactly("conn-1");

        JsonNode undone = send("{\"type\":\"unsubscribe\",\"data\":{\"resource_type\":\"tasks\",\"resource_id\":\"T1\"}}");
        assertThat(undone.path("type").asText()).isEqualTo("unsubscribed");
        assertThat(connections.subscribersOf("tasks:T1")).isEmpty();
    }

    @Test
    void subscribeWithoutResourceTypeIsAnError() throws Exception {
        handler.afterConnectionEstablished(wsSession);

        JsonNode reply = send("{\"type\":\"subscribe\",\"data\":{}}");

        assertThat(reply.path("type").asText()).isEqualTo("error");
        assertThat(reply.path("data").path("error").asText()).isEqualTo("resource_type is required");
    }

    @Test
    void authenticateWithKnownToken() throws Exception {
        when(authenticator.authenticate("secret")).thenReturn(Optional.of("bob"));
        handler.afterConnectionEstablished(wsSession);

        JsonNode reply = send("{\"type\":\"authenticate\",\"data\":{\"token\":\"secret\"}}");

        assertThat(reply.path("type").asText()).isEqualTo("authenticated");
        assertThat(reply.path("data").path("user_id").asText()).isEqualTo("bob");
        assertThat(connections.isAuthenticated("conn-1")).isTrue();
        assertThat(connections.connectionsOfUser("bob")).containsExactly("conn-1");
    }

    @Test
    void authenticateWithUnknownToken() throws Exception {
        when(authenticator.authenticate("nope")).thenReturn(Optional.empty());
        handler.afterConnectionEstablished(wsSession);

        JsonNode reply = send("{\"type\":\"authenticate\",\"data\":{\"token\":\"nope\"}}");

        assertThat(reply.path("type").asText()).isEqualTo("unauthorized");
        assertThat(connections.isAuthenticated("conn-1")).isFalse();
    }

    @Test
    void getStatusReportsConnection() throws Exception {
        handler.afterConnectionEstablished(wsSession);
        connections.subscribe("conn-1", "tasks");

        JsonNode reply = send("{\"type\":\"get_status\"}");

        assertThat(reply.path("type").asText()).isEqualTo("status");
        assertThat(reply.path("data").path("connection_id").asText()).isEqualTo("conn-1");
        assertThat(reply.path("data").path("user_id").asText()).isEqualTo("alice");
        assertThat(reply.path("data").path("active_connections").asInt()).isEqualTo(1);
        assertThat(reply.path("data").path("subscribed_topics").get(0).asText()).isEqualTo("tasks");
    }

    @Test
    void unknownTypeIsAnError() throws Exception {
        handler.afterConnectionEstablished(wsSession);

        JsonNode reply = send("{\"type\":\"dance\",\"correlation_id\":\"r9\"}");

        assertThat(reply.path("type").asText()).isEqualTo("error");
        assertThat(reply.path("data").path("error").asText()).isEqualTo("Unknown message type: dance");
        assertThat(reply.path("correlation_id").asText()).isEqualTo("r9");
    }

    @Test
    void serverOnlyTypeFromClientIsAnError() throws Exception {
        handler.afterConnectionEstablished(wsSession);

        JsonNode reply = send("{\"type\":\"task_update\"}");

        assertThat(reply.path("type").asText()).isEqualTo("error");
    }

    @Test
    void malformedJsonKeepsConnectionOpen() throws Exception {
        handler.afterConnectionEstablished(wsSession);

        JsonNode reply = send("{not json");

        assertThat(reply.path("type").asText()).isEqualTo("error");
        assertThat(reply.path("data").path("error").asText()).isEqualTo("Invalid JSON format");
        assertThat(connections.isConnected("conn-1")).isTrue();
    }

    @Test
    void authenticatorFailureBecomesInternalError() throws Exception {
        when(authenticator.authenticate("boom")).thenThrow(new IllegalStateException("store down"));
        handler.afterConnectionEstablished(wsSession);

        JsonNode reply = send("{\"type\":\"authenticate\",\"data\":{\"token\":\"boom\"},\"correlation_id\":\"r2\"}");

        assertThat(reply.path("type").asText()).isEqualTo("error");
        assertThat(reply.path("data").path("error").asText()).isEqualTo("Internal server error");
        assertThat(reply.path("correlation_id").asText()).isEqualTo("r2");
    }

    @Test
    void closeDisconnects() {
        handler.afterConnectionEstablished(wsSession);
        connections.subscribe("conn-1", "tasks");

        handler.afterConnectionClosed(wsSession, CloseStatus.NORMAL);

        assertThat(connections.isConnected("conn-1")).isFalse();
        assertThat(connections.subscribersOf("tasks")).isEmpty();
    }
}
