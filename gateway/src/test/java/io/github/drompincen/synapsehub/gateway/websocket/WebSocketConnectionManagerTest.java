package io.github.drompincen.synapsehub.gateway.websocket;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.synapsehub.gateway.config.JacksonConfig;
import io.github.drompincen.synapsehub.protocol.ws.WsMessage;
import io.github.drompincen.synapsehub.protocol.ws.WsMessageType;
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

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class WebSocketConnectionManagerTest {

    @Mock private WebSocketSession ws1;
    @Mock private WebSocketSession ws2;
    @Mock private WebSocketSession ws3;
    @Mock private Clock clock;

    private final AtomicReference<Instant> now = new AtomicReference<>(Instant.parse("2025-03-01T10:00:00Z"));
    private ObjectMapper objectMapper;
    private WebSocketConnectionManager manager;

    @BeforeEach
    void setUp() {
        objectMapper = new JacksonConfig().objectMapper();
        when(clock.instant()).thenAnswer(inv -> now.get());
        for (WebSocketSession ws : List.of(ws1, ws2, ws3)) {
            when(ws.isOpen()).thenReturn(true);
        }
        WebSocketProperties properties = new WebSocketProperties();
        properties.setHeartbeatInterval(Duration.ofSeconds(30));
        manager = new WebSocketConnectionManager(objectMapper, properties, clock);
    }

    private JsonNode lastFrame(WebSocketSession ws) throws Exception {
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(ws, atLeastOnce()).sendMessage(captor.capture());
        return objectMapper.readTree(captor.getValue().getPayload());
    }

    @Test
    void connectSendsEstablishedWithRequestedId() throws Exception {
        String id = manager.connect(ws1, "c1", "alice");

        assertThat(id).isEqualTo("c1");
        JsonNode frame = lastFrame(ws1);
        assertThat(frame.path("type").asText()).isEqualTo("connection_established");
        assertThat(frame.path("data").path("connection_id").asText()).isEqualTo("c1");
        assertThat(frame.path("data").path("user_id").asText()).isEqualTo("alice");
        assertThat(manager.connectionsOfUser("alice")).containsExactly("c1");
    }

    @Test
    void takenIdIsReplacedWithFreshOne() {
        manager.connect(ws1, "c1", null);
        String second = manager.connect(ws2, "c1", null);

        assertThat(second).isNotEqualTo("c1");
        assertThat(manager.connectionCount()).isEqualTo(2);
    }

    @Test
    void topicBroadcastReachesOnlyItsSubscribers() throws Exception {
        manager.connect(ws1, "a", null);
        manager.connect(ws2, "b", null);
        manager.connect(ws3, "c", null);
        manager.subscribe("a", "tasks:T1");
        manager.subscribe("b", "tasks:T1");
        manager.subscribe("c", "tasks:T2");
        clearInvocations(ws1, ws2, ws3);

        int delivered = manager.broadcastToTopic("tasks:T1",
                WsMessage.of(WsMessageType.NOTIFICATION, objectMapper.createObjectNode().put("n", 1)), null);

        assertThat(delivered).isEqualTo(2);
        assertThat(lastFrame(ws1).path("type").asText()).isEqualTo("notification");
        assertThat(lastFrame(ws2).path("data").path("n").asInt()).isEqualTo(1);
        verify(ws3, never()).sendMessage(any());
    }

    @Test
    void broadcastSkipsExcludedConnection() throws Exception {
        manager.connect(ws1, "a", null);
        manager.connect(ws2, "b", null);
        manager.subscribe("a", "tasks");
        manager.subscribe("b", "tasks");
        clearInvocations(ws1, ws2);

        int delivered = manager.broadcastToTopic("tasks",
                WsMessage.of(WsMessageType.NOTIFICATION, objectMapper.createObjectNode()), "a");

        assertThat(delivered).isEqualTo(1);
        verify(ws1, never()).sendMessage(any());
    }

    @Test
    void overlappingTopicsDeliverOncePerConnection() throws Exception {
        manager.connect(ws1, "a", null);
        manager.subscribe("a", "tasks");
        manager.subscribe("a", "tasks:T1");
        clearInvocations(ws1);

        int delivered = manager.broadcastToTopics(List.of("tasks:T1", "tasks"),
                WsMessage.of(WsMessageType.TASK_UPDATE, objectMapper.createObjectNode()), null);

        assertThat(delivered).isEqualTo(1);
        verify(ws1, times(1)).sendMessage(any());
    }

    @Test
    void subscribeHasSetSemantics() {
        manager.connect(ws1, "a", null);

        assertThat(manager.subscribe("a", "tasks")).isTrue();
        assertThat(manager.subscribe("a", "tasks")).isFalse();
        assertThat(manager.subscribersOf("tasks")).containsExactly("a");
        assertThat(manager.unsubscribe("a", "tasks")).isTrue();
        assertThat(manager.unsubscribe("a", "tasks")).isFalse();
        assertThat(manager.subscribersOf("tasks")).isEmpty();
    }

    @Test
    void disconnectRemovesIdFromEveryIndex() throws Exception {
        manager.connect(ws1, "a", "alice");
        manager.connect(ws2, "b", "alice");
        manager.subscribe("a", "tasks:T1");
        manager.subscribe("a", "tasks");
        manager.subscribe("b", "tasks");

        assertThat(manager.disconnect("a")).isTrue();

        assertThat(manager.isConnected("a")).isFalse();
        assertThat(manager.subscribersOf("tasks:T1")).isEmpty();
        assertThat(manager.subscribersOf("tasks")).containsExactly("b");
        assertThat(manager.connectionsOfUser("alice")).containsExactly("b");
        verify(ws1).close(CloseStatus.GOING_AWAY);
        assertThat(manager.disconnect("a")).isFalse();
    }

    @Test
    void failedSendDisconnects() throws Exception {
        manager.connect(ws1, "a", "alice");
        manager.subscribe("a", "tasks");
        doThrow(new IOException("broken pipe")).when(ws1).sendMessage(any());

        boolean sent = manager.sendPersonal("a", WsMessage.of(WsMessageType.PONG, objectMapper.createObjectNode()));

        assertThat(sent).isFalse();
        assertThat(manager.isConnected("a")).isFalse();
        assertThat(manager.subscribersOf("tasks")).isEmpty();
        assertThat(manager.connectionsOfUser("alice")).isEmpty();
    }

    @Test
    void sendToUserReachesAllOfTheirConnections() throws Exception {
        manager.connect(ws1, "a", "alice");
        manager.connect(ws2, "b", "bob");
        manager.connect(ws3, "c", null);
        manager.authenticate("c", "alice");
        clearInvocations(ws1, ws2, ws3);

        int delivered = manager.sendToUser("alice",
                WsMessage.of(WsMessageType.NOTIFICATION, objectMapper.createObjectNode()));

        assertThat(delivered).isEqualTo(2);
        verify(ws2, never()).sendMessage(any());
    }

    @Test
    void broadcastToAllCanRequireAuthentication() throws Exception {
        manager.connect(ws1, "a", null);
        manager.connect(ws2, "b", null);
        manager.authenticate("b", "bob");
        clearInvocations(ws1, ws2);

        assertThat(manager.broadcastToAll(WsMessage.of(WsMessageType.AGENT_STATUS, objectMapper.createObjectNode()), true))
                .isEqualTo(1);
        verify(ws1, never()).sendMessage(any());
        assertThat(manager.broadcastToAll(WsMessage.of(WsMessageType.AGENT_STATUS, objectMapper.createObjectNode()), false))
                .isEqualTo(2);
    }

    @Test
    void authenticateMovesConnectionBetweenUsers() {
        manager.connect(ws1, "a", "guest");

        manager.authenticate("a", "alice");

        assertThat(manager.connectionsOfUser("guest")).isEmpty();
        assertThat(manager.connectionsOfUser("alice")).containsExactly("a");
        assertThat(manager.isAuthenticated("a")).isTrue();
        assertThat(manager.userOf("a")).contains("alice");
    }

    @Test
    void sweepReapsOnlyIdleConnections() {
        manager.connect(ws1, "idle", null);
        manager.connect(ws2, "busy", null);

        now.set(now.get().plusSeconds(45));
        manager.touch("busy");
        now.set(now.get().plusSeconds(30));
        manager.reapStaleConnections();

        assertThat(manager.isConnected("idle")).isFalse();
        assertThat(manager.isConnected("busy")).isTrue();
        assertThat(manager.staleAfter()).isEqualTo(Duration.ofSeconds(60));
    }
}
