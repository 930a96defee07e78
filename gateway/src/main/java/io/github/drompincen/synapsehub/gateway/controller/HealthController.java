package io.github.drompincen.synapsehub.gateway.controller;

import io.github.drompincen.synapsehub.gateway.websocket.WebSocketConnectionManager;
import io.github.drompincen.synapsehub.protocol.cursor.CursorHealthDto;
import io.github.drompincen.synapsehub.runtime.cursor.CursorCommandQueue;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/health")
public class HealthController {

    private final CursorCommandQueue commandQueue;
    private final WebSocketConnectionManager connections;
    private final Clock clock;

    public HealthController(CursorCommandQueue commandQueue, WebSocketConnectionManager connections, Clock clock) {
        this.commandQueue = commandQueue;
        this.connections = connections;
        this.clock = clock;
    }

    /** The hub itself is up whenever this answers; {@code cursor_healthy} reports the connector. */
    @GetMapping
    public Map<String, Object> health() {
        CursorHealthDto cursor = commandQueue.health();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "ok");
        body.put("timestamp", clock.instant());
        body.put("cursor_healthy", cursor.healthy());
        body.put("cursor", cursor);
        body.put("websocket_connections", connections.connectionCount());
        return body;
    }
}
