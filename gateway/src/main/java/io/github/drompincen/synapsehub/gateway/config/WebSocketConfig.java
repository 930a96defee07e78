package io.github.drompincen.synapsehub.gateway.config;

import io.github.drompincen.synapsehub.gateway.websocket.SynapseHubWebSocketHandler;
import io.github.drompincen.synapsehub.gateway.websocket.WebSocketProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final SynapseHubWebSocketHandler handler;
    private final WebSocketProperties properties;

    public WebSocketConfig(SynapseHubWebSocketHandler handler, WebSocketProperties properties) {
        this.handler = handler;
        this.properties = properties;
    }

    /** {@code /ws} lets the server allocate the connection id; {@code /ws/{id}} proposes one. */
    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(handler, "/ws", "/ws/*")
                .setAllowedOriginPatterns(properties.getAllowedOrigins().toArray(String[]::new));
    }
}
