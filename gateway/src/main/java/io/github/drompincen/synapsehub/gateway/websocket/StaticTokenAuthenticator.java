package io.github.drompincen.synapsehub.gateway.websocket;

import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class StaticTokenAuthenticator implements WebSocketAuthenticator {

    private final WebSocketProperties properties;

    public StaticTokenAuthenticator(WebSocketProperties properties) {
        this.properties = properties;
    }

    @Override
    public Optional<String> authenticate(String token) {
        if (token == null || token.isBlank()) return Optional.empty();
        return Optional.ofNullable(properties.getTokens().get(token));
    }
}
