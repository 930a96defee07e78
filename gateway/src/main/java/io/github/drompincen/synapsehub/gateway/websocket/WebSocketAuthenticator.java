package io.github.drompincen.synapsehub.gateway.websocket;

import java.util.Optional;

/** Resolves the token of an {@code authenticate} control message to a user id. */
public interface WebSocketAuthenticator {

    Optional<String> authenticate(String token);
}
