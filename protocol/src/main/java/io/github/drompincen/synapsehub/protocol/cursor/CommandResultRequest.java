package io.github.drompincen.synapsehub.protocol.cursor;

/** Result reported by a connector agent. A non-null {@code error} means the command failed. */
public record CommandResultRequest(
        boolean success,
        String response,
        String error
) {}
