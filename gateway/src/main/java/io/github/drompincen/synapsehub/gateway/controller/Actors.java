package io.github.drompincen.synapsehub.gateway.controller;

/** Caller identity for audit fields, taken from the {@code X-User-Id} request header. */
final class Actors {

    static final String HEADER = "X-User-Id";
    static final String ANONYMOUS = "anonymous";

    private Actors() {}

    static String of(String header) {
        return header == null || header.isBlank() ? ANONYMOUS : header.trim();
    }
}
