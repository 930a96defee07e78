package io.github.drompincen.synapsehub.protocol.api;

import java.util.Map;

public record ApiError(
        String message,
        String errorCode,
        Map<String, Object> details
) {}
