package io.github.drompincen.synapsehub.protocol.cursor;

import java.util.Map;

public record AgentStatusRequest(
        String status,
        Map<String, Object> details
) {}
