package io.github.drompincen.synapsehub.protocol.cursor;

import java.time.Instant;
import java.util.List;

public record CursorAgentDto(
        String agentId,
        String version,
        String hostname,
        List<String> capabilities,
        String status,
        Instant registeredAt,
        Instant lastSeen,
        boolean live
) {}
