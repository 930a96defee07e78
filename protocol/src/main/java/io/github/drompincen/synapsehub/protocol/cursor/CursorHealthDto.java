package io.github.drompincen.synapsehub.protocol.cursor;

import java.time.Instant;

public record CursorHealthDto(
        CursorStatus status,
        boolean healthy,
        int queueSize,
        int activeCommands,
        int expiredCommands,
        int sshContexts,
        int liveAgents,
        Instant lastHeartbeat,
        Long heartbeatAgeSeconds
) {}
