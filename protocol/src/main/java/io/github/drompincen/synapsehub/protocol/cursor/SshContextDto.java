package io.github.drompincen.synapsehub.protocol.cursor;

import java.time.Instant;
import java.util.Map;

public record SshContextDto(
        String host,
        int port,
        String username,
        String keyPath,
        String workingDirectory,
        Map<String, String> environmentVars,
        int connectionTimeout,
        Instant lastVerified,
        boolean isActive
) {}
