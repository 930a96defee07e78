package io.github.drompincen.synapsehub.protocol.cursor;

import java.time.Instant;
import java.util.Map;

public record CursorCommandDto(
        String id,
        String taskId,
        CommandType commandType,
        String content,
        Map<String, Object> metadata,
        CommandStatus status,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        String response,
        String errorMessage,
        int retryCount,
        int maxRetries,
        long timeoutSeconds,
        SshContextDto sshContext
) {}
