package io.github.drompincen.synapsehub.protocol.api;

import java.time.Instant;
import java.util.Map;

public record TaskDto(
        String id,
        String title,
        String description,
        TaskStatus status,
        TaskTurn currentTurn,
        TaskPriority priority,
        int progress,
        String projectPath,
        String sshHost,
        String sshUser,
        Instant startedAt,
        Instant completedAt,
        Integer estimatedDuration,
        Integer actualDuration,
        String errorMessage,
        int retryCount,
        int maxRetries,
        Map<String, Map<String, Object>> aiContexts,
        Instant createdAt,
        Instant updatedAt,
        String createdBy,
        String updatedBy
) {
    public boolean isRemoteSsh() {
        return sshHost != null && sshUser != null;
    }
}
