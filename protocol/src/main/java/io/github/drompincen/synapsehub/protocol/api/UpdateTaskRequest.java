package io.github.drompincen.synapsehub.protocol.api;

import java.util.Map;

/** Partial update; {@code null} fields are left untouched. */
public record UpdateTaskRequest(
        String title,
        String description,
        TaskPriority priority,
        TaskStatus status,
        Integer progress,
        String projectPath,
        String sshHost,
        String sshUser,
        Integer estimatedDuration,
        Map<String, Map<String, Object>> aiContexts
) {
    public static UpdateTaskRequest status(TaskStatus status) {
        return new UpdateTaskRequest(null, null, null, status, null, null, null, null, null, null);
    }
}
