package io.github.drompincen.synapsehub.protocol.api;

import java.util.Map;

public record CreateTaskRequest(
        String title,
        String description,
        TaskPriority priority,
        String projectPath,
        String sshHost,
        String sshUser,
        Integer estimatedDuration,
        Integer maxRetries,
        Map<String, Map<String, Object>> aiContexts
) {
    public CreateTaskRequest(String title, TaskPriority priority) {
        this(title, null, priority, null, null, null, null, null, null);
    }
}
