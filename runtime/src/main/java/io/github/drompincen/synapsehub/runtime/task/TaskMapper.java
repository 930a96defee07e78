package io.github.drompincen.synapsehub.runtime.task;

import io.github.drompincen.synapsehub.persistence.document.TaskDocument;
import io.github.drompincen.synapsehub.protocol.api.TaskDto;

import java.util.Map;

public final class TaskMapper {

    private TaskMapper() {}

    public static TaskDto toDto(TaskDocument doc) {
        return new TaskDto(
                doc.getTaskId(),
                doc.getTitle(),
                doc.getDescription(),
                doc.getStatus(),
                doc.getCurrentTurn(),
                doc.getPriority(),
                doc.getProgress(),
                doc.getProjectPath(),
                doc.getSshHost(),
                doc.getSshUser(),
                doc.getStartedAt(),
                doc.getCompletedAt(),
                doc.getEstimatedDuration(),
                doc.getActualDuration(),
                doc.getErrorMessage(),
                doc.getRetryCount(),
                doc.getMaxRetries(),
                doc.getAiContexts() != null ? doc.getAiContexts() : Map.of(),
                doc.getCreatedAt(),
                doc.getUpdatedAt(),
                doc.getCreatedBy(),
                doc.getUpdatedBy());
    }
}
