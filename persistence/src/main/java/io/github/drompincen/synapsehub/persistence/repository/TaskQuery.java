package io.github.drompincen.synapsehub.persistence.repository;

import io.github.drompincen.synapsehub.protocol.api.TaskPriority;
import io.github.drompincen.synapsehub.protocol.api.TaskStatus;
import io.github.drompincen.synapsehub.protocol.api.TaskTurn;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/** Filter, sort and window for a task listing. {@code null} filters match everything. */
public record TaskQuery(
        String searchTerm,
        TaskStatus status,
        TaskPriority priority,
        TaskTurn currentTurn,
        Boolean remoteSsh,
        String createdBy,
        Instant createdAfter,
        Instant createdBefore,
        boolean includeDeleted,
        String sortBy,
        boolean descending,
        int skip,
        int limit
) {
    private static final Map<String, String> SORT_FIELDS = Map.of(
            "created_at", "createdAt",
            "updated_at", "updatedAt",
            "title", "title",
            "priority", "priority",
            "status", "status",
            "progress", "progress");

    public static Set<String> sortKeys() {
        return SORT_FIELDS.keySet();
    }

    public static TaskQuery firstPage(int limit) {
        return new TaskQuery(null, null, null, null, null, null, null, null, false, "created_at", true, 0, limit);
    }

    public String sortField() {
        return SORT_FIELDS.getOrDefault(sortBy, "createdAt");
    }
}
