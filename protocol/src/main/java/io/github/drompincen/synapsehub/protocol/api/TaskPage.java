package io.github.drompincen.synapsehub.protocol.api;

import java.util.List;

public record TaskPage(
        List<TaskDto> tasks,
        long total,
        int skip,
        int limit,
        boolean hasNext,
        boolean hasPrev
) {
    public static TaskPage of(List<TaskDto> tasks, long total, int skip, int limit) {
        return new TaskPage(tasks, total, skip, limit, (long) skip + limit < total, skip > 0);
    }
}
