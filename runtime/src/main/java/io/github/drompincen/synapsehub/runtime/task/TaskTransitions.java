package io.github.drompincen.synapsehub.runtime.task;

import io.github.drompincen.synapsehub.persistence.document.TaskDocument;
import io.github.drompincen.synapsehub.protocol.api.TaskStatus;
import io.github.drompincen.synapsehub.protocol.api.TaskTurn;
import io.github.drompincen.synapsehub.runtime.error.BusinessLogicException;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/** Applies one matrix step to a task document together with the turn and timestamps it implies. */
public final class TaskTransitions {

    public static final String RULE = "task_status_transition";

    private TaskTransitions() {}

    public static void apply(TaskDocument doc, TaskStatus next, Instant now) {
        TaskStatus current = doc.getStatus();
        if (!current.canTransitionTo(next)) {
            throw new BusinessLogicException("Invalid status transition " + current.value() + " -> " + next.value(),
                    RULE, details(current, next));
        }
        doc.setStatus(next);
        switch (next) {
            case PROCESSING_CURSOR -> {
                doc.setCurrentTurn(TaskTurn.CURSOR);
                if (current == TaskStatus.PENDING) {
                    doc.setStartedAt(now);
                    doc.setProgress(Math.max(doc.getProgress(), 5));
                }
            }
            case PROCESSING_GEMINI -> doc.setCurrentTurn(TaskTurn.GEMINI);
            case AWAITING_USER_GEMINI, AWAITING_USER_CURSOR -> doc.setCurrentTurn(TaskTurn.USER);
            case COMPLETED -> {
                finish(doc, now);
                doc.setProgress(100);
            }
            case FAILED, CANCELLED -> finish(doc, now);
            case PENDING -> { }
        }
    }

    public static Map<String, Object> details(TaskStatus from, TaskStatus to) {
        return Map.of("from", from.value(), "to", to.value());
    }

    private static void finish(TaskDocument doc, Instant now) {
        doc.setCompletedAt(now);
        if (doc.getStartedAt() != null) {
            doc.setActualDuration((int) Duration.between(doc.getStartedAt(), now).getSeconds());
        }
    }
}
