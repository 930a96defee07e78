package io.github.drompincen.synapsehub.runtime.message;

import io.github.drompincen.synapsehub.protocol.api.MessageSender;
import io.github.drompincen.synapsehub.protocol.api.TaskStatus;
import io.github.drompincen.synapsehub.protocol.api.TaskTurn;

import java.util.Optional;

/** Where a task goes after a message from a given sender. Empty means turn and status stay put. */
final class TurnPolicy {

    record Advance(TaskTurn turn, TaskStatus status) {}

    private TurnPolicy() {}

    static Optional<Advance> next(TaskStatus status, TaskTurn turn, MessageSender sender) {
        return switch (sender) {
            case SYSTEM -> Optional.empty();
            case USER -> turn != TaskTurn.USER
                    ? Optional.empty()
                    : status == TaskStatus.AWAITING_USER_GEMINI
                    ? Optional.of(new Advance(TaskTurn.GEMINI, TaskStatus.PROCESSING_GEMINI))
                    : Optional.of(new Advance(TaskTurn.CURSOR, TaskStatus.PROCESSING_CURSOR));
            case CURSOR -> Optional.of(new Advance(TaskTurn.USER, TaskStatus.AWAITING_USER_GEMINI));
            case GEMINI -> Optional.of(new Advance(TaskTurn.USER, TaskStatus.AWAITING_USER_CURSOR));
        };
    }
}
