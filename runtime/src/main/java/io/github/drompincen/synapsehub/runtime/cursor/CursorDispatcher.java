package io.github.drompincen.synapsehub.runtime.cursor;

import io.github.drompincen.synapsehub.protocol.cursor.CursorCommandDto;

/**
 * Hands a command to the external connector. Completion arrives later through
 * {@link CursorCommandQueue#completeCommand} or {@link CursorCommandQueue#failCommand}.
 */
public interface CursorDispatcher {

    /** @throws io.github.drompincen.synapsehub.runtime.error.ExternalServiceException when the hand-off fails */
    void dispatch(CursorCommandDto command);

    /** Withdraws a command that was cancelled or timed out before an agent picked it up. */
    default void withdraw(String commandId) {}

    default void clear() {}
}
