package io.github.drompincen.synapsehub.runtime.cursor;

import io.github.drompincen.synapsehub.protocol.cursor.CursorCommandDto;
import io.github.drompincen.synapsehub.protocol.cursor.CursorStatus;

import java.time.Duration;

public interface CommandLifecycleListener {
    default void onCompleted(CursorCommandDto command) {}
    /** Terminal failure: retries exhausted, cancelled commands excluded. */
    default void onFailed(CursorCommandDto command) {}
    default void onRetryScheduled(CursorCommandDto command, Duration delay) {}
    default void onStatusChanged(CursorStatus previous, CursorStatus current, String detail) {}
}
