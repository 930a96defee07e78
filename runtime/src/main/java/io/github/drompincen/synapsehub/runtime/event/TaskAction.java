package io.github.drompincen.synapsehub.runtime.event;

import java.util.Locale;

public enum TaskAction {
    CREATED,
    UPDATED,
    STARTED,
    COMPLETED,
    FAILED,
    RETRIED,
    CANCELLED,
    /** Soft delete; the document is kept with its deleted flag set. */
    DELETED,
    /** Hard delete; the document is gone. */
    PURGED;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
