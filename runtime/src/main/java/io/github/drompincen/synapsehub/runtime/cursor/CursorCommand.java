package io.github.drompincen.synapsehub.runtime.cursor;

import io.github.drompincen.synapsehub.protocol.cursor.CommandStatus;
import io.github.drompincen.synapsehub.protocol.cursor.CommandType;
import io.github.drompincen.synapsehub.protocol.cursor.CursorCommandDto;
import io.github.drompincen.synapsehub.protocol.cursor.SshContextDto;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/** Queue entry. Mutated only while holding the owning queue's lock. */
class CursorCommand {

    private final String id;
    private final String taskId;
    private final CommandType commandType;
    private final String content;
    private final Map<String, Object> metadata;
    private final int maxRetries;
    private final long timeoutSeconds;
    private final SshContextDto sshContext;
    private final Instant createdAt;

    private CommandStatus status = CommandStatus.QUEUED;
    private Instant startedAt;
    private Instant completedAt;
    private String response;
    private String errorMessage;
    private int retryCount;

    CursorCommand(String id, String taskId, CommandType commandType, String content, Map<String, Object> metadata,
                  int maxRetries, long timeoutSeconds, SshContextDto sshContext, Instant createdAt) {
        this.id = id;
        this.taskId = taskId;
        this.commandType = commandType;
        this.content = content;
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
        this.maxRetries = maxRetries;
        this.timeoutSeconds = timeoutSeconds;
        this.sshContext = sshContext;
        this.createdAt = createdAt;
    }

    boolean isExpired(Instant now) {
        return status == CommandStatus.PROCESSING && startedAt != null
                && Duration.between(startedAt, now).compareTo(Duration.ofSeconds(timeoutSeconds)) > 0;
    }

    boolean canRetry() {
        return status.isRetryable() && retryCount < maxRetries;
    }

    void markProcessing(Instant now) {
        status = CommandStatus.PROCESSING;
        startedAt = now;
    }

    void markCompleted(String response, Instant now) {
        this.status = CommandStatus.COMPLETED;
        this.response = response;
        this.completedAt = now;
    }

    void markFinished(CommandStatus status, String errorMessage, Instant now) {
        this.status = status;
        this.errorMessage = errorMessage;
        this.completedAt = now;
    }

    /** Identity, type and content survive a retry; only timing and retry bookkeeping change. */
    void resetForRetry() {
        retryCount++;
        status = CommandStatus.QUEUED;
        startedAt = null;
        completedAt = null;
    }

    CursorCommandDto toDto() {
        return new CursorCommandDto(id, taskId, commandType, content, metadata, status, createdAt, startedAt,
                completedAt, response, errorMessage, retryCount, maxRetries, timeoutSeconds, sshContext);
    }

    String id() { return id; }
    String taskId() { return taskId; }
    CommandStatus status() { return status; }
    Instant completedAt() { return completedAt; }
    int retryCount() { return retryCount; }
    long timeoutSeconds() { return timeoutSeconds; }
    Map<String, Object> metadata() { return metadata; }
}
