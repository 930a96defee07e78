package io.github.drompincen.synapsehub.runtime.cursor;

import io.github.drompincen.synapsehub.protocol.cursor.CommandType;
import io.github.drompincen.synapsehub.protocol.cursor.SshContextDto;

import java.util.Map;

/** What to enqueue. {@code null} retry and timeout settings fall back to the queue defaults. */
public record CommandSpec(
        String taskId,
        CommandType commandType,
        String content,
        Map<String, Object> metadata,
        SshContextDto sshContext,
        Integer maxRetries,
        Long timeoutSeconds
) {
    public static CommandSpec prompt(String taskId, String content) {
        return new CommandSpec(taskId, CommandType.PROMPT, content, Map.of(), null, null, null);
    }
}
