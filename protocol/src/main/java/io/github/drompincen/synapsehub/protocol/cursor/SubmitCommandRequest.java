package io.github.drompincen.synapsehub.protocol.cursor;

import java.util.Map;

public record SubmitCommandRequest(
        CommandType commandType,
        String content,
        Map<String, Object> metadata,
        String sshContextId,
        Integer maxRetries,
        Long timeoutSeconds
) {}
