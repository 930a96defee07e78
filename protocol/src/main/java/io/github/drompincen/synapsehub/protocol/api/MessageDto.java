package io.github.drompincen.synapsehub.protocol.api;

import java.time.Instant;

public record MessageDto(
        String id,
        String taskId,
        long seq,
        String content,
        MessageSender sender,
        String relatedFileName,
        Instant createdAt,
        String createdBy
) {}
