package io.github.drompincen.synapsehub.protocol.api;

import java.util.List;

public record MessagePage(
        List<MessageDto> messages,
        long total,
        int skip,
        int limit,
        boolean hasNext,
        boolean hasPrev
) {
    public static MessagePage of(List<MessageDto> messages, long total, int skip, int limit) {
        return new MessagePage(messages, total, skip, limit, (long) skip + limit < total, skip > 0);
    }
}
