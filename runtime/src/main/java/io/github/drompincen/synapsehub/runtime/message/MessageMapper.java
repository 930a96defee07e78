package io.github.drompincen.synapsehub.runtime.message;

import io.github.drompincen.synapsehub.persistence.document.MessageDocument;
import io.github.drompincen.synapsehub.protocol.api.MessageDto;

public final class MessageMapper {

    private MessageMapper() {}

    public static MessageDto toDto(MessageDocument doc) {
        return new MessageDto(doc.getMessageId(), doc.getTaskId(), doc.getSeq(), doc.getContent(),
                doc.getSender(), doc.getRelatedFileName(), doc.getCreatedAt(), doc.getCreatedBy());
    }
}
