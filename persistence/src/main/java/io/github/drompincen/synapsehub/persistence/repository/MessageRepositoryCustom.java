package io.github.drompincen.synapsehub.persistence.repository;

import io.github.drompincen.synapsehub.persistence.document.MessageDocument;
import io.github.drompincen.synapsehub.protocol.api.MessageSender;

import java.util.List;

public interface MessageRepositoryCustom {
    /** Offset window over a task's messages, optionally narrowed to one sender. */
    List<MessageDocument> findWindow(String taskId, MessageSender sender, boolean ascending, int skip, int limit);
    long countBySender(String taskId, MessageSender sender);
}
