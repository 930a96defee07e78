package io.github.drompincen.synapsehub.persistence.repository;

import io.github.drompincen.synapsehub.persistence.document.MessageDocument;
import io.github.drompincen.synapsehub.protocol.api.MessageSender;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface MessageRepository extends MongoRepository<MessageDocument, String>, MessageRepositoryCustom {
    List<MessageDocument> findByTaskIdOrderBySeqAsc(String taskId);
    List<MessageDocument> findByTaskIdAndSenderNotOrderBySeqAsc(String taskId, MessageSender sender);
    Optional<MessageDocument> findFirstByTaskIdAndSenderOrderBySeqDesc(String taskId, MessageSender sender);
    long countByTaskId(String taskId);
}
