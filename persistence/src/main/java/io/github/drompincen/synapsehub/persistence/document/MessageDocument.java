package io.github.drompincen.synapsehub.persistence.document;

import io.github.drompincen.synapsehub.protocol.api.MessageSender;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "task_messages")
@CompoundIndex(name = "task_seq", def = "{'taskId': 1, 'seq': 1}", unique = true)
public class MessageDocument {

    @Id
    private String messageId;
    private String taskId;
    private long seq;
    private String content;
    private MessageSender sender;
    private String relatedFileName;
    private Instant createdAt;
    private String createdBy;

    public MessageDocument() {}

    public String getMessageId() { return messageId; }
    public void setMessageId(String messageId) { this.messageId = messageId; }

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }

    public long getSeq() { return seq; }
    public void setSeq(long seq) { this.seq = seq; }

    public String getContent() { return content; }
    public void setContent(String content) { this.content = content; }

    public MessageSender getSender() { return sender; }
    public void setSender(MessageSender sender) { this.sender = sender; }

    public String getRelatedFileName() { return relatedFileName; }
    public void setRelatedFileName(String relatedFileName) { this.relatedFileName = relatedFileName; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }
}
