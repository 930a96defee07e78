package io.github.drompincen.synapsehub.protocol.api;

public record CreateMessageRequest(
        String content,
        MessageSender sender,
        String relatedFileName
) {
    public CreateMessageRequest(String content, MessageSender sender) {
        this(content, sender, null);
    }
}
