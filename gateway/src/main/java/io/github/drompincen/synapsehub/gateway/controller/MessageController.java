package io.github.drompincen.synapsehub.gateway.controller;

import io.github.drompincen.synapsehub.protocol.api.CreateMessageRequest;
import io.github.drompincen.synapsehub.protocol.api.MessageDto;
import io.github.drompincen.synapsehub.protocol.api.MessagePage;
import io.github.drompincen.synapsehub.protocol.api.MessageSender;
import io.github.drompincen.synapsehub.runtime.error.NotFoundException;
import io.github.drompincen.synapsehub.runtime.error.ValidationException;
import io.github.drompincen.synapsehub.runtime.message.MessageService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
public class MessageController {

    private final MessageService messageService;

    public MessageController(MessageService messageService) {
        this.messageService = messageService;
    }

    @PostMapping("/tasks/{taskId}/messages")
    public ResponseEntity<MessageDto> create(@PathVariable String taskId, @RequestBody CreateMessageRequest req,
                                             @RequestHeader(value = Actors.HEADER, required = false) String userId) {
        if (req == null) throw new ValidationException("request body is required");
        MessageDto message = messageService.createMessage(taskId, req.content(), req.sender(),
                req.relatedFileName(), Actors.of(userId));
        return ResponseEntity.status(HttpStatus.CREATED).body(message);
    }

    @GetMapping("/tasks/{taskId}/messages")
    public MessagePage list(@PathVariable String taskId,
                            @RequestParam(defaultValue = "0") int skip,
                            @RequestParam(defaultValue = "50") int limit,
                            @RequestParam(required = false) MessageSender sender,
                            @RequestParam(name = "sort_order", defaultValue = "asc") String sortOrder) {
        return messageService.getTaskMessages(taskId, skip, limit, sender, !TaskController.descending(sortOrder));
    }

    @GetMapping("/tasks/{taskId}/conversation")
    public List<MessageDto> conversation(@PathVariable String taskId,
                                         @RequestParam(name = "include_system", defaultValue = "true")
                                         boolean includeSystem) {
        return messageService.getConversationHistory(taskId, includeSystem);
    }

    @GetMapping("/messages/{messageId}")
    public MessageDto get(@PathVariable String messageId) {
        return messageService.getMessage(messageId);
    }

    @PostMapping("/tasks/{taskId}/relay")
    public ResponseEntity<MessageDto> relay(@PathVariable String taskId,
                                            @RequestParam(name = "target_agent") MessageSender targetAgent,
                                            @RequestParam String content,
                                            @RequestHeader(value = Actors.HEADER, required = false) String userId) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(messageService.relayToAgent(taskId, targetAgent, content, Actors.of(userId)));
    }

    @PostMapping("/tasks/{taskId}/system-message")
    public ResponseEntity<MessageDto> systemMessage(@PathVariable String taskId, @RequestParam String content,
                                                    @RequestHeader(value = Actors.HEADER, required = false)
                                                    String userId) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(messageService.addSystemMessage(taskId, content, Actors.of(userId)));
    }

    @GetMapping("/tasks/{taskId}/latest/{sender}")
    public MessageDto latest(@PathVariable String taskId, @PathVariable MessageSender sender) {
        return messageService.latestBySender(taskId, sender)
                .orElseThrow(() -> new NotFoundException("Message", taskId + "/" + sender.value()));
    }
}
