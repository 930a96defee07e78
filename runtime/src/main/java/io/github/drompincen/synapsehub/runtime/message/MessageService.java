package io.github.drompincen.synapsehub.runtime.message;

import io.github.drompincen.synapsehub.persistence.document.MessageDocument;
import io.github.drompincen.synapsehub.persistence.document.TaskDocument;
import io.github.drompincen.synapsehub.persistence.repository.MessageRepository;
import io.github.drompincen.synapsehub.persistence.repository.TaskRepository;
import io.github.drompincen.synapsehub.protocol.api.MessageDto;
import io.github.drompincen.synapsehub.protocol.api.MessagePage;
import io.github.drompincen.synapsehub.protocol.api.MessageSender;
import io.github.drompincen.synapsehub.protocol.api.TaskDto;
import io.github.drompincen.synapsehub.protocol.api.TaskStatus;
import io.github.drompincen.synapsehub.protocol.api.TaskTurn;
import io.github.drompincen.synapsehub.runtime.error.BusinessLogicException;
import io.github.drompincen.synapsehub.runtime.error.NotFoundException;
import io.github.drompincen.synapsehub.runtime.error.ValidationException;
import io.github.drompincen.synapsehub.runtime.event.HubEventPublisher;
import io.github.drompincen.synapsehub.runtime.event.TaskAction;
import io.github.drompincen.synapsehub.runtime.task.TaskMapper;
import io.github.drompincen.synapsehub.runtime.task.TaskProperties;
import io.github.drompincen.synapsehub.runtime.task.TaskService;
import io.github.drompincen.synapsehub.runtime.task.TaskTransitions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Turn-validated conversation of a task. A message insert and the task update it triggers commit
 * in one MongoDB transaction; events go out only after the commit.
 */
@Service
public class MessageService {

    private static final Logger log = LoggerFactory.getLogger(MessageService.class);

    static final int CONTENT_MAX = 10_000;
    static final int FILE_NAME_MAX = 255;
    static final String RULE_SENDER_TURN = "invalid_sender_for_turn";
    public static final String RULE_TASK_CLOSED = "task_closed";
    static final String RULE_CONCURRENT_UPDATE = TaskService.RULE_CONCURRENT_UPDATE;

    private final MessageRepository messageRepository;
    private final TaskRepository taskRepository;
    private final HubEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final TaskProperties taskProperties;
    private final Clock clock;

    public MessageService(MessageRepository messageRepository,
                          TaskRepository taskRepository,
                          HubEventPublisher eventPublisher,
                          PlatformTransactionManager transactionManager,
                          TaskProperties taskProperties,
                          Clock clock) {
        this.messageRepository = messageRepository;
        this.taskRepository = taskRepository;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.taskProperties = taskProperties;
        this.clock = clock;
    }

    private record Outcome(MessageDto message, TaskDto task, TaskTurn previousTurn, TaskStatus previousStatus) {
        boolean taskChanged() {
            return task != null;
        }
    }

    public MessageDto createMessage(String taskId, String content, MessageSender sender,
                                    String relatedFileName, String actor) {
        if (sender == null) throw new ValidationException("sender is required", "sender");
        if (content == null || content.isBlank()) throw new ValidationException("content is required", "content");
        if (content.length() > CONTENT_MAX) {
            throw new ValidationException("content must be at most " + CONTENT_MAX + " characters", "content");
        }
        if (relatedFileName != null && relatedFileName.length() > FILE_NAME_MAX) {
            throw new ValidationException("related_file_name must be at most " + FILE_NAME_MAX + " characters",
                    "related_file_name");
        }

        Outcome outcome;
        try {
            outcome = transactionTemplate.execute(status -> record(taskId, content, sender, relatedFileName, actor));
        } catch (DuplicateKeyException | OptimisticLockingFailureException e) {
            log.warn("Concurrent update while adding {} message to task {}: {}", sender.value(), taskId, e.getMessage());
            throw new BusinessLogicException("Task " + taskId + " was modified concurrently, retry the request",
                    RULE_CONCURRENT_UPDATE);
        }

        log.debug("Message {} #{} from {} on task {}", outcome.message().id(), outcome.message().seq(),
                sender.value(), taskId);
        eventPublisher.messageCreated(outcome.message());
        if (outcome.taskChanged()) {
            TaskAction action = outcome.previousStatus() == TaskStatus.PENDING ? TaskAction.STARTED : TaskAction.UPDATED;
            eventPublisher.taskChanged(outcome.task(), action);
            if (outcome.previousTurn() != outcome.task().currentTurn()) {
                eventPublisher.turnAdvanced(outcome.task(), outcome.previousTurn());
            }
        }
        return outcome.message();
    }

    private Outcome record(String taskId, String content, MessageSender sender, String relatedFileName, String actor) {
        TaskDocument task = taskRepository.findById(taskId)
                .filter(t -> !t.isDeleted())
                .orElseThrow(() -> new NotFoundException("Task", taskId));
        TaskStatus previousStatus = task.getStatus();
        TaskTurn previousTurn = task.getCurrentTurn();

        if (sender != MessageSender.SYSTEM && (previousStatus.isTerminal() || previousStatus == TaskStatus.FAILED)) {
            throw new BusinessLogicException("Task is " + previousStatus.value() + ", only system messages are accepted",
                    RULE_TASK_CLOSED, Map.of("status", previousStatus.value()));
        }
        if (!sender.canSendDuring(previousTurn)) {
            throw new BusinessLogicException(sender.value() + " cannot send a message during the "
                    + previousTurn.value() + " turn", RULE_SENDER_TURN,
                    Map.of("sender", sender.value(), "current_turn", previousTurn.value()));
        }

        Instant now = clock.instant();
        Optional<TurnPolicy.Advance> advance = TurnPolicy.next(previousStatus, previousTurn, sender);
        if (advance.isPresent()) {
            TaskTransitions.apply(task, advance.get().status(), now);
            task.setCurrentTurn(advance.get().turn());
        }

        MessageDocument msg = new MessageDocument();
        msg.setMessageId(UUID.randomUUID().toString());
        msg.setTaskId(taskId);
        msg.setSeq(messageRepository.countByTaskId(taskId) + 1);
        msg.setContent(content);
        msg.setSender(sender);
        msg.setRelatedFileName(relatedFileName);
        msg.setCreatedAt(now);
        msg.setCreatedBy(actor);
        MessageDto saved = MessageMapper.toDto(messageRepository.save(msg));

        if (advance.isEmpty()) {
            return new Outcome(saved, null, previousTurn, previousStatus);
        }
        task.setUpdatedAt(now);
        task.setUpdatedBy(actor);
        TaskDto updated = TaskMapper.toDto(taskRepository.save(task));
        return new Outcome(saved, updated, previousTurn, previousStatus);
    }

    public MessageDto getMessage(String messageId) {
        return messageRepository.findById(messageId)
                .map(MessageMapper::toDto)
                .orElseThrow(() -> new NotFoundException("Message", messageId));
    }

    public List<MessageDto> getConversationHistory(String taskId, boolean includeSystem) {
        requireTask(taskId);
        List<MessageDocument> docs = includeSystem
                ? messageRepository.findByTaskIdOrderBySeqAsc(taskId)
                : messageRepository.findByTaskIdAndSenderNotOrderBySeqAsc(taskId, MessageSender.SYSTEM);
        return docs.stream().map(MessageMapper::toDto).toList();
    }

    public MessagePage getTaskMessages(String taskId, int skip, int limit, MessageSender sender, boolean ascending) {
        if (skip < 0) throw new ValidationException("skip must not be negative", "skip");
        if (limit < 1) throw new ValidationException("limit must be positive", "limit");
        requireTask(taskId);
        int capped = Math.min(limit, taskProperties.getMaxPageSize());
        List<MessageDto> messages = messageRepository.findWindow(taskId, sender, ascending, skip, capped).stream()
                .map(MessageMapper::toDto).toList();
        return MessagePage.of(messages, messageRepository.countBySender(taskId, sender), skip, capped);
    }

    /** Records a system note addressed to an agent. Delivery to the agent is the command queue's job. */
    public MessageDto relayToAgent(String taskId, MessageSender target, String content, String actor) {
        if (target == null || !target.isAgent()) {
            throw new ValidationException("Can only relay to cursor or gemini", "target_agent");
        }
        if (content == null || content.isBlank()) throw new ValidationException("content is required", "content");
        String tagged = "[RELAY TO " + target.value().toUpperCase() + "] " + content;
        return createMessage(taskId, tagged, MessageSender.SYSTEM, null, actor);
    }

    public MessageDto addSystemMessage(String taskId, String content, String actor) {
        return createMessage(taskId, content, MessageSender.SYSTEM, null, actor);
    }

    public Optional<MessageDto> latestBySender(String taskId, MessageSender sender) {
        return messageRepository.findFirstByTaskIdAndSenderOrderBySeqDesc(taskId, sender).map(MessageMapper::toDto);
    }

    private void requireTask(String taskId) {
        if (taskRepository.findById(taskId).filter(t -> !t.isDeleted()).isEmpty()) {
            throw new NotFoundException("Task", taskId);
        }
    }
}
