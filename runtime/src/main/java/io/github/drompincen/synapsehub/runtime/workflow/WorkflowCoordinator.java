package io.github.drompincen.synapsehub.runtime.workflow;

import io.github.drompincen.synapsehub.protocol.api.MessageDto;
import io.github.drompincen.synapsehub.protocol.api.MessageSender;
import io.github.drompincen.synapsehub.protocol.api.TaskDto;
import io.github.drompincen.synapsehub.protocol.api.TaskStatus;
import io.github.drompincen.synapsehub.protocol.api.TaskTurn;
import io.github.drompincen.synapsehub.protocol.cursor.CommandType;
import io.github.drompincen.synapsehub.protocol.cursor.CursorCommandDto;
import io.github.drompincen.synapsehub.protocol.cursor.CursorStatus;
import io.github.drompincen.synapsehub.protocol.cursor.SshContextDto;
import io.github.drompincen.synapsehub.runtime.cursor.CommandLifecycleListener;
import io.github.drompincen.synapsehub.runtime.cursor.CommandSpec;
import io.github.drompincen.synapsehub.runtime.cursor.CursorCommandQueue;
import io.github.drompincen.synapsehub.runtime.cursor.SshContextCache;
import io.github.drompincen.synapsehub.runtime.error.BusinessLogicException;
import io.github.drompincen.synapsehub.runtime.error.NotFoundException;
import io.github.drompincen.synapsehub.runtime.error.SynapseHubException;
import io.github.drompincen.synapsehub.runtime.event.HubEventListener;
import io.github.drompincen.synapsehub.runtime.event.HubEventPublisher;
import io.github.drompincen.synapsehub.runtime.event.TaskAction;
import io.github.drompincen.synapsehub.runtime.message.MessageService;
import io.github.drompincen.synapsehub.runtime.task.TaskService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Moves work between the conversation and the Cursor connector. When a task's turn passes to
 * Cursor a prompt command is queued; the command's result comes back as a cursor message, and a
 * command that finally fails takes the task down with it.
 */
@Component
public class WorkflowCoordinator implements HubEventListener, CommandLifecycleListener {

    private static final Logger log = LoggerFactory.getLogger(WorkflowCoordinator.class);

    static final String ACTOR = "workflow";
    static final String SOURCE_KEY = "source";
    static final String SSH_CONTEXT_KEY = "ssh_context_id";
    static final String CURSOR_AGENT = "cursor";
    static final int DEFAULT_SSH_PORT = 22;
    static final int DEFAULT_SSH_TIMEOUT = 30;
    static final int MAX_WRITE_ATTEMPTS = 3;

    private final TaskService taskService;
    private final MessageService messageService;
    private final CursorCommandQueue commandQueue;
    private final SshContextCache sshContexts;
    private final HubEventPublisher eventPublisher;

    public WorkflowCoordinator(TaskService taskService,
                               MessageService messageService,
                               CursorCommandQueue commandQueue,
                               SshContextCache sshContexts,
                               HubEventPublisher eventPublisher) {
        this.taskService = taskService;
        this.messageService = messageService;
        this.commandQueue = commandQueue;
        this.sshContexts = sshContexts;
        this.eventPublisher = eventPublisher;
    }

    @PostConstruct
    public void init() {
        eventPublisher.addListener(this);
        commandQueue.addListener(this);
    }

    @PreDestroy
    public void shutdown() {
        eventPublisher.removeListener(this);
        commandQueue.removeListener(this);
    }

    // ---------------------------------------------------------------------------
    // Hub events
    // ---------------------------------------------------------------------------

    @Override
    public void onTurnAdvanced(TaskDto task, TaskTurn previous) {
        if (task.currentTurn() != TaskTurn.CURSOR || task.status() != TaskStatus.PROCESSING_CURSOR) return;
        String prompt = messageService.latestBySender(task.id(), MessageSender.USER)
                .map(MessageDto::content)
                .orElseGet(() -> task.description() != null && !task.description().isBlank()
                        ? task.description() : task.title());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(SOURCE_KEY, ACTOR);
        metadata.put("task_title", task.title());
        try {
            CursorCommandDto command = commandQueue.enqueue(new CommandSpec(task.id(), CommandType.PROMPT, prompt,
                    metadata, resolveSshContext(task), null, null));
            log.info("Task {} handed to cursor as command {}", task.id(), command.id());
        } catch (SynapseHubException e) {
            log.warn("Could not queue cursor command for task {}: {}", task.id(), e.getMessage());
            failTask(task.id(), "Cursor command rejected: " + e.getMessage());
        }
    }

    @Override
    public void onTaskChanged(TaskDto task, TaskAction action) {
        if (action != TaskAction.PURGED && action != TaskAction.DELETED && action != TaskAction.CANCELLED) return;
        int cancelled = commandQueue.cancelForTask(task.id());
        if (cancelled > 0) {
            log.info("Cancelled {} cursor command(s) of task {} ({})", cancelled, task.id(), action.value());
        }
    }

    // ---------------------------------------------------------------------------
    // Command lifecycle
    // ---------------------------------------------------------------------------

    @Override
    public void onCompleted(CursorCommandDto command) {
        if (!isWorkflowCommand(command)) return;
        String reply = command.response() != null && !command.response().isBlank()
                ? command.response() : "(cursor returned no output)";
        try {
            retryOnConflict(command.taskId(),
                    () -> messageService.createMessage(command.taskId(), reply, MessageSender.CURSOR, null, ACTOR));
        } catch (NotFoundException e) {
            log.warn("Cursor result of command {} dropped, task {} is gone", command.id(), command.taskId());
        } catch (BusinessLogicException e) {
            if (MessageService.RULE_TASK_CLOSED.equals(e.getRule())) {
                log.warn("Cursor result of command {} dropped: {}", command.id(), e.getMessage());
                return;
            }
            recordingFailed(command, e);
        } catch (SynapseHubException e) {
            recordingFailed(command, e);
        }
    }

    private void recordingFailed(CursorCommandDto command, SynapseHubException e) {
        log.warn("Cursor result of command {} not recorded on task {}: {}", command.id(), command.taskId(),
                e.getMessage());
        failTask(command.taskId(), "Cursor result could not be recorded: " + e.getMessage());
    }

    @Override
    public void onFailed(CursorCommandDto command) {
        if (!isWorkflowCommand(command)) return;
        failTask(command.taskId(), command.errorMessage() != null ? command.errorMessage() : "Cursor command failed");
    }

    @Override
    public void onStatusChanged(CursorStatus previous, CursorStatus current, String detail) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("previous", previous.value());
        if (detail != null) details.put("detail", detail);
        eventPublisher.agentStatus(CURSOR_AGENT, current.value(), details);
    }

    // ---------------------------------------------------------------------------

    /** A context registered under the cursor AI context wins over the task's own ssh fields. */
    SshContextDto resolveSshContext(TaskDto task) {
        Optional<SshContextDto> registered = Optional.ofNullable(task.aiContexts())
                .map(contexts -> contexts.get(CURSOR_AGENT))
                .map(ctx -> ctx.get(SSH_CONTEXT_KEY))
                .map(Object::toString)
                .flatMap(id -> {
                    Optional<SshContextDto> found = sshContexts.get(id);
                    if (found.isEmpty()) log.warn("Task {} names unknown ssh context {}", task.id(), id);
                    return found;
                });
        if (registered.isPresent()) return registered.get();
        if (!task.isRemoteSsh()) return null;
        return new SshContextDto(task.sshHost(), DEFAULT_SSH_PORT, task.sshUser(), null, task.projectPath(),
                Map.of(), DEFAULT_SSH_TIMEOUT, null, false);
    }

    private void failTask(String taskId, String reason) {
        try {
            retryOnConflict(taskId, () -> taskService.fail(taskId, reason, ACTOR));
        } catch (SynapseHubException e) {
            log.warn("Task {} could not be failed after cursor error: {}", taskId, e.getMessage());
        }
    }

    /** Repeats a task write that lost to a concurrent update; each attempt reloads the task. */
    private void retryOnConflict(String taskId, Runnable write) {
        for (int attempt = 1; ; attempt++) {
            try {
                write.run();
                return;
            } catch (BusinessLogicException e) {
                if (!TaskService.RULE_CONCURRENT_UPDATE.equals(e.getRule()) || attempt >= MAX_WRITE_ATTEMPTS) throw e;
                log.debug("Task {} changed concurrently, attempt {} of {}", taskId, attempt + 1, MAX_WRITE_ATTEMPTS);
            }
        }
    }

    private static boolean isWorkflowCommand(CursorCommandDto command) {
        return command.metadata() != null && ACTOR.equals(command.metadata().get(SOURCE_KEY));
    }
}
