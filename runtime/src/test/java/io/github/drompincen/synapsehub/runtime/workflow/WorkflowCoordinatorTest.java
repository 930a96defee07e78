package io.github.drompincen.synapsehub.runtime.workflow;

import io.github.drompincen.synapsehub.protocol.api.MessageDto;
import io.github.drompincen.synapsehub.protocol.api.MessageSender;
import io.github.drompincen.synapsehub.protocol.api.TaskDto;
import io.github.drompincen.synapsehub.protocol.api.TaskPriority;
import io.github.drompincen.synapsehub.protocol.api.TaskStatus;
import io.github.drompincen.synapsehub.protocol.api.TaskTurn;
import io.github.drompincen.synapsehub.protocol.cursor.CommandStatus;
import io.github.drompincen.synapsehub.protocol.cursor.CommandType;
import io.github.drompincen.synapsehub.protocol.cursor.CursorCommandDto;
import io.github.drompincen.synapsehub.protocol.cursor.CursorStatus;
import io.github.drompincen.synapsehub.protocol.cursor.SshContextDto;
import io.github.drompincen.synapsehub.runtime.cursor.CommandSpec;
import io.github.drompincen.synapsehub.runtime.cursor.CursorCommandQueue;
import io.github.drompincen.synapsehub.runtime.cursor.SshContextCache;
import io.github.drompincen.synapsehub.runtime.error.BusinessLogicException;
import io.github.drompincen.synapsehub.runtime.error.NotFoundException;
import io.github.drompincen.synapsehub.runtime.event.HubEventPublisher;
import io.github.drompincen.synapsehub.runtime.event.TaskAction;
import io.github.drompincen.synapsehub.runtime.message.MessageService;
import io.github.drompincen.synapsehub.runtime.task.TaskService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WorkflowCoordinatorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private TaskService taskService;

    @Mock
    private MessageService messageService;

    @Mock
    private CursorCommandQueue commandQueue;

    @Mock
    private SshContextCache sshContexts;

    @Mock
    private HubEventPublisher eventPublisher;

    private WorkflowCoordinator coordinator;

    @BeforeEach
    void setUp() {
        coordinator = new WorkflowCoordinator(taskService, messageService, commandQueue, sshContexts, eventPublisher);
    }

    private static TaskDto task(TaskStatus status, TaskTurn turn, String sshHost, String sshUser,
                                Map<String, Map<String, Object>> aiContexts) {
        return new TaskDto("t1", "Refactor parser", "Split the lexer", status, turn, TaskPriority.NORMAL, 5,
                "/srv/app", sshHost, sshUser, NOW, null, null, null, null, 0, 3, aiContexts, NOW, NOW, "alice",
                "alice");
    }

    private static CursorCommandDto command(CommandStatus status, String response, String error, String source) {
        Map<String, Object> metadata = source != null ? Map.of(WorkflowCoordinator.SOURCE_KEY, source) : Map.of();
        return new CursorCommandDto("c1", "t1", CommandType.PROMPT, "prompt", metadata, status, NOW, NOW, NOW,
                response, error, 0, 3, 300, null);
    }

    private static BusinessLogicException conflict() {
        return new BusinessLogicException("Task t1 was modified concurrently, retry the request",
                TaskService.RULE_CONCURRENT_UPDATE);
    }

    private static CursorCommandDto queued() {
        return command(CommandStatus.QUEUED, null, null, WorkflowCoordinator.ACTOR);
    }

    @Test
    void registersWithBothEventSources() {
        coordinator.init();

        verify(eventPublisher).addListener(coordinator);
        verify(commandQueue).addListener(coordinator);
    }

    @Test
    void cursorTurnQueuesLatestUserMessageAsPrompt() {
        MessageDto latest = new MessageDto("m1", "t1", 1, "Please split the lexer", MessageSender.USER, null, NOW,
                "alice");
        when(messageService.latestBySender("t1", MessageSender.USER)).thenReturn(Optional.of(latest));
        when(commandQueue.enqueue(any(CommandSpec.class))).thenReturn(queued());

        coordinator.onTurnAdvanced(task(TaskStatus.PROCESSING_CURSOR, TaskTurn.CURSOR, null, null, Map.of()),
                TaskTurn.USER);

        ArgumentCaptor<CommandSpec> spec = ArgumentCaptor.forClass(CommandSpec.class);
        verify(commandQueue).enqueue(spec.capture());
        assertThat(spec.getValue().content()).isEqualTo("Please split the lexer");
        assertThat(spec.getValue().commandType()).isEqualTo(CommandType.PROMPT);
        assertThat(spec.getValue().metadata()).containsEntry(WorkflowCoordinator.SOURCE_KEY, WorkflowCoordinator.ACTOR);
        assertThat(spec.getValue().sshContext()).isNull();
    }

    @Test
    void startedTaskWithoutMessagesPromptsWithDescription() {
        when(messageService.latestBySender("t1", MessageSender.USER)).thenReturn(Optional.empty());
        when(commandQueue.enqueue(any(CommandSpec.class))).thenReturn(queued());

        coordinator.onTurnAdvanced(task(TaskStatus.PROCESSING_CURSOR, TaskTurn.CURSOR, "build-01", "ci", Map.of()),
                TaskTurn.USER);

        ArgumentCaptor<CommandSpec> spec = ArgumentCaptor.forClass(CommandSpec.class);
        verify(commandQueue).enqueue(spec.capture());
        assertThat(spec.getValue().content()).isEqualTo("Split the lexer");
        SshContextDto ssh = spec.getValue().sshContext();
        assertThat(ssh.host()).isEqualTo("build-01");
        assertThat(ssh.username()).isEqualTo("ci");
        assertThat(ssh.workingDirectory()).isEqualTo("/srv/app");
        assertThat(ssh.port()).isEqualTo(22);
    }

    @Test
    void registeredSshContextFromAiContextWins() {
        SshContextDto registered = new SshContextDto("jump-02", 2222, "deploy", null, "/opt", Map.of(), 30,
                null, false);
        when(sshContexts.get("prod")).thenReturn(Optional.of(registered));

        SshContextDto resolved = coordinator.resolveSshContext(task(TaskStatus.PROCESSING_CURSOR, TaskTurn.CURSOR,
                "build-01", "ci", Map.of("cursor", Map.of(WorkflowCoordinator.SSH_CONTEXT_KEY, "prod"))));

        assertThat(resolved).isSameAs(registered);
    }

    @Test
    void otherTurnsAreIgnored() {
        coordinator.onTurnAdvanced(task(TaskStatus.PROCESSING_GEMINI, TaskTurn.GEMINI, null, null, Map.of()),
                TaskTurn.USER);

        verifyNoInteractions(commandQueue, messageService);
    }

    @Test
    void fullQueueFailsTheTask() {
        when(messageService.latestBySender("t1", MessageSender.USER)).thenReturn(Optional.empty());
        when(commandQueue.enqueue(any(CommandSpec.class)))
                .thenThrow(new BusinessLogicException("Command queue is full (1000)", "command_queue_capacity"));

        coordinator.onTurnAdvanced(task(TaskStatus.PROCESSING_CURSOR, TaskTurn.CURSOR, null, null, Map.of()),
                TaskTurn.USER);

        verify(taskService).fail(eq("t1"), contains("queue is full"), eq(WorkflowCoordinator.ACTOR));
    }

    @Test
    void completedCommandBecomesCursorMessage() {
        coordinator.onCompleted(command(CommandStatus.COMPLETED, "Lexer split into two classes", null,
                WorkflowCoordinator.ACTOR));

        verify(messageService).createMessage("t1", "Lexer split into two classes", MessageSender.CURSOR, null,
                WorkflowCoordinator.ACTOR);
    }

    @Test
    void commandsFromOtherSourcesAreLeftAlone() {
        coordinator.onCompleted(command(CommandStatus.COMPLETED, "ok", null, null));
        coordinator.onFailed(command(CommandStatus.FAILED, null, "boom", "api"));

        verifyNoInteractions(messageService, taskService);
    }

    @Test
    void lateResultOnClosedTaskIsDropped() {
        when(messageService.createMessage(anyString(), anyString(), any(), any(), anyString()))
                .thenThrow(new BusinessLogicException("Task is cancelled", "task_closed"));

        coordinator.onCompleted(command(CommandStatus.COMPLETED, "done", null, WorkflowCoordinator.ACTOR));

        verifyNoInteractions(taskService);
    }

    @Test
    void exhaustedCommandFailsTask() {
        coordinator.onFailed(command(CommandStatus.FAILED, null, "Command timed out after 300 seconds",
                WorkflowCoordinator.ACTOR));

        verify(taskService).fail("t1", "Command timed out after 300 seconds", WorkflowCoordinator.ACTOR);
    }

    @Test
    void connectorStatusIsBroadcastAsAgentStatus() {
        coordinator.onStatusChanged(CursorStatus.CONNECTING, CursorStatus.CONNECTED, null);

        verify(eventPublisher).agentStatus("cursor", "connected", Map.of("previous", "connecting"));
    }

    @Test
    void removedTaskCancelsItsCommands() {
        when(commandQueue.cancelForTask("t1")).thenReturn(2);

        coordinator.onTaskChanged(task(TaskStatus.COMPLETED, TaskTurn.USER, null, null, Map.of()), TaskAction.PURGED);
        coordinator.onTaskChanged(task(TaskStatus.COMPLETED, TaskTurn.USER, null, null, Map.of()), TaskAction.UPDATED);

        verify(commandQueue, times(1)).cancelForTask("t1");
    }

    @Test
    void failingTaskRetriesAfterConcurrentUpdate() {
        when(taskService.fail("t1", "boom", WorkflowCoordinator.ACTOR))
                .thenThrow(conflict())
                .thenReturn(task(TaskStatus.FAILED, TaskTurn.CURSOR, null, null, Map.of()));

        coordinator.onFailed(command(CommandStatus.FAILED, null, "boom", WorkflowCoordinator.ACTOR));

        verify(taskService, times(2)).fail("t1", "boom", WorkflowCoordinator.ACTOR);
    }

    @Test
    void failingTaskGivesUpAfterBoundedAttempts() {
        when(taskService.fail("t1", "boom", WorkflowCoordinator.ACTOR)).thenThrow(conflict());

        coordinator.onFailed(command(CommandStatus.FAILED, null, "boom", WorkflowCoordinator.ACTOR));

        verify(taskService, times(WorkflowCoordinator.MAX_WRITE_ATTEMPTS)).fail("t1", "boom", WorkflowCoordinator.ACTOR);
    }

    @Test
    void cursorResultIsRecordedAgainAfterConcurrentUpdate() {
        MessageDto recorded = new MessageDto("m2", "t1", 2, "done", MessageSender.CURSOR, null, NOW,
                WorkflowCoordinator.ACTOR);
        when(messageService.createMessage("t1", "done", MessageSender.CURSOR, null, WorkflowCoordinator.ACTOR))
                .thenThrow(conflict())
                .thenReturn(recorded);

        coordinator.onCompleted(command(CommandStatus.COMPLETED, "done", null, WorkflowCoordinator.ACTOR));

        verify(messageService, times(2)).createMessage("t1", "done", MessageSender.CURSOR, null,
                WorkflowCoordinator.ACTOR);
        verifyNoInteractions(taskService);
    }

    @Test
    void unrecordableCursorResultFailsTask() {
        when(messageService.createMessage(anyString(), anyString(), any(), any(), anyString()))
                .thenThrow(new BusinessLogicException("cursor cannot send a message during the user turn",
                        "invalid_sender_for_turn"));

        coordinator.onCompleted(command(CommandStatus.COMPLETED, "done", null, WorkflowCoordinator.ACTOR));

        verify(messageService, times(1)).createMessage(anyString(), anyString(), any(), any(), anyString());
        verify(taskService).fail(eq("t1"), contains("could not be recorded"), eq(WorkflowCoordinator.ACTOR));
    }

    @Test
    void cursorResultForRemovedTaskIsDropped() {
        when(messageService.createMessage(anyString(), anyString(), any(), any(), anyString()))
                .thenThrow(new NotFoundException("Task", "t1"));

        coordinator.onCompleted(command(CommandStatus.COMPLETED, "done", null, WorkflowCoordinator.ACTOR));

        verifyNoInteractions(taskService);
    }
}
