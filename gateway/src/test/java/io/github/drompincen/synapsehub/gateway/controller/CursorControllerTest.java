package io.github.drompincen.synapsehub.gateway.controller;

import io.github.drompincen.synapsehub.protocol.api.TaskStatus;
import io.github.drompincen.synapsehub.protocol.cursor.CommandStatus;
import io.github.drompincen.synapsehub.protocol.cursor.CommandType;
import io.github.drompincen.synapsehub.protocol.cursor.CursorCommandDto;
import io.github.drompincen.synapsehub.protocol.cursor.CursorStatus;
import io.github.drompincen.synapsehub.protocol.cursor.SubmitCommandRequest;
import io.github.drompincen.synapsehub.runtime.cursor.CursorCommandQueue;
import io.github.drompincen.synapsehub.runtime.cursor.SshContextCache;
import io.github.drompincen.synapsehub.runtime.error.NotFoundException;
import io.github.drompincen.synapsehub.runtime.task.TaskService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CursorControllerTest {

    @Mock private CursorCommandQueue commandQueue;
    @Mock private SshContextCache sshContexts;
    @Mock private TaskService taskService;

    private CursorController controller;

    @BeforeEach
    void setUp() {
        controller = new CursorController(commandQueue, sshContexts, taskService);
    }

    private static CursorCommandDto command(String id, CommandStatus status) {
        return new CursorCommandDto(id, "T1", CommandType.PROMPT, "fix it", Map.of(), status,
                Instant.parse("2025-03-01T10:00:00Z"), null, null, null, null, 0, 3, 300, null);
    }

    @Test
    void submitChecksTaskAndReturns202() {
        SubmitCommandRequest req = new SubmitCommandRequest(null, "fix it", null, null, null, null);
        when(taskService.get("T1")).thenReturn(TaskControllerTest.task("T1", TaskStatus.PENDING));
        when(commandQueue.submit("T1", req)).thenReturn(command("C1", CommandStatus.QUEUED));

        ResponseEntity<CursorCommandDto> response = controller.submit("T1", req);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(response.getBody().status()).isEqualTo(CommandStatus.QUEUED);
    }

    @Test
    void submitForUnknownTaskNeverQueues() {
        when(taskService.get("T9")).thenThrow(new NotFoundException("Task", "T9"));

        assertThatThrownBy(() -> controller.submit("T9",
                new SubmitCommandRequest(null, "fix it", null, null, null, null)))
                .isInstanceOf(NotFoundException.class);
        verifyNoInteractions(commandQueue);
    }

    @Test
    void unknownCommandStatusIsNotFound() {
        when(commandQueue.getCommand("C9")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> controller.commandStatus("C9")).isInstanceOf(NotFoundException.class);
    }

    @Test
    void cancelReportsOutcome() {
        when(commandQueue.getCommand("C1")).thenReturn(Optional.of(command("C1", CommandStatus.CANCELLED)));
        when(commandQueue.cancel("C1")).thenReturn(false);

        Map<String, Object> body = controller.cancel("C1");

        assertThat(body).containsEntry("command_id", "C1").containsEntry("cancelled", false);
    }

    @Test
    void statusSummarizesQueue() {
        when(commandQueue.status()).thenReturn(CursorStatus.CONNECTED);
        when(commandQueue.isRunning()).thenReturn(true);
        when(commandQueue.queueSize()).thenReturn(2);
        when(commandQueue.activeCount()).thenReturn(1);
        when(sshContexts.size()).thenReturn(0);
        when(commandQueue.lastError()).thenReturn(Optional.empty());

        Map<String, Object> body = controller.status();

        assertThat(body).containsEntry("status", CursorStatus.CONNECTED)
                .containsEntry("queue_size", 2)
                .containsEntry("active_commands", 1);
    }

    @Test
    void removingUnknownSshContextIsNotFound() {
        when(sshContexts.remove("prod")).thenReturn(false);

        assertThatThrownBy(() -> controller.removeSshContext("prod")).isInstanceOf(NotFoundException.class);
    }
}
