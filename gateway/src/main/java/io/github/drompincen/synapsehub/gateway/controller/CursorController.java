package io.github.drompincen.synapsehub.gateway.controller;

import io.github.drompincen.synapsehub.protocol.cursor.CursorCommandDto;
import io.github.drompincen.synapsehub.protocol.cursor.CursorHealthDto;
import io.github.drompincen.synapsehub.protocol.cursor.SshContextDto;
import io.github.drompincen.synapsehub.protocol.cursor.SshContextRequest;
import io.github.drompincen.synapsehub.protocol.cursor.SubmitCommandRequest;
import io.github.drompincen.synapsehub.runtime.cursor.CursorCommandQueue;
import io.github.drompincen.synapsehub.runtime.cursor.SshContextCache;
import io.github.drompincen.synapsehub.runtime.error.NotFoundException;
import io.github.drompincen.synapsehub.runtime.task.TaskService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/** Command queue and SSH context surface used by operators and the task UI. */
@RestController
@RequestMapping("/api/cursor")
public class CursorController {

    private final CursorCommandQueue commandQueue;
    private final SshContextCache sshContexts;
    private final TaskService taskService;

    public CursorController(CursorCommandQueue commandQueue, SshContextCache sshContexts, TaskService taskService) {
        this.commandQueue = commandQueue;
        this.sshContexts = sshContexts;
        this.taskService = taskService;
    }

    @PostMapping("/tasks/{taskId}/command")
    public ResponseEntity<CursorCommandDto> submit(@PathVariable String taskId, @RequestBody SubmitCommandRequest req) {
        taskService.get(taskId);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(commandQueue.submit(taskId, req));
    }

    @GetMapping("/commands/{commandId}/status")
    public CursorCommandDto commandStatus(@PathVariable String commandId) {
        return commandQueue.getCommand(commandId).orElseThrow(() -> new NotFoundException("Command", commandId));
    }

    @DeleteMapping("/commands/{commandId}")
    public Map<String, Object> cancel(@PathVariable String commandId) {
        if (commandQueue.getCommand(commandId).isEmpty()) throw new NotFoundException("Command", commandId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("command_id", commandId);
        body.put("cancelled", commandQueue.cancel(commandId));
        return body;
    }

    @GetMapping("/status")
    public Map<String, Object> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", commandQueue.status());
        body.put("running", commandQueue.isRunning());
        body.put("queue_size", commandQueue.queueSize());
        body.put("active_commands", commandQueue.activeCount());
        body.put("ssh_contexts", sshContexts.size());
        body.put("last_error", commandQueue.lastError().orElse(null));
        return body;
    }

    @GetMapping("/health")
    public CursorHealthDto health() {
        return commandQueue.health();
    }

    // ---------------------------------------------------------------------------
    // SSH contexts
    // ---------------------------------------------------------------------------

    @PostMapping("/ssh-contexts/{contextId}")
    public ResponseEntity<SshContextDto> addSshContext(@PathVariable String contextId,
                                                       @RequestBody SshContextRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(sshContexts.add(contextId, req));
    }

    @GetMapping("/ssh-contexts")
    public Map<String, SshContextDto> listSshContexts() {
        return sshContexts.list();
    }

    @GetMapping("/ssh-contexts/{contextId}")
    public SshContextDto getSshContext(@PathVariable String contextId) {
        return sshContexts.require(contextId);
    }

    @PostMapping("/ssh-contexts/{contextId}/verify")
    public SshContextDto verifySshContext(@PathVariable String contextId) {
        return sshContexts.verify(contextId);
    }

    @DeleteMapping("/ssh-contexts/{contextId}")
    public ResponseEntity<Void> removeSshContext(@PathVariable String contextId) {
        if (!sshContexts.remove(contextId)) throw new NotFoundException("SSH context", contextId);
        return ResponseEntity.noContent().build();
    }
}
