package io.github.drompincen.synapsehub.gateway.controller;

import io.github.drompincen.synapsehub.persistence.repository.TaskQuery;
import io.github.drompincen.synapsehub.protocol.api.CreateTaskRequest;
import io.github.drompincen.synapsehub.protocol.api.TaskDto;
import io.github.drompincen.synapsehub.protocol.api.TaskPage;
import io.github.drompincen.synapsehub.protocol.api.TaskPriority;
import io.github.drompincen.synapsehub.protocol.api.TaskStatus;
import io.github.drompincen.synapsehub.protocol.api.TaskTurn;
import io.github.drompincen.synapsehub.protocol.api.UpdateTaskRequest;
import io.github.drompincen.synapsehub.runtime.error.ValidationException;
import io.github.drompincen.synapsehub.runtime.task.TaskService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/tasks")
public class TaskController {

    private final TaskService taskService;

    public TaskController(TaskService taskService) {
        this.taskService = taskService;
    }

    @PostMapping
    public ResponseEntity<TaskDto> create(@RequestBody CreateTaskRequest req,
                                          @RequestHeader(value = Actors.HEADER, required = false) String userId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(taskService.create(req, Actors.of(userId)));
    }

    @GetMapping
    public TaskPage list(@RequestParam(defaultValue = "0") int skip,
                         @RequestParam(defaultValue = "20") int limit,
                         @RequestParam(name = "sort_by", defaultValue = "created_at") String sortBy,
                         @RequestParam(name = "sort_order", defaultValue = "desc") String sortOrder,
                         @RequestParam(name = "search_term", required = false) String searchTerm,
                         @RequestParam(required = false) TaskStatus status,
                         @RequestParam(required = false) TaskPriority priority,
                         @RequestParam(name = "current_turn", required = false) TaskTurn currentTurn,
                         @RequestParam(name = "is_remote_ssh", required = false) Boolean remoteSsh,
                         @RequestParam(name = "created_by", required = false) String createdBy,
                         @RequestParam(name = "created_after", required = false)
                         @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant createdAfter,
                         @RequestParam(name = "created_before", required = false)
                         @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant createdBefore,
                         @RequestParam(name = "include_deleted", defaultValue = "false") boolean includeDeleted) {
        return taskService.list(new TaskQuery(searchTerm, status, priority, currentTurn, remoteSsh, createdBy,
                createdAfter, createdBefore, includeDeleted, sortBy, descending(sortOrder), skip, limit));
    }

    @GetMapping("/{taskId}")
    public TaskDto get(@PathVariable String taskId) {
        return taskService.get(taskId);
    }

    @PutMapping("/{taskId}")
    public TaskDto update(@PathVariable String taskId, @RequestBody UpdateTaskRequest patch,
                          @RequestHeader(value = Actors.HEADER, required = false) String userId) {
        return taskService.update(taskId, patch, Actors.of(userId));
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<Void> delete(@PathVariable String taskId,
                                       @RequestParam(name = "soft_delete", defaultValue = "true") boolean softDelete,
                                       @RequestHeader(value = Actors.HEADER, required = false) String userId) {
        taskService.delete(taskId, Actors.of(userId), softDelete);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{taskId}/start")
    public TaskDto start(@PathVariable String taskId,
                         @RequestHeader(value = Actors.HEADER, required = false) String userId) {
        return taskService.start(taskId, Actors.of(userId));
    }

    @PostMapping("/{taskId}/complete")
    public TaskDto complete(@PathVariable String taskId,
                            @RequestHeader(value = Actors.HEADER, required = false) String userId) {
        return taskService.complete(taskId, Actors.of(userId));
    }

    @PostMapping("/{taskId}/fail")
    public TaskDto fail(@PathVariable String taskId,
                        @RequestParam(name = "error_message") String errorMessage,
                        @RequestHeader(value = Actors.HEADER, required = false) String userId) {
        return taskService.fail(taskId, errorMessage, Actors.of(userId));
    }

    @PostMapping("/{taskId}/retry")
    public TaskDto retry(@PathVariable String taskId,
                         @RequestHeader(value = Actors.HEADER, required = false) String userId) {
        return taskService.retry(taskId, Actors.of(userId));
    }

    @PostMapping("/{taskId}/cancel")
    public TaskDto cancel(@PathVariable String taskId,
                          @RequestHeader(value = Actors.HEADER, required = false) String userId) {
        return taskService.cancel(taskId, Actors.of(userId));
    }

    @PutMapping("/{taskId}/ai-context/{agent}")
    public TaskDto updateAiContext(@PathVariable String taskId, @PathVariable String agent,
                                   @RequestBody Map<String, Object> context,
                                   @RequestHeader(value = Actors.HEADER, required = false) String userId) {
        return taskService.updateAiContext(taskId, agent, context, Actors.of(userId));
    }

    static boolean descending(String sortOrder) {
        if ("desc".equalsIgnoreCase(sortOrder)) return true;
        if ("asc".equalsIgnoreCase(sortOrder)) return false;
        throw new ValidationException("sort_order must be asc or desc", "sort_order");
    }
}
