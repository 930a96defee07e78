package io.github.drompincen.synapsehub.runtime.task;

import io.github.drompincen.synapsehub.persistence.document.TaskDocument;
import io.github.drompincen.synapsehub.persistence.repository.TaskQuery;
import io.github.drompincen.synapsehub.persistence.repository.TaskRepository;
import io.github.drompincen.synapsehub.protocol.api.CreateTaskRequest;
import io.github.drompincen.synapsehub.protocol.api.TaskDto;
import io.github.drompincen.synapsehub.protocol.api.TaskPage;
import io.github.drompincen.synapsehub.protocol.api.TaskPriority;
import io.github.drompincen.synapsehub.protocol.api.TaskStatus;
import io.github.drompincen.synapsehub.protocol.api.TaskTurn;
import io.github.drompincen.synapsehub.protocol.api.UpdateTaskRequest;
import io.github.drompincen.synapsehub.runtime.error.BusinessLogicException;
import io.github.drompincen.synapsehub.runtime.error.DuplicateException;
import io.github.drompincen.synapsehub.runtime.error.NotFoundException;
import io.github.drompincen.synapsehub.runtime.error.ValidationException;
import io.github.drompincen.synapsehub.runtime.event.HubEventPublisher;
import io.github.drompincen.synapsehub.runtime.event.TaskAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Task lifecycle. Every status change goes through {@link TaskStatus#canTransitionTo}, except the
 * {@code failed -> pending} edge which only {@link #retry} may take.
 */
@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    static final String RULE_DELETE_PROCESSING = "delete_while_processing";
    static final String RULE_RETRY_LIMIT = "retry_limit_exceeded";
    public static final String RULE_CONCURRENT_UPDATE = "concurrent_task_update";

    private final TaskRepository taskRepository;
    private final HubEventPublisher eventPublisher;
    private final TaskProperties properties;
    private final Clock clock;

    public TaskService(TaskRepository taskRepository,
                       HubEventPublisher eventPublisher,
                       TaskProperties properties,
                       Clock clock) {
        properties.validate();
        this.taskRepository = taskRepository;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    // ---------------------------------------------------------------------------
    // CRUD
    // ---------------------------------------------------------------------------

    public TaskDto create(CreateTaskRequest req, String actor) {
        if (req == null) throw new ValidationException("request body is required");
        String title = TaskFieldValidator.title(req.title());
        TaskFieldValidator.maxLength(req.description(), TaskFieldValidator.DESCRIPTION_MAX, "description");
        TaskFieldValidator.maxLength(req.projectPath(), TaskFieldValidator.PROJECT_PATH_MAX, "project_path");
        String sshHost = TaskFieldValidator.blankToNull(req.sshHost());
        String sshUser = TaskFieldValidator.blankToNull(req.sshUser());
        TaskFieldValidator.sshPair(sshHost, sshUser);
        TaskFieldValidator.estimatedDuration(req.estimatedDuration());
        int maxRetries = req.maxRetries() != null ? req.maxRetries() : properties.getDefaultMaxRetries();
        TaskFieldValidator.maxRetries(maxRetries);

        if (actor != null && taskRepository.existsByTitleAndCreatedByAndDeletedFalse(title, actor)) {
            throw new DuplicateException("Task '" + title + "' already exists for " + actor, "title", title);
        }

        Instant now = clock.instant();
        TaskDocument doc = new TaskDocument();
        doc.setTaskId(UUID.randomUUID().toString());
        doc.setTitle(title);
        doc.setDescription(req.description());
        doc.setPriority(req.priority() != null ? req.priority() : TaskPriority.NORMAL);
        doc.setStatus(TaskStatus.PENDING);
        doc.setCurrentTurn(TaskTurn.USER);
        doc.setProjectPath(req.projectPath());
        doc.setSshHost(sshHost);
        doc.setSshUser(sshUser);
        doc.setEstimatedDuration(req.estimatedDuration());
        doc.setMaxRetries(maxRetries);
        doc.setRetryCount(0);
        doc.setProgress(0);
        doc.setAiContexts(req.aiContexts() != null ? new HashMap<>(req.aiContexts()) : new HashMap<>());
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        doc.setCreatedBy(actor);
        doc.setUpdatedBy(actor);

        TaskDto dto;
        try {
            dto = TaskMapper.toDto(taskRepository.save(doc));
        } catch (DuplicateKeyException e) {
            // lost the race against a concurrent create with the same title
            throw new DuplicateException("Task '" + title + "' already exists for " + actor, "title", title);
        }
        log.info("Task {} created by {}: {}", dto.id(), actor, title);
        eventPublisher.taskChanged(dto, TaskAction.CREATED);
        return dto;
    }

    public TaskDto get(String taskId) {
        return TaskMapper.toDto(loadActive(taskId));
    }

    public TaskPage list(TaskQuery query) {
        if (query.skip() < 0) throw new ValidationException("skip must not be negative", "skip");
        if (query.limit() < 1) throw new ValidationException("limit must be positive", "limit");
        if (query.sortBy() != null && !TaskQuery.sortKeys().contains(query.sortBy())) {
            throw new ValidationException("sort_by must be one of " + TaskQuery.sortKeys(), "sort_by");
        }
        int limit = Math.min(query.limit(), properties.getMaxPageSize());
        TaskQuery capped = new TaskQuery(query.searchTerm(), query.status(), query.priority(), query.currentTurn(),
                query.remoteSsh(), query.createdBy(), query.createdAfter(), query.createdBefore(),
                query.includeDeleted(), query.sortBy() != null ? query.sortBy() : "created_at",
                query.descending(), query.skip(), limit);

        List<TaskDto> tasks = taskRepository.search(capped).stream().map(TaskMapper::toDto).toList();
        long total = taskRepository.countMatching(capped);
        return TaskPage.of(tasks, total, capped.skip(), limit);
    }

    public TaskDto update(String taskId, UpdateTaskRequest patch, String actor) {
        if (patch == null) throw new ValidationException("request body is required");
        TaskDocument doc = loadActive(taskId);
        TaskTurn previousTurn = doc.getCurrentTurn();

        if (patch.title() != null) doc.setTitle(TaskFieldValidator.title(patch.title()));
        if (patch.description() != null) {
            TaskFieldValidator.maxLength(patch.description(), TaskFieldValidator.DESCRIPTION_MAX, "description");
            doc.setDescription(patch.description());
        }
        if (patch.priority() != null) doc.setPriority(patch.priority());
        if (patch.progress() != null) {
            TaskFieldValidator.progress(patch.progress());
            doc.setProgress(patch.progress());
        }
        if (patch.projectPath() != null) {
            TaskFieldValidator.maxLength(patch.projectPath(), TaskFieldValidator.PROJECT_PATH_MAX, "project_path");
            doc.setProjectPath(patch.projectPath());
        }
        if (patch.sshHost() != null || patch.sshUser() != null) {
            // blank clears the pair; a half-specified pair is merged with the stored half
            String host = patch.sshHost() != null ? TaskFieldValidator.blankToNull(patch.sshHost()) : doc.getSshHost();
            String user = patch.sshUser() != null ? TaskFieldValidator.blankToNull(patch.sshUser()) : doc.getSshUser();
            TaskFieldValidator.sshPair(host, user);
            doc.setSshHost(host);
            doc.setSshUser(user);
        }
        if (patch.estimatedDuration() != null) {
            TaskFieldValidator.estimatedDuration(patch.estimatedDuration());
            doc.setEstimatedDuration(patch.estimatedDuration());
        }
        if (patch.aiContexts() != null) {
            Map<String, Map<String, Object>> merged = new HashMap<>(doc.getAiContexts());
            merged.putAll(patch.aiContexts());
            doc.setAiContexts(merged);
        }

        TaskAction action = TaskAction.UPDATED;
        if (patch.status() != null && patch.status() != doc.getStatus()) {
            if (doc.getStatus() == TaskStatus.FAILED && patch.status() == TaskStatus.PENDING) {
                throw new BusinessLogicException("A failed task returns to pending only through retry",
                        TaskTransitions.RULE, TaskTransitions.details(doc.getStatus(), patch.status()));
            }
            action = actionFor(doc.getStatus(), patch.status());
            TaskTransitions.apply(doc, patch.status(), clock.instant());
        }
        return save(doc, previousTurn, actor, action);
    }

    public void delete(String taskId, String actor, boolean soft) {
        TaskDocument doc = taskRepository.findById(taskId)
                .filter(t -> !soft || !t.isDeleted())
                .orElseThrow(() -> new NotFoundException("Task", taskId));
        if (doc.getStatus().isProcessing()) {
            throw new BusinessLogicException("Cannot delete task while " + doc.getStatus().value(),
                    RULE_DELETE_PROCESSING, Map.of("status", doc.getStatus().value()));
        }
        if (soft) {
            doc.setDeleted(true);
            save(doc, doc.getCurrentTurn(), actor, TaskAction.DELETED);
            log.info("Task {} soft-deleted by {}", taskId, actor);
        } else {
            TaskDto last = TaskMapper.toDto(doc);
            taskRepository.delete(doc);
            log.info("Task {} deleted by {}", taskId, actor);
            eventPublisher.taskChanged(last, TaskAction.PURGED);
        }
    }

    // ---------------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------------

    public TaskDto start(String taskId, String actor) {
        TaskDocument doc = loadActive(taskId);
        TaskTurn previousTurn = doc.getCurrentTurn();
        if (doc.getStatus() != TaskStatus.PENDING) {
            throw new BusinessLogicException("Task can only be started from pending, current status is "
                    + doc.getStatus().value(), TaskTransitions.RULE,
                    TaskTransitions.details(doc.getStatus(), TaskStatus.PROCESSING_CURSOR));
        }
        TaskTransitions.apply(doc, TaskStatus.PROCESSING_CURSOR, clock.instant());
        TaskDto dto = save(doc, previousTurn, actor, TaskAction.STARTED);
        log.info("Task {} started", taskId);
        return dto;
    }

    public TaskDto complete(String taskId, String actor) {
        TaskDocument doc = loadActive(taskId);
        TaskTurn previousTurn = doc.getCurrentTurn();
        TaskTransitions.apply(doc, TaskStatus.COMPLETED, clock.instant());
        TaskDto dto = save(doc, previousTurn, actor, TaskAction.COMPLETED);
        log.info("Task {} completed after {}s", taskId, dto.actualDuration());
        return dto;
    }

    public TaskDto fail(String taskId, String reason, String actor) {
        TaskDocument doc = loadActive(taskId);
        TaskTurn previousTurn = doc.getCurrentTurn();
        TaskTransitions.apply(doc, TaskStatus.FAILED, clock.instant());
        doc.setErrorMessage(reason);
        TaskDto dto = save(doc, previousTurn, actor, TaskAction.FAILED);
        log.info("Task {} failed: {}", taskId, reason);
        return dto;
    }

    public TaskDto cancel(String taskId, String actor) {
        TaskDocument doc = loadActive(taskId);
        TaskTurn previousTurn = doc.getCurrentTurn();
        TaskTransitions.apply(doc, TaskStatus.CANCELLED, clock.instant());
        TaskDto dto = save(doc, previousTurn, actor, TaskAction.CANCELLED);
        log.info("Task {} cancelled by {}", taskId, actor);
        return dto;
    }

    public TaskDto retry(String taskId, String actor) {
        TaskDocument doc = loadActive(taskId);
        TaskTurn previousTurn = doc.getCurrentTurn();
        if (doc.getStatus() != TaskStatus.FAILED) {
            throw new BusinessLogicException("Only failed tasks can be retried, current status is "
                    + doc.getStatus().value(), TaskTransitions.RULE,
                    TaskTransitions.details(doc.getStatus(), TaskStatus.PENDING));
        }
        if (doc.getRetryCount() >= doc.getMaxRetries()) {
            throw new BusinessLogicException("Task has used all " + doc.getMaxRetries() + " retries",
                    RULE_RETRY_LIMIT, Map.of("retry_count", doc.getRetryCount(), "max_retries", doc.getMaxRetries()));
        }
        doc.setStatus(TaskStatus.PENDING);
        doc.setCurrentTurn(TaskTurn.USER);
        doc.setRetryCount(doc.getRetryCount() + 1);
        doc.setErrorMessage(null);
        doc.setCompletedAt(null);
        doc.setActualDuration(null);
        doc.setProgress(Math.min(doc.getProgress(), 10));
        TaskDto dto = save(doc, previousTurn, actor, TaskAction.RETRIED);
        log.info("Task {} retry {}/{}", taskId, dto.retryCount(), dto.maxRetries());
        return dto;
    }

    /**
     * Hands the turn to {@code next} together with the status that turn implies. A turn whose status
     * has no edge from the current one is refused, so turn and status never disagree.
     */
    public TaskDto advanceTurn(String taskId, TaskTurn next, String actor) {
        if (next == null) throw new ValidationException("next turn is required", "turn");
        TaskDocument doc = loadActive(taskId);
        TaskTurn previous = doc.getCurrentTurn();
        if (previous == next) {
            throw new BusinessLogicException("Task is already on the " + next.value() + " turn", "turn_unchanged");
        }
        if (doc.getStatus().isTerminal()) {
            throw new BusinessLogicException("Task is " + doc.getStatus().value(), TaskTransitions.RULE,
                    Map.of("status", doc.getStatus().value()));
        }
        TaskStatus derived = statusForTurn(doc.getStatus(), next);
        if (derived == null || !doc.getStatus().canTransitionTo(derived)) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("status", doc.getStatus().value());
            details.put("turn", next.value());
            throw new BusinessLogicException("Task in status " + doc.getStatus().value() + " cannot move to the "
                    + next.value() + " turn", TaskTransitions.RULE, details);
        }
        TaskTransitions.apply(doc, derived, clock.instant());
        return save(doc, previous, actor, TaskAction.UPDATED);
    }

    public TaskDto updateAiContext(String taskId, String agent, Map<String, Object> context, String actor) {
        if (agent == null || agent.isBlank()) throw new ValidationException("agent is required", "agent");
        TaskDocument doc = loadActive(taskId);
        Map<String, Map<String, Object>> contexts = new HashMap<>(doc.getAiContexts());
        contexts.put(agent, context != null ? new LinkedHashMap<>(context) : new LinkedHashMap<>());
        doc.setAiContexts(contexts);
        return save(doc, doc.getCurrentTurn(), actor, TaskAction.UPDATED);
    }

    // ---------------------------------------------------------------------------
    // Internals
    // ---------------------------------------------------------------------------

    TaskDocument loadActive(String taskId) {
        return taskRepository.findById(taskId)
                .filter(t -> !t.isDeleted())
                .orElseThrow(() -> new NotFoundException("Task", taskId));
    }

    private static TaskStatus statusForTurn(TaskStatus current, TaskTurn next) {
        return switch (next) {
            case CURSOR -> TaskStatus.PROCESSING_CURSOR;
            case GEMINI -> TaskStatus.PROCESSING_GEMINI;
            case USER -> current == TaskStatus.PROCESSING_CURSOR ? TaskStatus.AWAITING_USER_GEMINI
                    : current == TaskStatus.PROCESSING_GEMINI ? TaskStatus.AWAITING_USER_CURSOR
                    : null;
        };
    }

    private TaskDto save(TaskDocument doc, TaskTurn previousTurn, String actor, TaskAction action) {
        doc.setUpdatedAt(clock.instant());
        doc.setUpdatedBy(actor);
        TaskDto dto;
        try {
            dto = TaskMapper.toDto(taskRepository.save(doc));
        } catch (OptimisticLockingFailureException e) {
            log.warn("Concurrent update of task {} ({}): {}", doc.getTaskId(), action.value(), e.getMessage());
            throw new BusinessLogicException("Task " + doc.getTaskId() + " was modified concurrently, retry the request",
                    RULE_CONCURRENT_UPDATE);
        }
        eventPublisher.taskChanged(dto, action);
        if (previousTurn != dto.currentTurn()) {
            eventPublisher.turnAdvanced(dto, previousTurn);
        }
        return dto;
    }

    private static TaskAction actionFor(TaskStatus from, TaskStatus to) {
        if (from == TaskStatus.PENDING && to == TaskStatus.PROCESSING_CURSOR) return TaskAction.STARTED;
        return switch (to) {
            case COMPLETED -> TaskAction.COMPLETED;
            case FAILED -> TaskAction.FAILED;
            case CANCELLED -> TaskAction.CANCELLED;
            default -> TaskAction.UPDATED;
        };
    }

}
