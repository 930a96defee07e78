package io.github.drompincen.synapsehub.runtime.cursor;

import io.github.drompincen.synapsehub.protocol.cursor.CommandStatus;
import io.github.drompincen.synapsehub.protocol.cursor.CommandType;
import io.github.drompincen.synapsehub.protocol.cursor.CursorCommandDto;
import io.github.drompincen.synapsehub.protocol.cursor.CursorHealthDto;
import io.github.drompincen.synapsehub.protocol.cursor.CursorStatus;
import io.github.drompincen.synapsehub.protocol.cursor.SshContextDto;
import io.github.drompincen.synapsehub.protocol.cursor.SubmitCommandRequest;
import io.github.drompincen.synapsehub.runtime.error.BusinessLogicException;
import io.github.drompincen.synapsehub.runtime.error.ConfigurationException;
import io.github.drompincen.synapsehub.runtime.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Bounded FIFO of commands for the Cursor connector, driven by three loops on one scheduler thread:
 * connection check, heartbeat and processing. All queue tables are guarded by {@code lock};
 * listeners are notified after the lock is released.
 */
@Service
public class CursorCommandQueue implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(CursorCommandQueue.class);

    public static final String RULE_CAPACITY = "command_queue_capacity";

    private final Object lock = new Object();
    private final Deque<CursorCommand> queue = new ArrayDeque<>();
    private final Map<String, CursorCommand> active = new LinkedHashMap<>();
    private final Map<String, CursorCommand> retrying = new LinkedHashMap<>();
    private final Map<String, Instant> retryDue = new LinkedHashMap<>();
    private final Map<String, CursorCommand> finished = new LinkedHashMap<>();
    private final List<ScheduledFuture<?>> loops = new ArrayList<>();
    private final List<CommandLifecycleListener> listeners = new CopyOnWriteArrayList<>();

    private final CursorProperties properties;
    private final SshContextCache sshContexts;
    private final CursorAgentRegistry agents;
    private final CursorDispatcher dispatcher;
    private final RetryBackoffPolicy backoff;
    private final Clock clock;

    private ScheduledExecutorService scheduler;
    private CursorStatus status = CursorStatus.DISCONNECTED;
    private Instant lastHeartbeat;
    private String lastError;
    private boolean running;

    public CursorCommandQueue(CursorProperties properties,
                              SshContextCache sshContexts,
                              CursorAgentRegistry agents,
                              CursorDispatcher dispatcher,
                              Clock clock) {
        properties.validate();
        this.properties = properties;
        this.sshContexts = sshContexts;
        this.agents = agents;
        this.dispatcher = dispatcher;
        this.backoff = RetryBackoffPolicy.from(properties.getRetryBackoff());
        this.clock = clock;
    }

    public void addListener(CommandLifecycleListener listener) {
        listeners.add(listener);
    }

    public void removeListener(CommandLifecycleListener listener) {
        listeners.remove(listener);
    }

    // ---------------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------------

    @Override
    public void start() {
        synchronized (lock) {
            if (running) return;
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "cursor-queue");
                t.setDaemon(true);
                return t;
            });
            loops.add(scheduler.scheduleWithFixedDelay(() -> runLoop("connection", this::connectionCheckOnce),
                    0, properties.getConnectionCheckInterval().toMillis(), TimeUnit.MILLISECONDS));
            loops.add(scheduler.scheduleWithFixedDelay(() -> runLoop("heartbeat", this::heartbeatOnce),
                    properties.getHeartbeatInterval().toMillis(), properties.getHeartbeatInterval().toMillis(),
                    TimeUnit.MILLISECONDS));
            loops.add(scheduler.scheduleWithFixedDelay(() -> runLoop("processing", this::processOnce),
                    properties.getProcessingInterval().toMillis(), properties.getProcessingInterval().toMillis(),
                    TimeUnit.MILLISECONDS));
            running = true;
        }
        log.info("Cursor command queue started (capacity {}, backoff {})",
                properties.getQueueMaxSize(), backoff.strategy());
    }

    /** Cancels the loops, marks every queued, active or backing-off command cancelled and clears all state. */
    @Override
    public void stop() {
        List<Runnable> events = new ArrayList<>();
        int cancelled;
        synchronized (lock) {
            loops.forEach(f -> f.cancel(false));
            loops.clear();
            if (scheduler != null) {
                scheduler.shutdownNow();
                scheduler = null;
            }
            Instant now = clock.instant();
            List<CursorCommand> open = Stream.of(queue.stream(), active.values().stream(), retrying.values().stream())
                    .flatMap(s -> s)
                    .toList();
            open.forEach(c -> c.markFinished(CommandStatus.CANCELLED, "Command queue stopped", now));
            cancelled = open.size();
            queue.clear();
            active.clear();
            retrying.clear();
            retryDue.clear();
            finished.clear();
            dispatcher.clear();
            sshContexts.clear();
            lastHeartbeat = null;
            running = false;
            transition(CursorStatus.DISCONNECTED, "queue stopped", events);
        }
        fire(events);
        log.info("Cursor command queue stopped, {} command(s) cancelled", cancelled);
    }

    @Override
    public boolean isRunning() {
        synchronized (lock) {
            return running;
        }
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isAutoStart();
    }

    private void runLoop(String name, Runnable body) {
        try {
            body.run();
        } catch (Exception e) {
            log.error("Cursor {} loop iteration failed", name, e);
            List<Runnable> events = new ArrayList<>();
            synchronized (lock) {
                lastError = name + " loop: " + e.getMessage();
                transition(CursorStatus.ERROR, lastError, events);
            }
            fire(events);
        }
    }

    // ---------------------------------------------------------------------------
    // Loop bodies, one iteration each
    // ---------------------------------------------------------------------------

    void connectionCheckOnce() {
        List<Runnable> events = new ArrayList<>();
        synchronized (lock) {
            if (status.isReachable()) return;
            Optional<Instant> sighting = agents.freshestLiveSighting();
            if (sighting.isEmpty()) {
                transition(CursorStatus.DISCONNECTED, "no live cursor agent", events);
            } else {
                transition(CursorStatus.CONNECTING, "live cursor agent found", events);
                lastHeartbeat = sighting.get();
                lastError = null;
                transition(active.isEmpty() ? CursorStatus.CONNECTED : CursorStatus.PROCESSING, null, events);
            }
        }
        fire(events);
    }

    void heartbeatOnce() {
        List<Runnable> events = new ArrayList<>();
        synchronized (lock) {
            if (!status.isReachable()) return;
            Optional<Instant> sighting = agents.freshestLiveSighting();
            if (sighting.isPresent()) {
                lastHeartbeat = sighting.get();
                log.debug("Cursor heartbeat refreshed at {}", lastHeartbeat);
            } else {
                transition(active.isEmpty() ? CursorStatus.DISCONNECTED : CursorStatus.TIMEOUT,
                        "cursor agent heartbeat lost", events);
            }
        }
        fire(events);
    }

    void processOnce() {
        List<Runnable> events = new ArrayList<>();
        synchronized (lock) {
            Instant now = clock.instant();
            for (CursorCommand command : new ArrayList<>(active.values())) {
                if (command.isExpired(now)) {
                    finishUnsuccessfully(command, CommandStatus.TIMEOUT,
                            "Command timed out after " + command.timeoutSeconds() + " seconds", now, events);
                }
            }
            requeueDueRetries(now, events);
            pruneFinished(now);

            if (status.isReachable() && !queue.isEmpty()) {
                CursorCommand next = queue.pollFirst();
                next.markProcessing(now);
                active.put(next.id(), next);
                log.info("Dispatching command {} ({}) for task {}", next.id(), next.toDto().commandType().value(),
                        next.taskId());
                try {
                    dispatcher.dispatch(next.toDto());
                } catch (RuntimeException e) {
                    log.warn("Dispatch of command {} failed: {}", next.id(), e.getMessage());
                    finishUnsuccessfully(next, CommandStatus.FAILED, "Dispatch failed: " + e.getMessage(), now, events);
                }
            }
            if (status.isReachable()) {
                transition(active.isEmpty() ? CursorStatus.CONNECTED : CursorStatus.PROCESSING, null, events);
            }
        }
        fire(events);
    }

    // ---------------------------------------------------------------------------
    // Submission and results
    // ---------------------------------------------------------------------------

    public CursorCommandDto submit(String taskId, SubmitCommandRequest req) {
        if (req == null) throw new ValidationException("request body is required");
        SshContextDto context = null;
        if (req.sshContextId() != null && !req.sshContextId().isBlank()) {
            if (!properties.isEnableSshContext()) {
                throw new ConfigurationException("SSH context support is disabled",
                        "synapsehub.cursor.enable-ssh-context");
            }
            context = sshContexts.require(req.sshContextId());
        }
        return enqueue(new CommandSpec(taskId, req.commandType() != null ? req.commandType() : CommandType.PROMPT,
                req.content(), req.metadata(), context, req.maxRetries(), req.timeoutSeconds()));
    }

    public CursorCommandDto enqueue(CommandSpec spec) {
        if (spec.taskId() == null || spec.taskId().isBlank()) throw new ValidationException("task id is required", "task_id");
        if (spec.content() == null || spec.content().isBlank()) {
            throw new ValidationException("Command content cannot be empty", "content");
        }
        int maxRetries = spec.maxRetries() != null ? spec.maxRetries() : properties.getMaxRetries();
        if (maxRetries < 0 || maxRetries > 10) throw new ValidationException("max_retries must be within 0..10", "max_retries");
        long timeout = spec.timeoutSeconds() != null ? spec.timeoutSeconds() : properties.getCommandTimeout().getSeconds();
        if (timeout < 1) throw new ValidationException("timeout_seconds must be positive", "timeout_seconds");

        synchronized (lock) {
            if (queue.size() >= properties.getQueueMaxSize()) {
                throw new BusinessLogicException("Command queue is full (" + queue.size() + ")", RULE_CAPACITY,
                        Map.of("queue_size", queue.size(), "max_size", properties.getQueueMaxSize()));
            }
            CursorCommand command = new CursorCommand(UUID.randomUUID().toString(), spec.taskId(),
                    spec.commandType() != null ? spec.commandType() : CommandType.PROMPT, spec.content(),
                    spec.metadata(), maxRetries, timeout, spec.sshContext(), clock.instant());
            queue.addLast(command);
            log.info("Queued command {} for task {}, type {}", command.id(), spec.taskId(),
                    command.toDto().commandType().value());
            return command.toDto();
        }
    }

    /** @return false when the command is no longer active and the result was discarded */
    public boolean completeCommand(String commandId, String response) {
        List<Runnable> events = new ArrayList<>();
        synchronized (lock) {
            CursorCommand command = active.remove(commandId);
            if (command == null) {
                log.info("Discarding result for inactive command {}", commandId);
                return false;
            }
            command.markCompleted(response, clock.instant());
            finished.put(command.id(), command);
            CursorCommandDto snapshot = command.toDto();
            events.add(notifyAll(l -> l.onCompleted(snapshot)));
            if (active.isEmpty() && status == CursorStatus.PROCESSING) {
                transition(CursorStatus.CONNECTED, null, events);
            }
            log.info("Command {} completed", commandId);
        }
        fire(events);
        return true;
    }

    /** @return false when the command is no longer active and the report was discarded */
    public boolean failCommand(String commandId, String error) {
        List<Runnable> events = new ArrayList<>();
        synchronized (lock) {
            CursorCommand command = active.get(commandId);
            if (command == null) {
                log.info("Discarding failure report for inactive command {}", commandId);
                return false;
            }
            finishUnsuccessfully(command, CommandStatus.FAILED, error != null ? error : "Command failed",
                    clock.instant(), events);
        }
        fire(events);
        return true;
    }

    /** Removes a queued command or marks an active one cancelled. False for unknown or already finished ids. */
    public boolean cancel(String commandId) {
        synchronized (lock) {
            CursorCommand command = takeOpen(commandId);
            if (command == null) return false;
            command.markFinished(CommandStatus.CANCELLED, "Cancelled", clock.instant());
            dispatcher.withdraw(commandId);
            finished.put(commandId, command);
            log.info("Cancelled command {}", commandId);
            return true;
        }
    }

    public int cancelForTask(String taskId) {
        List<String> ids;
        synchronized (lock) {
            ids = Stream.of(queue.stream(), active.values().stream(), retrying.values().stream())
                    .flatMap(s -> s)
                    .filter(c -> c.taskId().equals(taskId))
                    .map(CursorCommand::id)
                    .toList();
        }
        return (int) ids.stream().filter(this::cancel).count();
    }

    // ---------------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------------

    public Optional<CursorCommandDto> getCommand(String commandId) {
        synchronized (lock) {
            return allCommands().filter(c -> c.id().equals(commandId)).findFirst().map(CursorCommand::toDto);
        }
    }

    public List<CursorCommandDto> commandsForTask(String taskId) {
        synchronized (lock) {
            return allCommands().filter(c -> c.taskId().equals(taskId)).map(CursorCommand::toDto).toList();
        }
    }

    public CursorStatus status() {
        synchronized (lock) {
            return status;
        }
    }

    public int queueSize() {
        synchronized (lock) {
            return queue.size();
        }
    }

    public int activeCount() {
        synchronized (lock) {
            return active.size();
        }
    }

    public CursorHealthDto health() {
        synchronized (lock) {
            Instant now = clock.instant();
            int expired = (int) active.values().stream().filter(c -> c.isExpired(now)).count();
            Long age = lastHeartbeat != null ? Duration.between(lastHeartbeat, now).getSeconds() : null;
            boolean heartbeatFresh = lastHeartbeat != null
                    && Duration.between(lastHeartbeat, now).compareTo(properties.getHeartbeatInterval().multipliedBy(2)) < 0;
            return new CursorHealthDto(status, status.isReachable() && heartbeatFresh, queue.size(), active.size(),
                    expired, sshContexts.size(), agents.liveCount(), lastHeartbeat, age);
        }
    }

    public Optional<String> lastError() {
        synchronized (lock) {
            return Optional.ofNullable(lastError);
        }
    }

    // ---------------------------------------------------------------------------
    // Internals, callers hold the lock
    // ---------------------------------------------------------------------------

    private void finishUnsuccessfully(CursorCommand command, CommandStatus outcome, String error,
                                      Instant now, List<Runnable> events) {
        active.remove(command.id());
        dispatcher.withdraw(command.id());
        command.markFinished(outcome, error, now);
        if (command.canRetry()) {
            command.resetForRetry();
            Duration delay = backoff.delayFor(command.retryCount());
            CursorCommandDto snapshot = command.toDto();
            log.warn("Retrying command {} after {}: attempt {}/{} in {}ms", command.id(), outcome.value(),
                    command.retryCount(), snapshot.maxRetries(), delay.toMillis());
            retrying.put(command.id(), command);
            retryDue.put(command.id(), now.plus(delay));
            events.add(notifyAll(l -> l.onRetryScheduled(snapshot, delay)));
            if (delay.isZero()) requeueDueRetries(now, events);
        } else {
            // an exhausted timeout ends as a plain failure so callers see one terminal state
            if (outcome == CommandStatus.TIMEOUT) command.markFinished(CommandStatus.FAILED, error, now);
            finished.put(command.id(), command);
            CursorCommandDto snapshot = command.toDto();
            log.error("Command {} for task {} failed after {} retries: {}", command.id(), command.taskId(),
                    command.retryCount(), error);
            events.add(notifyAll(l -> l.onFailed(snapshot)));
        }
    }

    private void requeueDueRetries(Instant now, List<Runnable> events) {
        Iterator<Map.Entry<String, Instant>> it = retryDue.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Instant> due = it.next();
            if (due.getValue().isAfter(now)) continue;
            it.remove();
            CursorCommand command = retrying.remove(due.getKey());
            if (command == null) continue;
            if (queue.size() >= properties.getQueueMaxSize()) {
                command.markFinished(CommandStatus.FAILED, "Command queue full, retry abandoned", now);
                finished.put(command.id(), command);
                CursorCommandDto snapshot = command.toDto();
                log.error("Command {} dropped from retry: queue full", command.id());
                events.add(notifyAll(l -> l.onFailed(snapshot)));
            } else {
                queue.addLast(command);
            }
        }
    }

    private void pruneFinished(Instant now) {
        Instant cutoff = now.minus(properties.getCompletedRetention());
        finished.values().removeIf(c -> c.completedAt() != null && c.completedAt().isBefore(cutoff));
    }

    private CursorCommand takeOpen(String commandId) {
        for (Iterator<CursorCommand> it = queue.iterator(); it.hasNext(); ) {
            CursorCommand command = it.next();
            if (command.id().equals(commandId)) {
                it.remove();
                return command;
            }
        }
        CursorCommand command = active.remove(commandId);
        if (command != null) return command;
        retryDue.remove(commandId);
        return retrying.remove(commandId);
    }

    private Stream<CursorCommand> allCommands() {
        return Stream.of(active.values().stream(), queue.stream(), retrying.values().stream(),
                finished.values().stream()).flatMap(s -> s);
    }

    private void transition(CursorStatus next, String detail, List<Runnable> events) {
        if (status == next) return;
        CursorStatus previous = status;
        status = next;
        if (detail != null) {
            log.info("Cursor connector {} -> {} ({})", previous.value(), next.value(), detail);
        } else {
            log.info("Cursor connector {} -> {}", previous.value(), next.value());
        }
        events.add(notifyAll(l -> l.onStatusChanged(previous, next, detail)));
    }

    private Runnable notifyAll(Consumer<CommandLifecycleListener> call) {
        return () -> {
            for (CommandLifecycleListener listener : listeners) {
                try {
                    call.accept(listener);
                } catch (Exception e) {
                    log.error("Command lifecycle listener failed", e);
                }
            }
        };
    }

    private static void fire(List<Runnable> events) {
        events.forEach(Runnable::run);
    }
}
