package io.github.drompincen.synapsehub.runtime.cursor;

import io.github.drompincen.synapsehub.protocol.cursor.SshContextDto;
import io.github.drompincen.synapsehub.protocol.cursor.SshContextRequest;
import io.github.drompincen.synapsehub.runtime.error.ConfigurationException;
import io.github.drompincen.synapsehub.runtime.error.NotFoundException;
import io.github.drompincen.synapsehub.runtime.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remote development targets keyed by a caller-chosen id. Entries are immutable records, so a
 * command holding one keeps its copy even after the entry is replaced or removed.
 */
@Component
public class SshContextCache {

    private static final Logger log = LoggerFactory.getLogger(SshContextCache.class);
    private static final int DEFAULT_PORT = 22;
    private static final int DEFAULT_CONNECTION_TIMEOUT = 30;

    private final Map<String, SshContextDto> contexts = new ConcurrentHashMap<>();
    private final CursorProperties properties;
    private final SshConnectivityProbe probe;
    private final Clock clock;

    public SshContextCache(CursorProperties properties, SshConnectivityProbe probe, Clock clock) {
        this.properties = properties;
        this.probe = probe;
        this.clock = clock;
    }

    public SshContextDto add(String contextId, SshContextRequest req) {
        if (!properties.isEnableSshContext()) {
            throw new ConfigurationException("SSH context support is disabled", "synapsehub.cursor.enable-ssh-context");
        }
        if (contextId == null || contextId.isBlank()) throw new ValidationException("context id is required", "context_id");
        if (req == null || req.host() == null || req.host().isBlank()) throw new ValidationException("host is required", "host");
        if (req.username() == null || req.username().isBlank()) {
            throw new ValidationException("username is required", "username");
        }
        int port = req.port() != null ? req.port() : DEFAULT_PORT;
        if (port < 1 || port > 65535) throw new ValidationException("port must be within 1..65535", "port");
        int timeout = req.connectionTimeout() != null ? req.connectionTimeout() : DEFAULT_CONNECTION_TIMEOUT;
        if (timeout < 1) throw new ValidationException("connection_timeout must be positive", "connection_timeout");

        SshContextDto context = new SshContextDto(req.host().trim(), port, req.username().trim(), req.keyPath(),
                req.workingDirectory(), req.environmentVars() != null ? Map.copyOf(req.environmentVars()) : Map.of(),
                timeout, null, false);
        contexts.put(contextId, context);
        log.info("Registered SSH context {} for {}@{}:{}", contextId, context.username(), context.host(), port);
        return context;
    }

    public Optional<SshContextDto> get(String contextId) {
        return Optional.ofNullable(contexts.get(contextId));
    }

    public SshContextDto require(String contextId) {
        return get(contextId).orElseThrow(() -> new NotFoundException("SSH context", contextId));
    }

    public Map<String, SshContextDto> list() {
        return new TreeMap<>(contexts);
    }

    /** Probes the target and records the outcome. The probe runs without holding any entry. */
    public SshContextDto verify(String contextId) {
        SshContextDto current = require(contextId);
        Duration timeout = properties.getSshProbeTimeout();
        boolean reachable = probe.isReachable(current.host(), current.port(), timeout);
        if (!reachable) {
            log.warn("SSH context {} unreachable at {}:{}", contextId, current.host(), current.port());
        }
        SshContextDto updated = contexts.computeIfPresent(contextId, (id, ctx) -> new SshContextDto(ctx.host(),
                ctx.port(), ctx.username(), ctx.keyPath(), ctx.workingDirectory(), ctx.environmentVars(),
                ctx.connectionTimeout(), clock.instant(), reachable));
        if (updated == null) throw new NotFoundException("SSH context", contextId);
        return updated;
    }

    public boolean remove(String contextId) {
        boolean removed = contexts.remove(contextId) != null;
        if (removed) log.info("Removed SSH context {}", contextId);
        return removed;
    }

    public int size() {
        return contexts.size();
    }

    void clear() {
        contexts.clear();
    }
}
