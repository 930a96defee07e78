package io.github.drompincen.synapsehub.runtime.cursor;

import io.github.drompincen.synapsehub.protocol.cursor.AgentRegistrationRequest;
import io.github.drompincen.synapsehub.protocol.cursor.AgentStatusRequest;
import io.github.drompincen.synapsehub.protocol.cursor.CursorAgentDto;
import io.github.drompincen.synapsehub.runtime.error.NotFoundException;
import io.github.drompincen.synapsehub.runtime.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Connector agents known to the hub. An agent is live while its last registration or heartbeat is
 * younger than {@link CursorProperties#effectiveAgentStaleAfter()}.
 */
@Component
public class CursorAgentRegistry {

    private static final Logger log = LoggerFactory.getLogger(CursorAgentRegistry.class);

    private record Agent(String agentId, String version, String hostname, List<String> capabilities,
                         String status, Instant registeredAt, Instant lastSeen) {}

    private final Map<String, Agent> agents = new ConcurrentHashMap<>();
    private final CursorProperties properties;
    private final Clock clock;

    public CursorAgentRegistry(CursorProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public CursorAgentDto register(String agentId, AgentRegistrationRequest req) {
        if (agentId == null || agentId.isBlank()) throw new ValidationException("agent id is required", "agent_id");
        Instant now = clock.instant();
        AgentRegistrationRequest r = req != null ? req : new AgentRegistrationRequest(null, null, null);
        Agent agent = new Agent(agentId, r.version(), r.hostname(),
                r.capabilities() != null ? List.copyOf(r.capabilities()) : List.of(), "ready", now, now);
        agents.put(agentId, agent);
        log.info("Cursor agent {} registered (version {}, host {})", agentId, r.version(), r.hostname());
        return toDto(agent, now);
    }

    public CursorAgentDto heartbeat(String agentId, AgentStatusRequest req) {
        Instant now = clock.instant();
        Agent updated = agents.computeIfPresent(agentId, (id, a) -> new Agent(a.agentId(), a.version(), a.hostname(),
                a.capabilities(), req != null && req.status() != null ? req.status() : a.status(),
                a.registeredAt(), now));
        if (updated == null) throw new NotFoundException("Cursor agent", agentId);
        return toDto(updated, now);
    }

    public boolean unregister(String agentId) {
        boolean removed = agents.remove(agentId) != null;
        if (removed) log.info("Cursor agent {} unregistered", agentId);
        return removed;
    }

    public boolean isRegistered(String agentId) {
        return agents.containsKey(agentId);
    }

    public List<CursorAgentDto> list() {
        Instant now = clock.instant();
        return agents.values().stream()
                .sorted(Comparator.comparing(Agent::agentId))
                .map(a -> toDto(a, now))
                .toList();
    }

    public int liveCount() {
        Instant now = clock.instant();
        return (int) agents.values().stream().filter(a -> isLive(a, now)).count();
    }

    /** Most recent sighting among live agents; empty when none is live. */
    public Optional<Instant> freshestLiveSighting() {
        Instant now = clock.instant();
        return agents.values().stream()
                .filter(a -> isLive(a, now))
                .map(Agent::lastSeen)
                .max(Comparator.naturalOrder());
    }

    void clear() {
        agents.clear();
    }

    private boolean isLive(Agent agent, Instant now) {
        return !agent.lastSeen().plus(properties.effectiveAgentStaleAfter()).isBefore(now);
    }

    private CursorAgentDto toDto(Agent a, Instant now) {
        return new CursorAgentDto(a.agentId(), a.version(), a.hostname(), a.capabilities(), a.status(),
                a.registeredAt(), a.lastSeen(), isLive(a, now));
    }
}
