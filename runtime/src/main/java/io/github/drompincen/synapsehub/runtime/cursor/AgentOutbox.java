package io.github.drompincen.synapsehub.runtime.cursor;

import io.github.drompincen.synapsehub.protocol.cursor.CursorCommandDto;
import io.github.drompincen.synapsehub.runtime.error.NotFoundException;
import io.github.drompincen.synapsehub.runtime.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/** Dispatcher for polling agents: dispatched commands wait here, in order, until an agent collects them. */
@Component
public class AgentOutbox implements CursorDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AgentOutbox.class);
    static final int MAX_POLL = 50;

    private final Deque<CursorCommandDto> pending = new ArrayDeque<>();
    private final CursorAgentRegistry registry;

    public AgentOutbox(CursorAgentRegistry registry) {
        this.registry = registry;
    }

    @Override
    public synchronized void dispatch(CursorCommandDto command) {
        pending.addLast(command);
        log.debug("Command {} waiting for agent pickup", command.id());
    }

    @Override
    public synchronized void withdraw(String commandId) {
        pending.removeIf(c -> c.id().equals(commandId));
    }

    @Override
    public synchronized void clear() {
        pending.clear();
    }

    /** Polling also counts as a sign of life for the agent. */
    public List<CursorCommandDto> poll(String agentId, int max) {
        if (max < 1 || max > MAX_POLL) throw new ValidationException("max must be within 1.." + MAX_POLL, "max");
        if (!registry.isRegistered(agentId)) throw new NotFoundException("Cursor agent", agentId);
        registry.heartbeat(agentId, null);
        List<CursorCommandDto> batch = new ArrayList<>();
        synchronized (this) {
            while (batch.size() < max && !pending.isEmpty()) {
                batch.add(pending.pollFirst());
            }
        }
        if (!batch.isEmpty()) log.info("Agent {} collected {} command(s)", agentId, batch.size());
        return batch;
    }

    public synchronized int size() {
        return pending.size();
    }
}
