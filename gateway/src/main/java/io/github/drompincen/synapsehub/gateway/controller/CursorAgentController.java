package io.github.drompincen.synapsehub.gateway.controller;

import io.github.drompincen.synapsehub.protocol.cursor.AgentRegistrationRequest;
import io.github.drompincen.synapsehub.protocol.cursor.AgentStatusRequest;
import io.github.drompincen.synapsehub.protocol.cursor.CommandResultRequest;
import io.github.drompincen.synapsehub.protocol.cursor.CursorAgentDto;
import io.github.drompincen.synapsehub.protocol.cursor.CursorCommandDto;
import io.github.drompincen.synapsehub.runtime.cursor.AgentOutbox;
import io.github.drompincen.synapsehub.runtime.cursor.CursorAgentRegistry;
import io.github.drompincen.synapsehub.runtime.cursor.CursorCommandQueue;
import io.github.drompincen.synapsehub.runtime.error.NotFoundException;
import io.github.drompincen.synapsehub.runtime.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Polling contract for external connector agents: register, heartbeat through status updates,
 * collect dispatched commands and report their results.
 */
@RestController
@RequestMapping("/api/cursor/agents")
public class CursorAgentController {

    private static final Logger log = LoggerFactory.getLogger(CursorAgentController.class);

    private final CursorAgentRegistry registry;
    private final AgentOutbox outbox;
    private final CursorCommandQueue commandQueue;

    public CursorAgentController(CursorAgentRegistry registry, AgentOutbox outbox, CursorCommandQueue commandQueue) {
        this.registry = registry;
        this.outbox = outbox;
        this.commandQueue = commandQueue;
    }

    @PostMapping("/{agentId}/register")
    public ResponseEntity<CursorAgentDto> register(@PathVariable String agentId,
                                                   @RequestBody(required = false) AgentRegistrationRequest req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(registry.register(agentId, req));
    }

    @PutMapping("/{agentId}/status")
    public CursorAgentDto status(@PathVariable String agentId,
                                 @RequestBody(required = false) AgentStatusRequest req) {
        return registry.heartbeat(agentId, req);
    }

    @GetMapping("/{agentId}/commands")
    public List<CursorCommandDto> poll(@PathVariable String agentId,
                                       @RequestParam(defaultValue = "1") int max) {
        return outbox.poll(agentId, max);
    }

    @PostMapping("/{agentId}/commands/{commandId}/result")
    public Map<String, Object> result(@PathVariable String agentId, @PathVariable String commandId,
                                      @RequestBody CommandResultRequest req) {
        if (req == null) throw new ValidationException("request body is required");
        if (!registry.isRegistered(agentId)) throw new NotFoundException("Cursor agent", agentId);
        boolean accepted = req.success() && req.error() == null
                ? commandQueue.completeCommand(commandId, req.response())
                : commandQueue.failCommand(commandId, req.error() != null ? req.error() : "Command failed");
        if (!accepted) log.info("Agent {} reported on inactive command {}", agentId, commandId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("command_id", commandId);
        body.put("accepted", accepted);
        return body;
    }

    @DeleteMapping("/{agentId}")
    public ResponseEntity<Void> unregister(@PathVariable String agentId) {
        if (!registry.unregister(agentId)) throw new NotFoundException("Cursor agent", agentId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping
    public List<CursorAgentDto> list() {
        return registry.list();
    }
}
