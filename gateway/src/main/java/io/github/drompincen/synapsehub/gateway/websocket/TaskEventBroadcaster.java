package io.github.drompincen.synapsehub.gateway.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.synapsehub.protocol.api.MessageDto;
import io.github.drompincen.synapsehub.protocol.api.TaskDto;
import io.github.drompincen.synapsehub.protocol.ws.WsMessage;
import io.github.drompincen.synapsehub.protocol.ws.WsMessageType;
import io.github.drompincen.synapsehub.runtime.event.HubEventListener;
import io.github.drompincen.synapsehub.runtime.event.HubEventPublisher;
import io.github.drompincen.synapsehub.runtime.event.TaskAction;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Turns committed hub events into WebSocket traffic. Task updates go to {@code tasks:{id}} and
 * {@code tasks}; new messages to {@code tasks:{taskId}}; connector status to every connection.
 */
@Component
public class TaskEventBroadcaster implements HubEventListener {

    private static final Logger log = LoggerFactory.getLogger(TaskEventBroadcaster.class);

    static final String TASKS = "tasks";

    private final HubEventPublisher eventPublisher;
    private final WebSocketConnectionManager connections;
    private final ObjectMapper objectMapper;

    public TaskEventBroadcaster(HubEventPublisher eventPublisher,
                                WebSocketConnectionManager connections,
                                ObjectMapper objectMapper) {
        this.eventPublisher = eventPublisher;
        this.connections = connections;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        eventPublisher.addListener(this);
    }

    @PreDestroy
    public void shutdown() {
        eventPublisher.removeListener(this);
    }

    @Override
    public void onTaskChanged(TaskDto task, TaskAction action) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("task_id", task.id());
        data.put("action", action.value());
        data.set("task", objectMapper.valueToTree(task));
        int delivered = connections.broadcastToTopics(
                List.of(WsMessage.topic(TASKS, task.id()), TASKS), WsMessage.of(WsMessageType.TASK_UPDATE, data), null);
        log.debug("task_update {} for {} delivered to {} connection(s)", action.value(), task.id(), delivered);

        if ((action == TaskAction.COMPLETED || action == TaskAction.FAILED) && task.createdBy() != null) {
            ObjectNode note = objectMapper.createObjectNode();
            note.put("task_id", task.id());
            note.put("title", action == TaskAction.COMPLETED ? "Task completed" : "Task failed");
            note.put("message", action == TaskAction.COMPLETED
                    ? "Task '" + task.title() + "' completed"
                    : "Task '" + task.title() + "' failed: " + task.errorMessage());
            note.put("level", action == TaskAction.COMPLETED ? "info" : "error");
            connections.sendToUser(task.createdBy(), WsMessage.of(WsMessageType.NOTIFICATION, note));
        }
    }

    @Override
    public void onMessageCreated(MessageDto message) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("task_id", message.taskId());
        data.set("message", objectMapper.valueToTree(message));
        connections.broadcastToTopic(WsMessage.topic(TASKS, message.taskId()),
                WsMessage.of(WsMessageType.NEW_MESSAGE, data), null);
    }

    @Override
    public void onAgentStatus(String agent, String status, Map<String, Object> details) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("agent", agent);
        data.put("status", status);
        data.set("details", objectMapper.valueToTree(details != null ? details : Map.of()));
        connections.broadcastToAll(WsMessage.of(WsMessageType.AGENT_STATUS, data), false);
    }

    @Override
    public void onError(Throwable t) {
        log.error("Hub event could not be broadcast", t);
    }
}
