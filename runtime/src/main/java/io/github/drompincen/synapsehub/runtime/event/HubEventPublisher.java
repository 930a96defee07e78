package io.github.drompincen.synapsehub.runtime.event;

import io.github.drompincen.synapsehub.protocol.api.MessageDto;
import io.github.drompincen.synapsehub.protocol.api.TaskDto;
import io.github.drompincen.synapsehub.protocol.api.TaskTurn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fans hub state changes out to in-process listeners on the calling thread, so listeners see
 * events in the order the mutations committed. A failing listener never affects the others.
 */
@Component
public class HubEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(HubEventPublisher.class);

    private final List<HubEventListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(HubEventListener listener) {
        listeners.add(listener);
    }

    public void removeListener(HubEventListener listener) {
        listeners.remove(listener);
    }

    public void taskChanged(TaskDto task, TaskAction action) {
        notifyListeners("task " + action.value() + " " + task.id(), l -> l.onTaskChanged(task, action));
    }

    public void turnAdvanced(TaskDto task, TaskTurn previous) {
        notifyListeners("turn " + previous.value() + "->" + task.currentTurn().value() + " " + task.id(),
                l -> l.onTurnAdvanced(task, previous));
    }

    public void messageCreated(MessageDto message) {
        notifyListeners("message " + message.id(), l -> l.onMessageCreated(message));
    }

    public void agentStatus(String agent, String status, Map<String, Object> details) {
        notifyListeners("agent " + agent + " " + status, l -> l.onAgentStatus(agent, status, details));
    }

    private void notifyListeners(String event, Consumer<HubEventListener> call) {
        for (HubEventListener listener : listeners) {
            try {
                call.accept(listener);
            } catch (Exception e) {
                log.error("Listener error for {}", event, e);
                listener.onError(e);
            }
        }
    }
}
