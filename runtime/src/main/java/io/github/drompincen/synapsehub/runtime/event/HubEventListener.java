package io.github.drompincen.synapsehub.runtime.event;

import io.github.drompincen.synapsehub.protocol.api.MessageDto;
import io.github.drompincen.synapsehub.protocol.api.TaskDto;
import io.github.drompincen.synapsehub.protocol.api.TaskTurn;

import java.util.Map;

public interface HubEventListener {
    default void onTaskChanged(TaskDto task, TaskAction action) {}
    default void onTurnAdvanced(TaskDto task, TaskTurn previous) {}
    default void onMessageCreated(MessageDto message) {}
    default void onAgentStatus(String agent, String status, Map<String, Object> details) {}
    default void onError(Throwable t) {}
}
