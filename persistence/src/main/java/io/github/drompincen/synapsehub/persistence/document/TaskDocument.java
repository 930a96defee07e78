package io.github.drompincen.synapsehub.persistence.document;

import io.github.drompincen.synapsehub.protocol.api.TaskPriority;
import io.github.drompincen.synapsehub.protocol.api.TaskStatus;
import io.github.drompincen.synapsehub.protocol.api.TaskTurn;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Document(collection = "tasks")
@CompoundIndex(name = "title_creator", def = "{'title': 1, 'createdBy': 1}", unique = true,
        partialFilter = "{'deleted': false, 'createdBy': {'$exists': true}}")
public class TaskDocument {

    @Id
    private String taskId;
    private String title;
    private String description;
    @Indexed
    private TaskStatus status;
    private TaskTurn currentTurn;
    private TaskPriority priority;
    private int progress;
    private String projectPath;
    private String sshHost;
    private String sshUser;
    private Instant startedAt;
    private Instant completedAt;
    private Integer estimatedDuration;
    private Integer actualDuration;
    private String errorMessage;
    private int retryCount;
    private int maxRetries;
    private Map<String, Map<String, Object>> aiContexts = new HashMap<>();
    private boolean deleted;
    @Indexed
    private Instant createdAt;
    private Instant updatedAt;
    private String createdBy;
    private String updatedBy;
    @Version
    private Long version;

    public TaskDocument() {}

    public boolean isRemoteSsh() {
        return sshHost != null && sshUser != null;
    }

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public TaskStatus getStatus() { return status; }
    public void setStatus(TaskStatus status) { this.status = status; }

    public TaskTurn getCurrentTurn() { return currentTurn; }
    public void setCurrentTurn(TaskTurn currentTurn) { this.currentTurn = currentTurn; }

    public TaskPriority getPriority() { return priority; }
    public void setPriority(TaskPriority priority) { this.priority = priority; }

    public int getProgress() { return progress; }
    public void setProgress(int progress) { this.progress = progress; }

    public String getProjectPath() { return projectPath; }
    public void setProjectPath(String projectPath) { this.projectPath = projectPath; }

    public String getSshHost() { return sshHost; }
    public void setSshHost(String sshHost) { this.sshHost = sshHost; }

    public String getSshUser() { return sshUser; }
    public void setSshUser(String sshUser) { this.sshUser = sshUser; }

    public Instant getStartedAt() { return startedAt; }
    public void setStartedAt(Instant startedAt) { this.startedAt = startedAt; }

    public Instant getCompletedAt() { return completedAt; }
    public void setCompletedAt(Instant completedAt) { this.completedAt = completedAt; }

    public Integer getEstimatedDuration() { return estimatedDuration; }
    public void setEstimatedDuration(Integer estimatedDuration) { this.estimatedDuration = estimatedDuration; }

    public Integer getActualDuration() { return actualDuration; }
    public void setActualDuration(Integer actualDuration) { this.actualDuration = actualDuration; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public int getRetryCount() { return retryCount; }
    public void setRetryCount(int retryCount) { this.retryCount = retryCount; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public Map<String, Map<String, Object>> getAiContexts() { return aiContexts; }
    public void setAiContexts(Map<String, Map<String, Object>> aiContexts) { this.aiContexts = aiContexts; }

    public boolean isDeleted() { return deleted; }
    public void setDeleted(boolean deleted) { this.deleted = deleted; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }

    public String getUpdatedBy() { return updatedBy; }
    public void setUpdatedBy(String updatedBy) { this.updatedBy = updatedBy; }

    public Long getVersion() { return version; }
    public void setVersion(Long version) { this.version = version; }
}
