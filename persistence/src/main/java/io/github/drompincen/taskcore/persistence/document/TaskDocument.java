package io.github.drompincen.taskcore.persistence.document;

import io.github.drompincen.taskcore.protocol.api.TaskDto;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "tasks")
public class TaskDocument {

    @Id
    private String taskId;
    private String title;
    private String description;
    private TaskDto.TaskStatus status;
    private TaskDto.TaskPriority priority;
    private Instant createdAt;
    private Instant updatedAt;
    @Indexed(sparse = true)
    private Instant deletedAt;

    public TaskDocument() {}

    public boolean isActive() { return deletedAt == null; }

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public TaskDto.TaskStatus getStatus() { return status; }
    public void setStatus(TaskDto.TaskStatus status) { this.status = status; }

    public TaskDto.TaskPriority getPriority() { return priority; }
    public void setPriority(TaskDto.TaskPriority priority) { this.priority = priority; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }

    public Instant getDeletedAt() { return deletedAt; }
    public void setDeletedAt(Instant deletedAt) { this.deletedAt = deletedAt; }
}
