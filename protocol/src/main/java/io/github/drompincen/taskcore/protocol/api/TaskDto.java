package io.github.drompincen.taskcore.protocol.api;

import java.time.Instant;

public record TaskDto(
        String taskId,
        String title,
        String description,
        TaskStatus status,
        TaskPriority priority,
        Instant createdAt,
        Instant updatedAt,
        Instant deletedAt
) {
    public enum TaskStatus {
        PENDING, IN_PROGRESS, DONE
    }

    public enum TaskPriority {
        LOW, MEDIUM, HIGH
    }
}
