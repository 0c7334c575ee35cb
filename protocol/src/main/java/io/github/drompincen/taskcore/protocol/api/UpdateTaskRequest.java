package io.github.drompincen.taskcore.protocol.api;

import jakarta.validation.constraints.Size;

public record UpdateTaskRequest(
        @Size(min = 1, max = 255) String title,
        @Size(max = 10000) String description,
        TaskDto.TaskStatus status,
        TaskDto.TaskPriority priority
) {}
