package io.github.drompincen.taskcore.protocol.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateTaskRequest(
        @NotBlank @Size(max = 255) String title,
        @Size(max = 10000) String description,
        TaskDto.TaskStatus status,
        TaskDto.TaskPriority priority
) {}
