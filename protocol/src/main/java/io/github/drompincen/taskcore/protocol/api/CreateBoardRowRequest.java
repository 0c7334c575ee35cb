package io.github.drompincen.taskcore.protocol.api;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record CreateBoardRowRequest(
        @NotBlank String taskId,
        @NotBlank @Size(max = 255) String listKey,
        @NotNull @Min(0) Integer position
) {}
