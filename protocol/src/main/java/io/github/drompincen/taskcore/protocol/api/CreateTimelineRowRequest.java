package io.github.drompincen.taskcore.protocol.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

public record CreateTimelineRowRequest(
        @NotBlank String taskId,
        @NotNull Instant startAt,
        @NotNull Instant endAt,
        @Min(0) @Max(100) Integer progress
) {}
