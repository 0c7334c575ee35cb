package io.github.drompincen.taskcore.protocol.api;

import java.time.Instant;

public record BoardRowDto(
        String rowId,
        String taskId,
        String listKey,
        int position,
        Instant deletedAt
) {}
