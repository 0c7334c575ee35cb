package io.github.drompincen.taskcore.protocol.api;

import java.time.Instant;

public record TimelineRowDto(
        String rowId,
        String taskId,
        Instant startAt,
        Instant endAt,
        int progress,
        Instant deletedAt
) {}
