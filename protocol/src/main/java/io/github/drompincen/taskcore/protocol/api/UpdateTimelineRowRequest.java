package io.github.drompincen.taskcore.protocol.api;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

import java.time.Instant;

/** Partial update; null fields keep the stored value. */
public record UpdateTimelineRowRequest(
        Instant startAt,
        Instant endAt,
        @Min(0) @Max(100) Integer progress
) {}
