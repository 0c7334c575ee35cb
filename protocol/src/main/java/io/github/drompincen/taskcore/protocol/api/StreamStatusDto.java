package io.github.drompincen.taskcore.protocol.api;

public record StreamStatusDto(long currentEventId, int subscriptions) {}
