package io.github.drompincen.taskcore.gateway.error;

public record ApiError(String code, String message) {}
