package io.github.drompincen.taskcore.protocol.event;

public enum EventCategory {
    TASK,
    TIMELINE,
    BOARD
}
