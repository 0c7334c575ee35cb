package io.github.drompincen.taskcore.protocol.event;

public enum EventType {
    // Task
    TASK_CREATED(EventCategory.TASK),
    TASK_UPDATED(EventCategory.TASK),
    TASK_DELETED(EventCategory.TASK),
    TASK_RESTORED(EventCategory.TASK),

    // Timeline
    TIMELINE_ROW_CREATED(EventCategory.TIMELINE),
    TIMELINE_ROW_UPDATED(EventCategory.TIMELINE),
    TIMELINE_ROW_DELETED(EventCategory.TIMELINE),
    TIMELINE_ROW_RESTORED(EventCategory.TIMELINE),

    // Board
    BOARD_ROW_CREATED(EventCategory.BOARD),
    BOARD_ROW_MOVED(EventCategory.BOARD),
    BOARD_ROW_DELETED(EventCategory.BOARD),
    BOARD_ROW_RESTORED(EventCategory.BOARD);

    private final EventCategory category;

    EventType(EventCategory category) {
        this.category = category;
    }

    public EventCategory category() {
        return category;
    }
}
