package io.github.drompincen.taskcore.protocol.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.drompincen.taskcore.protocol.api.BoardRowDto;
import io.github.drompincen.taskcore.protocol.api.TaskDto;
import io.github.drompincen.taskcore.protocol.api.TimelineRowDto;

import java.time.Instant;

/**
 * Immutable announcement of one successful mutation. The payload is a full snapshot of the
 * affected entity after the transition. An event is created unstamped ({@code eventId == 0})
 * and receives its sequence number when it is published.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DomainEvent(
        long eventId,
        EventType type,
        Instant timestamp,
        Object payload,
        String previousListKey,
        Integer previousPosition
) {

    public static DomainEvent of(EventType type, Object payload) {
        return new DomainEvent(0L, type, Instant.now(), payload, null, null);
    }

    public static DomainEvent boardRowMoved(BoardRowDto row, String previousListKey, int previousPosition) {
        return new DomainEvent(0L, EventType.BOARD_ROW_MOVED, Instant.now(), row, previousListKey, previousPosition);
    }

    public DomainEvent withEventId(long id) {
        return new DomainEvent(id, type, timestamp, payload, previousListKey, previousPosition);
    }

    @JsonIgnore
    public boolean isStamped() {
        return eventId > 0;
    }

    @JsonIgnore
    public EventCategory category() {
        return type.category();
    }

    /** Task the payload belongs to, or null for payloads that carry none. */
    @JsonIgnore
    public String taskId() {
        if (payload instanceof TaskDto task) return task.taskId();
        if (payload instanceof TimelineRowDto row) return row.taskId();
        if (payload instanceof BoardRowDto row) return row.taskId();
        return null;
    }

    /** List-key of a board row payload, or null for every other payload. */
    @JsonIgnore
    public String listKey() {
        return payload instanceof BoardRowDto row ? row.listKey() : null;
    }
}
