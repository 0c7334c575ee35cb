package io.github.drompincen.taskcore.runtime.mapping;

import io.github.drompincen.taskcore.persistence.document.BoardRowDocument;
import io.github.drompincen.taskcore.persistence.document.TaskDocument;
import io.github.drompincen.taskcore.persistence.document.TimelineRowDocument;
import io.github.drompincen.taskcore.protocol.api.BoardRowDto;
import io.github.drompincen.taskcore.protocol.api.TaskDto;
import io.github.drompincen.taskcore.protocol.api.TimelineRowDto;

public final class DtoMapper {

    private DtoMapper() {}

    public static TaskDto toDto(TaskDocument doc) {
        return new TaskDto(doc.getTaskId(), doc.getTitle(), doc.getDescription(), doc.getStatus(),
                doc.getPriority(), doc.getCreatedAt(), doc.getUpdatedAt(), doc.getDeletedAt());
    }

    public static TimelineRowDto toDto(TimelineRowDocument doc) {
        return new TimelineRowDto(doc.getRowId(), doc.getTaskId(), doc.getStartAt(), doc.getEndAt(),
                doc.getProgress(), doc.getDeletedAt());
    }

    public static BoardRowDto toDto(BoardRowDocument doc) {
        return new BoardRowDto(doc.getRowId(), doc.getTaskId(), doc.getListKey(), doc.getPosition(),
                doc.getDeletedAt());
    }
}
