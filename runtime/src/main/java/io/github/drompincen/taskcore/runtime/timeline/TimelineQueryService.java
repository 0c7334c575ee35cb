package io.github.drompincen.taskcore.runtime.timeline;

import io.github.drompincen.taskcore.persistence.store.TimelineRowStore;
import io.github.drompincen.taskcore.protocol.api.TimelineRowDto;
import io.github.drompincen.taskcore.runtime.error.NotFoundException;
import io.github.drompincen.taskcore.runtime.mapping.DtoMapper;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Service
public class TimelineQueryService {

    private final TimelineRowStore timelineRowStore;

    public TimelineQueryService(TimelineRowStore timelineRowStore) {
        this.timelineRowStore = timelineRowStore;
    }

    public TimelineRowDto getById(String rowId, boolean includeDeleted) {
        return timelineRowStore.findById(rowId, includeDeleted)
                .map(DtoMapper::toDto)
                .orElseThrow(() -> NotFoundException.of("Timeline row", rowId));
    }

    public Optional<TimelineRowDto> findByTaskId(String taskId) {
        return timelineRowStore.findActiveByTaskId(taskId).map(DtoMapper::toDto);
    }

    public List<TimelineRowDto> findByTaskIds(Collection<String> taskIds) {
        return timelineRowStore.findActiveByTaskIds(taskIds).stream().map(DtoMapper::toDto).toList();
    }

    public List<TimelineRowDto> findAll(boolean includeDeleted) {
        return timelineRowStore.findAll(includeDeleted).stream().map(DtoMapper::toDto).toList();
    }
}
