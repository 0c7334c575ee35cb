package io.github.drompincen.taskcore.runtime.task;

import io.github.drompincen.taskcore.persistence.store.TaskStore;
import io.github.drompincen.taskcore.protocol.api.TaskDto;
import io.github.drompincen.taskcore.runtime.error.NotFoundException;
import io.github.drompincen.taskcore.runtime.mapping.DtoMapper;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class TaskQueryService {

    private final TaskStore taskStore;

    public TaskQueryService(TaskStore taskStore) {
        this.taskStore = taskStore;
    }

    public TaskDto getById(String taskId, boolean includeDeleted) {
        return taskStore.findById(taskId, includeDeleted)
                .map(DtoMapper::toDto)
                .orElseThrow(() -> NotFoundException.of("Task", taskId));
    }

    public List<TaskDto> findAll(boolean includeDeleted) {
        return taskStore.findAll(includeDeleted).stream().map(DtoMapper::toDto).toList();
    }
}
