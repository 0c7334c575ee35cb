package io.github.drompincen.taskcore.gateway.controller;

import io.github.drompincen.taskcore.protocol.api.CreateTaskRequest;
import io.github.drompincen.taskcore.protocol.api.TaskDto;
import io.github.drompincen.taskcore.protocol.api.UpdateTaskRequest;
import io.github.drompincen.taskcore.runtime.task.TaskCommandService;
import io.github.drompincen.taskcore.runtime.task.TaskQueryService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/tasks")
public class TaskController {

    private final TaskCommandService commandService;
    private final TaskQueryService queryService;

    public TaskController(TaskCommandService commandService, TaskQueryService queryService) {
        this.commandService = commandService;
        this.queryService = queryService;
    }

    @PostMapping
    public ResponseEntity<TaskDto> create(@Valid @RequestBody CreateTaskRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(commandService.create(request));
    }

    @GetMapping
    public List<TaskDto> list(@RequestParam(defaultValue = "false") boolean includeDeleted) {
        return queryService.findAll(includeDeleted);
    }

    @GetMapping("/{taskId}")
    public ResponseEntity<TaskDto> get(@PathVariable String taskId,
                                       @RequestParam(defaultValue = "false") boolean includeDeleted) {
        return ResponseEntity.ok(queryService.getById(taskId, includeDeleted));
    }

    @PutMapping("/{taskId}")
    public ResponseEntity<TaskDto> update(@PathVariable String taskId,
                                          @Valid @RequestBody UpdateTaskRequest request) {
        return ResponseEntity.ok(commandService.update(taskId, request));
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<Void> delete(@PathVariable String taskId) {
        commandService.delete(taskId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{taskId}/restore")
    public ResponseEntity<TaskDto> restore(@PathVariable String taskId) {
        return ResponseEntity.ok(commandService.restore(taskId));
    }
}
