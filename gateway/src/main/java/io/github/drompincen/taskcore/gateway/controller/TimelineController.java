package io.github.drompincen.taskcore.gateway.controller;

import io.github.drompincen.taskcore.protocol.api.CreateTimelineRowRequest;
import io.github.drompincen.taskcore.protocol.api.TimelineRowDto;
import io.github.drompincen.taskcore.protocol.api.UpdateTimelineRowRequest;
import io.github.drompincen.taskcore.runtime.event.SubscriptionFilter;
import io.github.drompincen.taskcore.runtime.timeline.TimelineCommandService;
import io.github.drompincen.taskcore.runtime.timeline.TimelineQueryService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/v1/timeline/rows")
public class TimelineController {

    private final TimelineCommandService commandService;
    private final TimelineQueryService queryService;

    public TimelineController(TimelineCommandService commandService, TimelineQueryService queryService) {
        this.commandService = commandService;
        this.queryService = queryService;
    }

    @PostMapping
    public ResponseEntity<TimelineRowDto> create(@Valid @RequestBody CreateTimelineRowRequest request) {
        TimelineRowDto row = commandService.create(request.taskId(), request.startAt(), request.endAt(),
                request.progress());
        return ResponseEntity.status(HttpStatus.CREATED).body(row);
    }

    /** Rows of the given tasks (comma separated), or every row when none is given. */
    @GetMapping
    public List<TimelineRowDto> list(@RequestParam(required = false) String taskIds,
                                     @RequestParam(defaultValue = "false") boolean includeDeleted) {
        Set<String> ids = SubscriptionFilter.splitCsv(taskIds);
        return ids.isEmpty() ? queryService.findAll(includeDeleted) : queryService.findByTaskIds(ids);
    }

    @GetMapping("/{rowId}")
    public ResponseEntity<TimelineRowDto> get(@PathVariable String rowId,
                                              @RequestParam(defaultValue = "false") boolean includeDeleted) {
        return ResponseEntity.ok(queryService.getById(rowId, includeDeleted));
    }

    @GetMapping("/by-task/{taskId}")
    public ResponseEntity<TimelineRowDto> getByTask(@PathVariable String taskId) {
        return queryService.findByTaskId(taskId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{rowId}")
    public ResponseEntity<TimelineRowDto> update(@PathVariable String rowId,
                                                 @Valid @RequestBody UpdateTimelineRowRequest request) {
        return ResponseEntity.ok(commandService.update(rowId, request.startAt(), request.endAt(), request.progress()));
    }

    @DeleteMapping("/{rowId}")
    public ResponseEntity<Void> delete(@PathVariable String rowId) {
        commandService.delete(rowId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{rowId}/restore")
    public ResponseEntity<TimelineRowDto> restore(@PathVariable String rowId) {
        return ResponseEntity.ok(commandService.restore(rowId));
    }
}
