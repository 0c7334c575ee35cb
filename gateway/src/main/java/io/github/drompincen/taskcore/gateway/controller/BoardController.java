package io.github.drompincen.taskcore.gateway.controller;

import io.github.drompincen.taskcore.protocol.api.BoardRowDto;
import io.github.drompincen.taskcore.protocol.api.CreateBoardRowRequest;
import io.github.drompincen.taskcore.protocol.api.MoveBoardRowRequest;
import io.github.drompincen.taskcore.runtime.board.BoardCommandService;
import io.github.drompincen.taskcore.runtime.board.BoardQueryService;
import io.github.drompincen.taskcore.runtime.event.SubscriptionFilter;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;

@RestController
@RequestMapping("/api/v1/board/rows")
public class BoardController {

    private final BoardCommandService commandService;
    private final BoardQueryService queryService;

    public BoardController(BoardCommandService commandService, BoardQueryService queryService) {
        this.commandService = commandService;
        this.queryService = queryService;
    }

    @PostMapping
    public ResponseEntity<BoardRowDto> create(@Valid @RequestBody CreateBoardRowRequest request) {
        BoardRowDto row = commandService.create(request.taskId(), request.listKey(), request.position());
        return ResponseEntity.status(HttpStatus.CREATED).body(row);
    }

    /** Active rows of the given lists (comma separated) in position order, or every row. */
    @GetMapping
    public List<BoardRowDto> list(@RequestParam(required = false) String listKeys,
                                  @RequestParam(defaultValue = "false") boolean includeDeleted) {
        Set<String> keys = SubscriptionFilter.splitCsv(listKeys);
        if (keys.isEmpty()) {
            return queryService.findAll(includeDeleted);
        }
        return keys.size() == 1
                ? queryService.findByListKey(keys.iterator().next())
                : queryService.findByListKeys(keys);
    }

    @GetMapping("/{rowId}")
    public ResponseEntity<BoardRowDto> get(@PathVariable String rowId,
                                           @RequestParam(defaultValue = "false") boolean includeDeleted) {
        return ResponseEntity.ok(queryService.getById(rowId, includeDeleted));
    }

    @GetMapping("/by-task/{taskId}")
    public ResponseEntity<BoardRowDto> getByTask(@PathVariable String taskId) {
        return queryService.findByTaskId(taskId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @PutMapping("/{rowId}/position")
    public ResponseEntity<BoardRowDto> move(@PathVariable String rowId,
                                            @Valid @RequestBody MoveBoardRowRequest request) {
        return ResponseEntity.ok(commandService.move(rowId, request.listKey(), request.position()));
    }

    @DeleteMapping("/{rowId}")
    public ResponseEntity<Void> delete(@PathVariable String rowId) {
        commandService.delete(rowId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{rowId}/restore")
    public ResponseEntity<BoardRowDto> restore(@PathVariable String rowId) {
        return ResponseEntity.ok(commandService.restore(rowId));
    }
}
