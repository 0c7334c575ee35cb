package io.github.drompincen.taskcore.runtime.board;

import io.github.drompincen.taskcore.persistence.store.BoardRowStore;
import io.github.drompincen.taskcore.protocol.api.BoardRowDto;
import io.github.drompincen.taskcore.runtime.error.NotFoundException;
import io.github.drompincen.taskcore.runtime.mapping.DtoMapper;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Service
public class BoardQueryService {

    private final BoardRowStore boardRowStore;

    public BoardQueryService(BoardRowStore boardRowStore) {
        this.boardRowStore = boardRowStore;
    }

    public BoardRowDto getById(String rowId, boolean includeDeleted) {
        return boardRowStore.findById(rowId, includeDeleted)
                .map(DtoMapper::toDto)
                .orElseThrow(() -> NotFoundException.of("Board row", rowId));
    }

    public Optional<BoardRowDto> findByTaskId(String taskId) {
        return boardRowStore.findActiveByTaskId(taskId).map(DtoMapper::toDto);
    }

    public List<BoardRowDto> findByListKey(String listKey) {
        return boardRowStore.findActiveByListKey(listKey).stream().map(DtoMapper::toDto).toList();
    }

    public List<BoardRowDto> findByListKeys(Collection<String> listKeys) {
        return boardRowStore.findActiveByListKeys(listKeys).stream().map(DtoMapper::toDto).toList();
    }

    public List<BoardRowDto> findAll(boolean includeDeleted) {
        return boardRowStore.findAll(includeDeleted).stream().map(DtoMapper::toDto).toList();
    }
}
