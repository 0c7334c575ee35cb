package io.github.drompincen.taskcore.runtime.board;

import io.github.drompincen.taskcore.persistence.document.BoardRowDocument;
import io.github.drompincen.taskcore.persistence.store.BoardRowStore;
import io.github.drompincen.taskcore.persistence.store.TaskStore;
import io.github.drompincen.taskcore.protocol.api.BoardRowDto;
import io.github.drompincen.taskcore.protocol.event.DomainEvent;
import io.github.drompincen.taskcore.protocol.event.EventType;
import io.github.drompincen.taskcore.runtime.error.ConflictException;
import io.github.drompincen.taskcore.runtime.error.InvalidArgumentException;
import io.github.drompincen.taskcore.runtime.error.NotFoundException;
import io.github.drompincen.taskcore.runtime.event.EventAnnouncer;
import io.github.drompincen.taskcore.runtime.lock.ListKeyLockService;
import io.github.drompincen.taskcore.runtime.mapping.DtoMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Board row use cases. Every mutation runs under the lock of each list-key it touches: shifts
 * and the row write are persisted in one transaction, then the event is announced while the
 * lock is still held so events of one list are numbered in commit order. Create and restore
 * also hold the task lock, since the task's single active row may sit in any list.
 */
@Service
public class BoardCommandService {

    private static final Logger log = LoggerFactory.getLogger(BoardCommandService.class);
    private static final int MAX_LIST_KEY_LENGTH = 255;
    private static final int MAX_MOVE_ATTEMPTS = 3;

    private final BoardRowStore boardRowStore;
    private final TaskStore taskStore;
    private final PositionReconciler reconciler;
    private final ListKeyLockService lockService;
    private final EventAnnouncer announcer;
    private final TransactionOperations transactions;

    public BoardCommandService(BoardRowStore boardRowStore, TaskStore taskStore, PositionReconciler reconciler,
                               ListKeyLockService lockService, EventAnnouncer announcer,
                               TransactionOperations transactions) {
        this.boardRowStore = boardRowStore;
        this.taskStore = taskStore;
        this.reconciler = reconciler;
        this.lockService = lockService;
        this.announcer = announcer;
        this.transactions = transactions;
    }

    public BoardRowDto create(String taskId, String listKey, int position) {
        validateListKey(listKey);
        validatePosition(position);
        return lockService.withTaskLock(taskId, () -> lockService.withLock(listKey, () -> {
            BoardRowDocument row = inTransaction(() -> {
                if (taskStore.findActiveById(taskId).isEmpty()) {
                    throw NotFoundException.of("Task", taskId);
                }
                if (boardRowStore.existsActiveByTaskId(taskId)) {
                    throw new ConflictException("Board row already exists for task: " + taskId);
                }
                reconciler.apply(boardRowStore, reconciler.insertAt(listKey, position));

                BoardRowDocument doc = new BoardRowDocument();
                doc.setRowId(UUID.randomUUID().toString());
                doc.setTaskId(taskId);
                doc.setListKey(listKey);
                doc.setPosition(position);
                try {
                    boardRowStore.create(doc);
                } catch (DuplicateKeyException e) {
                    // unique task index rejected the row; close the slot opened above
                    reconciler.apply(boardRowStore, reconciler.removeAt(listKey, position));
                    throw new ConflictException("Board row already exists for task: " + taskId, e);
                }
                return doc;
            });
            BoardRowDto dto = DtoMapper.toDto(row);
            announcer.announce(DomainEvent.of(EventType.BOARD_ROW_CREATED, dto));
            log.info("Created board row {} for task {} at {}[{}]", row.getRowId(), taskId, listKey, position);
            return dto;
        }));
    }

    public BoardRowDto move(String rowId, String targetListKey, int targetPosition) {
        validateListKey(targetListKey);
        validatePosition(targetPosition);
        for (int attempt = 0; attempt < MAX_MOVE_ATTEMPTS; attempt++) {
            String currentListKey = requireActive(rowId).getListKey();
            Optional<BoardRowDto> moved = lockService.withLocks(List.of(currentListKey, targetListKey), () -> {
                BoardRowDocument row = requireActive(rowId);
                if (!row.getListKey().equals(currentListKey)) {
                    // moved to another list before we got the lock
                    return Optional.empty();
                }
                return Optional.of(moveLocked(row, targetListKey, targetPosition));
            });
            if (moved.isPresent()) {
                return moved.get();
            }
        }
        throw new ConflictException("Board row keeps moving concurrently: " + rowId);
    }

    private BoardRowDto moveLocked(BoardRowDocument row, String targetListKey, int targetPosition) {
        String previousListKey = row.getListKey();
        int previousPosition = row.getPosition();
        inTransaction(() -> {
            List<PositionShift> shifts = previousListKey.equals(targetListKey)
                    ? reconciler.moveWithin(targetListKey, previousPosition, targetPosition)
                    : reconciler.moveAcross(previousListKey, previousPosition, targetListKey, targetPosition);
            reconciler.apply(boardRowStore, shifts);
            row.setListKey(targetListKey);
            row.setPosition(targetPosition);
            if (!boardRowStore.update(row)) {
                throw NotFoundException.of("Board row", row.getRowId());
            }
            return row;
        });
        BoardRowDto dto = DtoMapper.toDto(row);
        announcer.announce(DomainEvent.boardRowMoved(dto, previousListKey, previousPosition));
        log.info("Moved board row {} from {}[{}] to {}[{}]", row.getRowId(), previousListKey, previousPosition,
                targetListKey, targetPosition);
        return dto;
    }

    public BoardRowDto delete(String rowId) {
        String listKey = requireActive(rowId).getListKey();
        return lockService.withLock(listKey, () -> {
            BoardRowDocument row = requireActive(rowId);
            if (!row.getListKey().equals(listKey)) {
                throw new ConflictException("Board row moved concurrently: " + rowId);
            }
            BoardRowDocument deleted = inTransaction(() -> {
                reconciler.apply(boardRowStore, reconciler.removeAt(listKey, row.getPosition()));
                if (!boardRowStore.softDelete(rowId)) {
                    throw NotFoundException.of("Board row", rowId);
                }
                return boardRowStore.findById(rowId, true).orElse(row);
            });
            BoardRowDto dto = DtoMapper.toDto(deleted);
            announcer.announce(DomainEvent.of(EventType.BOARD_ROW_DELETED, dto));
            log.info("Deleted board row {} from {}[{}]", rowId, listKey, row.getPosition());
            return dto;
        });
    }

    public BoardRowDto restore(String rowId) {
        BoardRowDocument snapshot = boardRowStore.findById(rowId, true)
                .orElseThrow(() -> NotFoundException.of("Board row", rowId));
        if (snapshot.isActive()) {
            throw new ConflictException("Board row is not deleted: " + rowId);
        }
        String listKey = snapshot.getListKey();
        return lockService.withTaskLock(snapshot.getTaskId(), () -> lockService.withLock(listKey, () -> {
            BoardRowDocument restored = inTransaction(() -> {
                BoardRowDocument row = boardRowStore.findById(rowId, true)
                        .orElseThrow(() -> NotFoundException.of("Board row", rowId));
                if (row.isActive()) {
                    throw new ConflictException("Board row is not deleted: " + rowId);
                }
                if (boardRowStore.existsActiveByTaskId(row.getTaskId())) {
                    throw new ConflictException("Task already has an active board row: " + row.getTaskId());
                }
                long activeCount = boardRowStore.countActiveByListKey(listKey);
                int target = reconciler.reinsertPosition(row.getPosition(), activeCount);
                reconciler.apply(boardRowStore, reconciler.reinsertAt(listKey, row.getPosition(), activeCount));
                try {
                    if (!boardRowStore.restoreAt(rowId, target)) {
                        reconciler.apply(boardRowStore, reconciler.removeAt(listKey, target));
                        throw new ConflictException("Board row is not deleted: " + rowId);
                    }
                } catch (DuplicateKeyException e) {
                    reconciler.apply(boardRowStore, reconciler.removeAt(listKey, target));
                    throw new ConflictException("Task already has an active board row: " + row.getTaskId(), e);
                }
                row.setPosition(target);
                row.setDeletedAt(null);
                return row;
            });
            BoardRowDto dto = DtoMapper.toDto(restored);
            announcer.announce(DomainEvent.of(EventType.BOARD_ROW_RESTORED, dto));
            log.info("Restored board row {} to {}[{}]", rowId, listKey, restored.getPosition());
            return dto;
        }));
    }

    /** Cascade step of a task delete; no-op when the task has no active board row. */
    public Optional<BoardRowDto> deleteForTask(String taskId) {
        return boardRowStore.findActiveByTaskId(taskId).map(row -> delete(row.getRowId()));
    }

    /** Cascade step of a task restore; brings back the latest deleted row unless one is active. */
    public Optional<BoardRowDto> restoreForTask(String taskId) {
        if (boardRowStore.existsActiveByTaskId(taskId)) {
            return Optional.empty();
        }
        return boardRowStore.findLatestDeletedByTaskId(taskId).map(row -> restore(row.getRowId()));
    }

    private BoardRowDocument requireActive(String rowId) {
        return boardRowStore.findActiveById(rowId)
                .orElseThrow(() -> NotFoundException.of("Board row", rowId));
    }

    private BoardRowDocument inTransaction(Supplier<BoardRowDocument> work) {
        return transactions.execute(status -> work.get());
    }

    private static void validateListKey(String listKey) {
        if (listKey == null || listKey.isBlank()) {
            throw new InvalidArgumentException("listKey must not be blank");
        }
        if (listKey.length() > MAX_LIST_KEY_LENGTH) {
            throw new InvalidArgumentException("listKey must be at most " + MAX_LIST_KEY_LENGTH + " characters");
        }
    }

    private static void validatePosition(int position) {
        if (position < 0) {
            throw new InvalidArgumentException("position must not be negative: " + position);
        }
    }
}
