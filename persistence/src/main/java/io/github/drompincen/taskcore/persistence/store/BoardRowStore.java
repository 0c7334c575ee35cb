package io.github.drompincen.taskcore.persistence.store;

import io.github.drompincen.taskcore.persistence.document.BoardRowDocument;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Board row persistence. Besides entity CRUD it owns the position-shift primitive the
 * reconciler is expressed in. A shift only touches active rows of a single list-key and does
 * not serialize concurrent callers; callers hold the list-key lock around shift plus write.
 * At most one row per task is active: {@code create} and the restore calls fail with
 * {@link org.springframework.dao.DuplicateKeyException} otherwise.
 */
public interface BoardRowStore extends SoftDeleteStore<BoardRowDocument> {

    boolean existsActiveByTaskId(String taskId);

    /** Restores a deleted row into {@code position}; false when the row is absent or already active. */
    boolean restoreAt(String id, int position);

    Optional<BoardRowDocument> findActiveByTaskId(String taskId);

    Optional<BoardRowDocument> findLatestDeletedByTaskId(String taskId);

    /** Active rows of one list in ascending position order. */
    List<BoardRowDocument> findActiveByListKey(String listKey);

    /** Active rows of several lists, ordered by list-key then position. */
    List<BoardRowDocument> findActiveByListKeys(Collection<String> listKeys);

    long countActiveByListKey(String listKey);

    List<BoardRowDocument> findAll(boolean includeDeleted);

    /**
     * Adds {@code delta} to the position of every active row in {@code listKey} whose position
     * is at least {@code fromPosition}.
     *
     * @return number of rows changed
     */
    int shiftPositions(String listKey, int fromPosition, int delta);

    /** Same as {@link #shiftPositions(String, int, int)} restricted to positions up to {@code toPosition}. */
    int shiftPositions(String listKey, int fromPosition, int toPosition, int delta);
}
