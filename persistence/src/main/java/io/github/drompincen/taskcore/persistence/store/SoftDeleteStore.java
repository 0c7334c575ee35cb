package io.github.drompincen.taskcore.persistence.store;

import java.util.Optional;

/**
 * Entity CRUD with soft-delete semantics. Rows are never removed; {@code deletedAt} marks them
 * inactive. State-changing calls report whether a row actually changed so callers can tell a
 * lost race from a success.
 */
public interface SoftDeleteStore<T> {

    /** Persists a new row and returns its id. */
    String create(T entity);

    Optional<T> findActiveById(String id);

    Optional<T> findById(String id, boolean includeDeleted);

    /**
     * Writes the mutable fields of an active row. False when the row is absent or deleted, so a
     * stale copy never brings a deleted row back.
     */
    boolean update(T entity);

    /** Marks an active row deleted; false when the row is absent or already deleted. */
    boolean softDelete(String id);

    /** Clears the deletion mark; false when the row is absent or already active. */
    boolean restore(String id);
}
