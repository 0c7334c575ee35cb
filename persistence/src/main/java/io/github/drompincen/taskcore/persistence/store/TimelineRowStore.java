package io.github.drompincen.taskcore.persistence.store;

import io.github.drompincen.taskcore.persistence.document.TimelineRowDocument;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Timeline row persistence. At most one row per task is active: {@code create} and
 * {@code restore} fail with {@link org.springframework.dao.DuplicateKeyException} otherwise.
 */
public interface TimelineRowStore extends SoftDeleteStore<TimelineRowDocument> {

    boolean existsActiveByTaskId(String taskId);

    Optional<TimelineRowDocument> findActiveByTaskId(String taskId);

    /** Most recently deleted row of a task, used when a task restore cascades. */
    Optional<TimelineRowDocument> findLatestDeletedByTaskId(String taskId);

    List<TimelineRowDocument> findActiveByTaskIds(Collection<String> taskIds);

    List<TimelineRowDocument> findAll(boolean includeDeleted);
}
