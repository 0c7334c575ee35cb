package io.github.drompincen.taskcore.persistence.store;

import io.github.drompincen.taskcore.persistence.document.TaskDocument;

import java.util.List;

public interface TaskStore extends SoftDeleteStore<TaskDocument> {

    List<TaskDocument> findAll(boolean includeDeleted);
}
