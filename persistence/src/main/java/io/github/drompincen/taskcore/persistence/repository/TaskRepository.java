package io.github.drompincen.taskcore.persistence.repository;

import io.github.drompincen.taskcore.persistence.document.TaskDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface TaskRepository extends MongoRepository<TaskDocument, String> {
    Optional<TaskDocument> findByTaskIdAndDeletedAtIsNull(String taskId);
    List<TaskDocument> findByDeletedAtIsNullOrderByCreatedAtAsc();
    List<TaskDocument> findAllByOrderByCreatedAtAsc();
}
