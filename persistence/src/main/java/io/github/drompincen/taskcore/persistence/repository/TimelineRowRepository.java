package io.github.drompincen.taskcore.persistence.repository;

import io.github.drompincen.taskcore.persistence.document.TimelineRowDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface TimelineRowRepository extends MongoRepository<TimelineRowDocument, String> {
    Optional<TimelineRowDocument> findByRowIdAndDeletedAtIsNull(String rowId);
    Optional<TimelineRowDocument> findFirstByTaskIdAndDeletedAtIsNull(String taskId);
    Optional<TimelineRowDocument> findFirstByTaskIdAndDeletedAtIsNotNullOrderByDeletedAtDesc(String taskId);
    boolean existsByTaskIdAndDeletedAtIsNull(String taskId);
    List<TimelineRowDocument> findByDeletedAtIsNull();
    List<TimelineRowDocument> findByTaskIdInAndDeletedAtIsNull(Collection<String> taskIds);
}
