package io.github.drompincen.taskcore.persistence.repository;

import io.github.drompincen.taskcore.persistence.document.BoardRowDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface BoardRowRepository extends MongoRepository<BoardRowDocument, String> {
    Optional<BoardRowDocument> findByRowIdAndDeletedAtIsNull(String rowId);
    Optional<BoardRowDocument> findFirstByTaskIdAndDeletedAtIsNull(String taskId);
    Optional<BoardRowDocument> findFirstByTaskIdAndDeletedAtIsNotNullOrderByDeletedAtDesc(String taskId);
    boolean existsByTaskIdAndDeletedAtIsNull(String taskId);
    long countByListKeyAndDeletedAtIsNull(String listKey);
    List<BoardRowDocument> findByListKeyAndDeletedAtIsNullOrderByPositionAsc(String listKey);
    List<BoardRowDocument> findByListKeyInAndDeletedAtIsNullOrderByListKeyAscPositionAsc(Collection<String> listKeys);
    List<BoardRowDocument> findByDeletedAtIsNull();
}
