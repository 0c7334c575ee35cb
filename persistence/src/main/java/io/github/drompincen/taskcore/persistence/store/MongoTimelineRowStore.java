package io.github.drompincen.taskcore.persistence.store;

import io.github.drompincen.taskcore.persistence.document.TimelineRowDocument;
import io.github.drompincen.taskcore.persistence.repository.TimelineRowRepository;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public class MongoTimelineRowStore implements TimelineRowStore {

    private final TimelineRowRepository timelineRowRepository;
    private final MongoTemplate mongoTemplate;

    public MongoTimelineRowStore(TimelineRowRepository timelineRowRepository, MongoTemplate mongoTemplate) {
        this.timelineRowRepository = timelineRowRepository;
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public String create(TimelineRowDocument row) {
        row.setActiveTaskId(row.isActive() ? row.getTaskId() : null);
        return timelineRowRepository.insert(row).getRowId();
    }

    @Override
    public Optional<TimelineRowDocument> findActiveById(String id) {
        return timelineRowRepository.findByRowIdAndDeletedAtIsNull(id);
    }

    @Override
    public Optional<TimelineRowDocument> findById(String id, boolean includeDeleted) {
        return includeDeleted ? timelineRowRepository.findById(id) : findActiveById(id);
    }

    @Override
    public boolean update(TimelineRowDocument row) {
        Update update = new Update()
                .set("startAt", row.getStartAt())
                .set("endAt", row.getEndAt())
                .set("progress", row.getProgress());
        return mongoTemplate.updateFirst(activeRow(row.getRowId()), update, TimelineRowDocument.class)
                .getMatchedCount() > 0;
    }

    @Override
    public boolean softDelete(String id) {
        Update update = new Update().set("deletedAt", Instant.now()).unset("activeTaskId");
        return mongoTemplate.updateFirst(activeRow(id), update, TimelineRowDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean restore(String id) {
        Optional<TimelineRowDocument> row = timelineRowRepository.findById(id);
        if (row.isEmpty()) {
            return false;
        }
        Query query = new Query(Criteria.where("_id").is(id).and("deletedAt").ne(null));
        Update update = new Update().unset("deletedAt").set("activeTaskId", row.get().getTaskId());
        return mongoTemplate.updateFirst(query, update, TimelineRowDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean existsActiveByTaskId(String taskId) {
        return timelineRowRepository.existsByTaskIdAndDeletedAtIsNull(taskId);
    }

    @Override
    public Optional<TimelineRowDocument> findActiveByTaskId(String taskId) {
        return timelineRowRepository.findFirstByTaskIdAndDeletedAtIsNull(taskId);
    }

    @Override
    public Optional<TimelineRowDocument> findLatestDeletedByTaskId(String taskId) {
        return timelineRowRepository.findFirstByTaskIdAndDeletedAtIsNotNullOrderByDeletedAtDesc(taskId);
    }

    @Override
    public List<TimelineRowDocument> findActiveByTaskIds(Collection<String> taskIds) {
        if (taskIds.isEmpty()) {
            return List.of();
        }
        return timelineRowRepository.findByTaskIdInAndDeletedAtIsNull(taskIds);
    }

    @Override
    public List<TimelineRowDocument> findAll(boolean includeDeleted) {
        return includeDeleted ? timelineRowRepository.findAll() : timelineRowRepository.findByDeletedAtIsNull();
    }

    private static Query activeRow(String id) {
        return new Query(Criteria.where("_id").is(id).and("deletedAt").is(null));
    }
}
