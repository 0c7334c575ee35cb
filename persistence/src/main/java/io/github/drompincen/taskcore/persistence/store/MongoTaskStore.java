package io.github.drompincen.taskcore.persistence.store;

import io.github.drompincen.taskcore.persistence.document.TaskDocument;
import io.github.drompincen.taskcore.persistence.repository.TaskRepository;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class MongoTaskStore implements TaskStore {

    private final TaskRepository taskRepository;
    private final MongoTemplate mongoTemplate;

    public MongoTaskStore(TaskRepository taskRepository, MongoTemplate mongoTemplate) {
        this.taskRepository = taskRepository;
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public String create(TaskDocument task) {
        return taskRepository.insert(task).getTaskId();
    }

    @Override
    public Optional<TaskDocument> findActiveById(String id) {
        return taskRepository.findByTaskIdAndDeletedAtIsNull(id);
    }

    @Override
    public Optional<TaskDocument> findById(String id, boolean includeDeleted) {
        return includeDeleted ? taskRepository.findById(id) : findActiveById(id);
    }

    @Override
    public boolean update(TaskDocument task) {
        Query query = new Query(Criteria.where("_id").is(task.getTaskId()).and("deletedAt").is(null));
        Update update = new Update()
                .set("title", task.getTitle())
                .set("description", task.getDescription())
                .set("status", task.getStatus())
                .set("priority", task.getPriority())
                .set("updatedAt", task.getUpdatedAt());
        return mongoTemplate.updateFirst(query, update, TaskDocument.class).getMatchedCount() > 0;
    }

    @Override
    public boolean softDelete(String id) {
        Instant now = Instant.now();
        Query query = new Query(Criteria.where("_id").is(id).and("deletedAt").is(null));
        Update update = new Update().set("deletedAt", now).set("updatedAt", now);
        return mongoTemplate.updateFirst(query, update, TaskDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean restore(String id) {
        Query query = new Query(Criteria.where("_id").is(id).and("deletedAt").ne(null));
        Update update = new Update().unset("deletedAt").set("updatedAt", Instant.now());
        return mongoTemplate.updateFirst(query, update, TaskDocument.class).getModifiedCount() > 0;
    }

    @Override
    public List<TaskDocument> findAll(boolean includeDeleted) {
        return includeDeleted
                ? taskRepository.findAllByOrderByCreatedAtAsc()
                : taskRepository.findByDeletedAtIsNullOrderByCreatedAtAsc();
    }
}
