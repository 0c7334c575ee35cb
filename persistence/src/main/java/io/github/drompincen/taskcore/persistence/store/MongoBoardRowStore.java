package io.github.drompincen.taskcore.persistence.store;

import io.github.drompincen.taskcore.persistence.document.BoardRowDocument;
import io.github.drompincen.taskcore.persistence.repository.BoardRowRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
public class MongoBoardRowStore implements BoardRowStore {

    private static final Logger log = LoggerFactory.getLogger(MongoBoardRowStore.class);

    private final BoardRowRepository boardRowRepository;
    private final MongoTemplate mongoTemplate;

    public MongoBoardRowStore(BoardRowRepository boardRowRepository, MongoTemplate mongoTemplate) {
        this.boardRowRepository = boardRowRepository;
        this.mongoTemplate = mongoTemplate;
    }

    @Override
    public String create(BoardRowDocument row) {
        row.setActiveTaskId(row.isActive() ? row.getTaskId() : null);
        return boardRowRepository.insert(row).getRowId();
    }

    @Override
    public Optional<BoardRowDocument> findActiveById(String id) {
        return boardRowRepository.findByRowIdAndDeletedAtIsNull(id);
    }

    @Override
    public Optional<BoardRowDocument> findById(String id, boolean includeDeleted) {
        return includeDeleted ? boardRowRepository.findById(id) : findActiveById(id);
    }

    @Override
    public boolean update(BoardRowDocument row) {
        Update update = new Update().set("listKey", row.getListKey()).set("position", row.getPosition());
        return mongoTemplate.updateFirst(activeRow(row.getRowId()), update, BoardRowDocument.class)
                .getMatchedCount() > 0;
    }

    @Override
    public boolean softDelete(String id) {
        Update update = new Update().set("deletedAt", Instant.now()).unset("activeTaskId");
        return mongoTemplate.updateFirst(activeRow(id), update, BoardRowDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean restore(String id) {
        return restoreRow(id, null);
    }

    @Override
    public boolean restoreAt(String id, int position) {
        return restoreRow(id, position);
    }

    private boolean restoreRow(String id, Integer position) {
        Optional<BoardRowDocument> row = boardRowRepository.findById(id);
        if (row.isEmpty()) {
            return false;
        }
        Query query = new Query(Criteria.where("_id").is(id).and("deletedAt").ne(null));
        Update update = new Update().unset("deletedAt").set("activeTaskId", row.get().getTaskId());
        if (position != null) {
            update.set("position", position);
        }
        return mongoTemplate.updateFirst(query, update, BoardRowDocument.class).getModifiedCount() > 0;
    }

    @Override
    public boolean existsActiveByTaskId(String taskId) {
        return boardRowRepository.existsByTaskIdAndDeletedAtIsNull(taskId);
    }

    @Override
    public Optional<BoardRowDocument> findActiveByTaskId(String taskId) {
        return boardRowRepository.findFirstByTaskIdAndDeletedAtIsNull(taskId);
    }

    @Override
    public Optional<BoardRowDocument> findLatestDeletedByTaskId(String taskId) {
        return boardRowRepository.findFirstByTaskIdAndDeletedAtIsNotNullOrderByDeletedAtDesc(taskId);
    }

    @Override
    public List<BoardRowDocument> findActiveByListKey(String listKey) {
        return boardRowRepository.findByListKeyAndDeletedAtIsNullOrderByPositionAsc(listKey);
    }

    @Override
    public List<BoardRowDocument> findActiveByListKeys(Collection<String> listKeys) {
        if (listKeys.isEmpty()) {
            return List.of();
        }
        return boardRowRepository.findByListKeyInAndDeletedAtIsNullOrderByListKeyAscPositionAsc(listKeys);
    }

    @Override
    public long countActiveByListKey(String listKey) {
        return boardRowRepository.countByListKeyAndDeletedAtIsNull(listKey);
    }

    @Override
    public List<BoardRowDocument> findAll(boolean includeDeleted) {
        return includeDeleted ? boardRowRepository.findAll() : boardRowRepository.findByDeletedAtIsNull();
    }

    @Override
    public int shiftPositions(String listKey, int fromPosition, int delta) {
        Criteria criteria = activeInList(listKey).and("position").gte(fromPosition);
        return applyShift(listKey, criteria, delta);
    }

    @Override
    public int shiftPositions(String listKey, int fromPosition, int toPosition, int delta) {
        if (toPosition < fromPosition) {
            return 0;
        }
        Criteria criteria = activeInList(listKey).and("position").gte(fromPosition).lte(toPosition);
        return applyShift(listKey, criteria, delta);
    }

    private static Query activeRow(String id) {
        return new Query(Criteria.where("_id").is(id).and("deletedAt").is(null));
    }

    private Criteria activeInList(String listKey) {
        return Criteria.where("listKey").is(listKey).and("deletedAt").is(null);
    }

    private int applyShift(String listKey, Criteria criteria, int delta) {
        if (delta == 0) {
            return 0;
        }
        long modified = mongoTemplate.updateMulti(new Query(criteria), new Update().inc("position", delta),
                BoardRowDocument.class).getModifiedCount();
        log.debug("Shifted {} rows in list {} by {}", modified, listKey, delta);
        return (int) modified;
    }
}
