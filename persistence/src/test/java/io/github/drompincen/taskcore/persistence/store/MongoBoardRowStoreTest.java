package io.github.drompincen.taskcore.persistence.store;

import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.taskcore.persistence.document.BoardRowDocument;
import io.github.drompincen.taskcore.persistence.repository.BoardRowRepository;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoBoardRowStoreTest {

    @Mock private BoardRowRepository boardRowRepository;
    @Mock private MongoTemplate mongoTemplate;

    private MongoBoardRowStore store;

    @BeforeEach
    void setUp() {
        store = new MongoBoardRowStore(boardRowRepository, mongoTemplate);
    }

    @Test
    void shiftPositionsIncrementsActiveRowsFromPosition() {
        when(mongoTemplate.updateMulti(any(Query.class), any(Update.class), eq(BoardRowDocument.class)))
                .thenReturn(UpdateResult.acknowledged(2, 2L, null));

        int changed = store.shiftPositions("todo", 2, 1);

        assertThat(changed).isEqualTo(2);
        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateMulti(query.capture(), update.capture(), eq(BoardRowDocument.class));

        Document criteria = query.getValue().getQueryObject();
        assertThat(criteria.get("listKey")).isEqualTo("todo");
        assertThat(criteria.containsKey("deletedAt")).isTrue();
        assertThat(criteria.get("deletedAt")).isNull();
        assertThat(((Document) criteria.get("position")).get("$gte")).isEqualTo(2);

        Document inc = (Document) update.getValue().getUpdateObject().get("$inc");
        assertThat(inc.get("position")).isEqualTo(1);
    }

    @Test
    void boundedShiftAddsUpperBound() {
        when(mongoTemplate.updateMulti(any(Query.class), any(Update.class), eq(BoardRowDocument.class)))
                .thenReturn(UpdateResult.acknowledged(2, 2L, null));

        store.shiftPositions("todo", 2, 3, -1);

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate).updateMulti(query.capture(), any(Update.class), eq(BoardRowDocument.class));
        Document position = (Document) query.getValue().getQueryObject().get("position");
        assertThat(position.get("$gte")).isEqualTo(2);
        assertThat(position.get("$lte")).isEqualTo(3);
    }

    @Test
    void emptyRangeOrZeroDeltaSkipsDatabase() {
        assertThat(store.shiftPositions("todo", 4, 3, 1)).isZero();
        assertThat(store.shiftPositions("todo", 0, 0)).isZero();

        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void softDeleteReportsWhetherRowChanged() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(BoardRowDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThat(store.softDelete("r1")).isTrue();
        assertThat(store.softDelete("r1")).isFalse();

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoTemplate, org.mockito.Mockito.times(2))
                .updateFirst(query.capture(), any(Update.class), eq(BoardRowDocument.class));
        Document criteria = query.getValue().getQueryObject();
        assertThat(criteria.get("_id")).isEqualTo("r1");
        assertThat(criteria.get("deletedAt")).isNull();
    }

    @Test
    void restoreOnlyMatchesDeletedRowsAndReclaimsTaskSlot() {
        when(boardRowRepository.findById("r1")).thenReturn(Optional.of(row("r1", "t1")));
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(BoardRowDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        assertThat(store.restore("r1")).isTrue();

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(query.capture(), update.capture(), eq(BoardRowDocument.class));
        Document deletedAt = (Document) query.getValue().getQueryObject().get("deletedAt");
        assertThat(deletedAt.containsKey("$ne")).isTrue();
        Document updateObject = update.getValue().getUpdateObject();
        assertThat(((Document) updateObject.get("$unset")).containsKey("deletedAt")).isTrue();
        Document set = (Document) updateObject.get("$set");
        assertThat(set.get("activeTaskId")).isEqualTo("t1");
        assertThat(set.containsKey("position")).isFalse();
    }

    @Test
    void restoreAtWritesPositionInTheSameUpdate() {
        when(boardRowRepository.findById("r1")).thenReturn(Optional.of(row("r1", "t1")));
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(BoardRowDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        assertThat(store.restoreAt("r1", 4)).isTrue();

        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(any(Query.class), update.capture(), eq(BoardRowDocument.class));
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertThat(set.get("position")).isEqualTo(4);
        assertThat(set.get("activeTaskId")).isEqualTo("t1");
    }

    @Test
    void restoreOfUnknownRowSkipsUpdate() {
        when(boardRowRepository.findById("missing")).thenReturn(Optional.empty());

        assertThat(store.restore("missing")).isFalse();
        verifyNoInteractions(mongoTemplate);
    }

    @Test
    void createMarksRowActiveForItsTask() {
        BoardRowDocument row = row("r1", "t1");
        when(boardRowRepository.insert(row)).thenReturn(row);

        assertThat(store.create(row)).isEqualTo("r1");
        assertThat(row.getActiveTaskId()).isEqualTo("t1");
    }

    @Test
    void softDeleteReleasesTaskSlot() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(BoardRowDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        store.softDelete("r1");

        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(any(Query.class), update.capture(), eq(BoardRowDocument.class));
        assertThat(((Document) update.getValue().getUpdateObject().get("$unset")).containsKey("activeTaskId")).isTrue();
    }

    @Test
    void updateOnlyTouchesActiveRowAndItsPlacement() {
        BoardRowDocument row = row("r1", "t1");
        row.setListKey("done");
        row.setPosition(2);
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(BoardRowDocument.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        // a row deleted since it was read matches nothing
        assertThat(store.update(row)).isFalse();

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(query.capture(), update.capture(), eq(BoardRowDocument.class));
        Document criteria = query.getValue().getQueryObject();
        assertThat(criteria.get("_id")).isEqualTo("r1");
        assertThat(criteria.containsKey("deletedAt")).isTrue();
        assertThat(criteria.get("deletedAt")).isNull();
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertThat(set).containsOnlyKeys("listKey", "position");
        verify(boardRowRepository, never()).save(any());
    }

    @Test
    void updateOfUnchangedActiveRowStillSucceeds() {
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(BoardRowDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 0L, null));

        assertThat(store.update(row("r1", "t1"))).isTrue();
    }

    @Test
    void findByIdHonorsIncludeDeleted() {
        BoardRowDocument row = new BoardRowDocument();
        row.setRowId("r1");
        when(boardRowRepository.findById("r1")).thenReturn(Optional.of(row));
        when(boardRowRepository.findByRowIdAndDeletedAtIsNull("r1")).thenReturn(Optional.empty());

        assertThat(store.findById("r1", true)).contains(row);
        assertThat(store.findById("r1", false)).isEmpty();
    }

    @Test
    void findActiveByListKeysWithNoKeysReturnsEmpty() {
        assertThat(store.findActiveByListKeys(List.of())).isEmpty();
        verifyNoInteractions(boardRowRepository);
    }

    private static BoardRowDocument row(String rowId, String taskId) {
        BoardRowDocument row = new BoardRowDocument();
        row.setRowId(rowId);
        row.setTaskId(taskId);
        row.setListKey("todo");
        return row;
    }
}
