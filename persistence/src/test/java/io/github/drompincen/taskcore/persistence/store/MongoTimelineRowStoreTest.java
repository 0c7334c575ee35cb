package io.github.drompincen.taskcore.persistence.store;

import com.mongodb.client.result.UpdateResult;
import io.github.drompincen.taskcore.persistence.document.TimelineRowDocument;
import io.github.drompincen.taskcore.persistence.repository.TimelineRowRepository;
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

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MongoTimelineRowStoreTest {

    @Mock private TimelineRowRepository timelineRowRepository;
    @Mock private MongoTemplate mongoTemplate;

    private MongoTimelineRowStore store;

    @BeforeEach
    void setUp() {
        store = new MongoTimelineRowStore(timelineRowRepository, mongoTemplate);
    }

    @Test
    void updateWritesScheduleOfActiveRowOnly() {
        TimelineRowDocument row = row();
        row.setProgress(60);
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(TimelineRowDocument.class)))
                .thenReturn(UpdateResult.acknowledged(0, 0L, null));

        assertThat(store.update(row)).isFalse();

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate).updateFirst(query.capture(), update.capture(), eq(TimelineRowDocument.class));
        Document criteria = query.getValue().getQueryObject();
        assertThat(criteria.get("_id")).isEqualTo("g1");
        assertThat(criteria.containsKey("deletedAt")).isTrue();
        assertThat(criteria.get("deletedAt")).isNull();
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertThat(set).containsOnlyKeys("startAt", "endAt", "progress");
        assertThat(set.get("progress")).isEqualTo(60);
        verify(timelineRowRepository, never()).save(any());
    }

    @Test
    void createAndRestoreClaimTaskSlotWhileSoftDeleteReleasesIt() {
        TimelineRowDocument row = row();
        when(timelineRowRepository.insert(row)).thenReturn(row);
        when(timelineRowRepository.findById("g1")).thenReturn(Optional.of(row));
        when(mongoTemplate.updateFirst(any(Query.class), any(Update.class), eq(TimelineRowDocument.class)))
                .thenReturn(UpdateResult.acknowledged(1, 1L, null));

        store.create(row);
        assertThat(row.getActiveTaskId()).isEqualTo("t1");

        store.softDelete("g1");
        store.restore("g1");

        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongoTemplate, org.mockito.Mockito.times(2))
                .updateFirst(any(Query.class), update.capture(), eq(TimelineRowDocument.class));
        Document deleteUpdate = update.getAllValues().get(0).getUpdateObject();
        assertThat(((Document) deleteUpdate.get("$unset")).containsKey("activeTaskId")).isTrue();
        Document restoreUpdate = update.getAllValues().get(1).getUpdateObject();
        assertThat(((Document) restoreUpdate.get("$set")).get("activeTaskId")).isEqualTo("t1");
    }

    private static TimelineRowDocument row() {
        TimelineRowDocument row = new TimelineRowDocument();
        row.setRowId("g1");
        row.setTaskId("t1");
        row.setStartAt(Instant.parse("2026-03-01T00:00:00Z"));
        row.setEndAt(Instant.parse("2026-03-05T00:00:00Z"));
        return row;
    }
}
