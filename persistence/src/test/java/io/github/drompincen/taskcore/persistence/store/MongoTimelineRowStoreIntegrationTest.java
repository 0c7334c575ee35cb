package io.github.drompincen.taskcore.persistence.store;

import io.github.drompincen.taskcore.persistence.AbstractMongoIntegrationTest;
import io.github.drompincen.taskcore.persistence.document.TimelineRowDocument;
import io.github.drompincen.taskcore.persistence.repository.TimelineRowRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MongoTimelineRowStoreIntegrationTest extends AbstractMongoIntegrationTest {

    private static final Instant START = Instant.parse("2026-03-01T00:00:00Z");

    @Autowired
    private TimelineRowRepository timelineRowRepository;

    private MongoTimelineRowStore store;

    @BeforeEach
    void setUp() {
        store = new MongoTimelineRowStore(timelineRowRepository, mongoTemplate);
    }

    @Test
    void secondActiveRowForTaskIsRejectedUntilFirstIsDeleted() {
        store.create(row("g1", "T"));

        assertThatThrownBy(() -> store.create(row("g2", "T"))).isInstanceOf(DuplicateKeyException.class);

        store.softDelete("g1");
        store.create(row("g2", "T"));

        assertThatThrownBy(() -> store.restore("g1")).isInstanceOf(DuplicateKeyException.class);
        assertThat(store.findActiveById("g1")).isEmpty();
    }

    @Test
    void updateOfDeletedRowIsRefused() {
        store.create(row("g1", "T"));
        TimelineRowDocument stale = store.findActiveById("g1").orElseThrow();
        store.softDelete("g1");

        stale.setProgress(90);

        assertThat(store.update(stale)).isFalse();
        assertThat(store.findById("g1", true)).hasValueSatisfying(row -> {
            assertThat(row.getDeletedAt()).isNotNull();
            assertThat(row.getProgress()).isEqualTo(10);
        });
    }

    private static TimelineRowDocument row(String rowId, String taskId) {
        TimelineRowDocument row = new TimelineRowDocument();
        row.setRowId(rowId);
        row.setTaskId(taskId);
        row.setStartAt(START);
        row.setEndAt(START.plus(3, ChronoUnit.DAYS));
        row.setProgress(10);
        return row;
    }
}
