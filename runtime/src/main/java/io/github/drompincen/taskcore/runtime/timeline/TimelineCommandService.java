package io.github.drompincen.taskcore.runtime.timeline;

import io.github.drompincen.taskcore.persistence.document.TimelineRowDocument;
import io.github.drompincen.taskcore.persistence.store.TaskStore;
import io.github.drompincen.taskcore.persistence.store.TimelineRowStore;
import io.github.drompincen.taskcore.protocol.api.TimelineRowDto;
import io.github.drompincen.taskcore.protocol.event.DomainEvent;
import io.github.drompincen.taskcore.protocol.event.EventType;
import io.github.drompincen.taskcore.runtime.error.ConflictException;
import io.github.drompincen.taskcore.runtime.error.InvalidArgumentException;
import io.github.drompincen.taskcore.runtime.error.NotFoundException;
import io.github.drompincen.taskcore.runtime.event.EventAnnouncer;
import io.github.drompincen.taskcore.runtime.lock.ListKeyLockService;
import io.github.drompincen.taskcore.runtime.mapping.DtoMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Timeline row use cases. Create and restore run under the task lock so a task never ends up
 * with two active rows; the unique task index backs this up across instances.
 */
@Service
public class TimelineCommandService {

    private static final Logger log = LoggerFactory.getLogger(TimelineCommandService.class);

    private final TimelineRowStore timelineRowStore;
    private final TaskStore taskStore;
    private final ListKeyLockService lockService;
    private final EventAnnouncer announcer;
    private final TransactionOperations transactions;

    public TimelineCommandService(TimelineRowStore timelineRowStore, TaskStore taskStore,
                                  ListKeyLockService lockService, EventAnnouncer announcer,
                                  TransactionOperations transactions) {
        this.timelineRowStore = timelineRowStore;
        this.taskStore = taskStore;
        this.lockService = lockService;
        this.announcer = announcer;
        this.transactions = transactions;
    }

    public TimelineRowDto create(String taskId, Instant startAt, Instant endAt, Integer progress) {
        int effectiveProgress = progress == null ? 0 : progress;
        validate(startAt, endAt, effectiveProgress);
        return lockService.withTaskLock(taskId, () -> {
            TimelineRowDocument row = transactions.execute(status -> {
                if (taskStore.findActiveById(taskId).isEmpty()) {
                    throw NotFoundException.of("Task", taskId);
                }
                if (timelineRowStore.existsActiveByTaskId(taskId)) {
                    throw new ConflictException("Timeline row already exists for task: " + taskId);
                }
                TimelineRowDocument doc = new TimelineRowDocument();
                doc.setRowId(UUID.randomUUID().toString());
                doc.setTaskId(taskId);
                doc.setStartAt(startAt);
                doc.setEndAt(endAt);
                doc.setProgress(effectiveProgress);
                try {
                    timelineRowStore.create(doc);
                } catch (DuplicateKeyException e) {
                    throw new ConflictException("Timeline row already exists for task: " + taskId, e);
                }
                return doc;
            });
            TimelineRowDto dto = DtoMapper.toDto(row);
            announcer.announce(DomainEvent.of(EventType.TIMELINE_ROW_CREATED, dto));
            log.info("Created timeline row {} for task {}", row.getRowId(), taskId);
            return dto;
        });
    }

    /** Partial update: null arguments keep the stored value, the merged row is re-validated. */
    public TimelineRowDto update(String rowId, Instant startAt, Instant endAt, Integer progress) {
        TimelineRowDocument row = transactions.execute(status -> {
            TimelineRowDocument doc = requireActive(rowId);
            Instant mergedStart = startAt != null ? startAt : doc.getStartAt();
            Instant mergedEnd = endAt != null ? endAt : doc.getEndAt();
            int mergedProgress = progress != null ? progress : doc.getProgress();
            validate(mergedStart, mergedEnd, mergedProgress);
            doc.setStartAt(mergedStart);
            doc.setEndAt(mergedEnd);
            doc.setProgress(mergedProgress);
            if (!timelineRowStore.update(doc)) {
                throw NotFoundException.of("Timeline row", rowId);
            }
            return doc;
        });
        TimelineRowDto dto = DtoMapper.toDto(row);
        announcer.announce(DomainEvent.of(EventType.TIMELINE_ROW_UPDATED, dto));
        return dto;
    }

    public TimelineRowDto delete(String rowId) {
        TimelineRowDocument row = transactions.execute(status -> {
            TimelineRowDocument doc = requireActive(rowId);
            if (!timelineRowStore.softDelete(rowId)) {
                throw NotFoundException.of("Timeline row", rowId);
            }
            return timelineRowStore.findById(rowId, true).orElse(doc);
        });
        TimelineRowDto dto = DtoMapper.toDto(row);
        announcer.announce(DomainEvent.of(EventType.TIMELINE_ROW_DELETED, dto));
        log.info("Deleted timeline row {}", rowId);
        return dto;
    }

    public TimelineRowDto restore(String rowId) {
        TimelineRowDocument snapshot = timelineRowStore.findById(rowId, true)
                .orElseThrow(() -> NotFoundException.of("Timeline row", rowId));
        return lockService.withTaskLock(snapshot.getTaskId(), () -> {
            TimelineRowDocument row = transactions.execute(status -> {
                TimelineRowDocument doc = timelineRowStore.findById(rowId, true)
                        .orElseThrow(() -> NotFoundException.of("Timeline row", rowId));
                if (doc.isActive()) {
                    throw new ConflictException("Timeline row is not deleted: " + rowId);
                }
                if (timelineRowStore.existsActiveByTaskId(doc.getTaskId())) {
                    throw new ConflictException("Task already has an active timeline row: " + doc.getTaskId());
                }
                try {
                    if (!timelineRowStore.restore(rowId)) {
                        throw new ConflictException("Timeline row is not deleted: " + rowId);
                    }
                } catch (DuplicateKeyException e) {
                    throw new ConflictException("Task already has an active timeline row: " + doc.getTaskId(), e);
                }
                doc.setDeletedAt(null);
                return doc;
            });
            TimelineRowDto dto = DtoMapper.toDto(row);
            announcer.announce(DomainEvent.of(EventType.TIMELINE_ROW_RESTORED, dto));
            log.info("Restored timeline row {}", rowId);
            return dto;
        });
    }

    public Optional<TimelineRowDto> deleteForTask(String taskId) {
        return timelineRowStore.findActiveByTaskId(taskId).map(row -> delete(row.getRowId()));
    }

    public Optional<TimelineRowDto> restoreForTask(String taskId) {
        if (timelineRowStore.existsActiveByTaskId(taskId)) {
            return Optional.empty();
        }
        return timelineRowStore.findLatestDeletedByTaskId(taskId).map(row -> restore(row.getRowId()));
    }

    private TimelineRowDocument requireActive(String rowId) {
        return timelineRowStore.findActiveById(rowId)
                .orElseThrow(() -> NotFoundException.of("Timeline row", rowId));
    }

    private static void validate(Instant startAt, Instant endAt, int progress) {
        if (startAt == null || endAt == null) {
            throw new InvalidArgumentException("startAt and endAt are required");
        }
        if (startAt.isAfter(endAt)) {
            throw new InvalidArgumentException("startAt must not be after endAt");
        }
        if (progress < 0 || progress > 100) {
            throw new InvalidArgumentException("progress must be between 0 and 100: " + progress);
        }
    }
}
