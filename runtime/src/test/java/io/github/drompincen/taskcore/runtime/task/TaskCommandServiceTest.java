package io.github.drompincen.taskcore.runtime.task;

import io.github.drompincen.taskcore.persistence.document.TaskDocument;
import io.github.drompincen.taskcore.persistence.store.TaskStore;
import io.github.drompincen.taskcore.protocol.api.CreateTaskRequest;
import io.github.drompincen.taskcore.protocol.api.TaskDto;
import io.github.drompincen.taskcore.protocol.api.UpdateTaskRequest;
import io.github.drompincen.taskcore.protocol.event.DomainEvent;
import io.github.drompincen.taskcore.protocol.event.EventType;
import io.github.drompincen.taskcore.runtime.board.BoardCommandService;
import io.github.drompincen.taskcore.runtime.error.ConflictException;
import io.github.drompincen.taskcore.runtime.error.InvalidArgumentException;
import io.github.drompincen.taskcore.runtime.error.NotFoundException;
import io.github.drompincen.taskcore.runtime.event.EventAnnouncer;
import io.github.drompincen.taskcore.runtime.timeline.TimelineCommandService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TaskCommandServiceTest {

    @Mock private TaskStore taskStore;
    @Mock private TimelineCommandService timelineCommandService;
    @Mock private BoardCommandService boardCommandService;
    @Mock private EventAnnouncer announcer;

    private TaskCommandService service;

    @BeforeEach
    void setUp() {
        service = new TaskCommandService(taskStore, timelineCommandService, boardCommandService, announcer,
                TransactionOperations.withoutTransaction());
    }

    @Test
    void createAppliesDefaultsAndAnnounces() {
        TaskDto created = service.create(new CreateTaskRequest("  Write report ", null, null, null));

        assertThat(created.title()).isEqualTo("Write report");
        assertThat(created.status()).isEqualTo(TaskDto.TaskStatus.PENDING);
        assertThat(created.priority()).isEqualTo(TaskDto.TaskPriority.MEDIUM);
        assertThat(created.createdAt()).isEqualTo(created.updatedAt());
        verify(taskStore).create(any(TaskDocument.class));

        ArgumentCaptor<DomainEvent> event = ArgumentCaptor.forClass(DomainEvent.class);
        verify(announcer).announce(event.capture());
        assertThat(event.getValue().type()).isEqualTo(EventType.TASK_CREATED);
        assertThat(event.getValue().taskId()).isEqualTo(created.taskId());
    }

    @Test
    void createRejectsBlankTitle() {
        assertThatThrownBy(() -> service.create(new CreateTaskRequest(" ", null, null, null)))
                .isInstanceOf(InvalidArgumentException.class);
        verify(taskStore, never()).create(any());
    }

    @Test
    void updateMergesProvidedFields() {
        TaskDocument stored = task("t1");
        when(taskStore.findActiveById("t1")).thenReturn(Optional.of(stored));
        when(taskStore.update(stored)).thenReturn(true);

        TaskDto updated = service.update("t1", new UpdateTaskRequest(null, "details", TaskDto.TaskStatus.DONE, null));

        assertThat(updated.title()).isEqualTo("Original");
        assertThat(updated.description()).isEqualTo("details");
        assertThat(updated.status()).isEqualTo(TaskDto.TaskStatus.DONE);
        assertThat(updated.priority()).isEqualTo(TaskDto.TaskPriority.HIGH);
        assertThat(updated.updatedAt()).isAfterOrEqualTo(stored.getCreatedAt());
    }

    @Test
    void updateOfMissingTaskIsNotFound() {
        when(taskStore.findActiveById("t1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.update("t1", new UpdateTaskRequest("x", null, null, null)))
                .isInstanceOf(NotFoundException.class);
        verify(announcer, never()).announce(any());
    }

    @Test
    void deleteAnnouncesThenCascadesToChildren() {
        TaskDocument stored = task("t1");
        TaskDocument deleted = task("t1");
        deleted.setDeletedAt(Instant.now());
        when(taskStore.findActiveById("t1")).thenReturn(Optional.of(stored));
        when(taskStore.softDelete("t1")).thenReturn(true);
        when(taskStore.findById("t1", true)).thenReturn(Optional.of(deleted));

        TaskDto result = service.delete("t1");

        assertThat(result.deletedAt()).isNotNull();
        InOrder order = inOrder(taskStore, announcer, timelineCommandService, boardCommandService);
        order.verify(taskStore).softDelete("t1");
        order.verify(announcer).announce(any(DomainEvent.class));
        order.verify(timelineCommandService).deleteForTask("t1");
        order.verify(boardCommandService).deleteForTask("t1");
    }

    @Test
    void failingCascadeDoesNotFailParent() {
        TaskDocument stored = task("t1");
        when(taskStore.findActiveById("t1")).thenReturn(Optional.of(stored));
        when(taskStore.softDelete("t1")).thenReturn(true);
        when(taskStore.findById("t1", true)).thenReturn(Optional.of(stored));
        when(timelineCommandService.deleteForTask("t1")).thenThrow(new IllegalStateException("db down"));

        service.delete("t1");

        verify(boardCommandService).deleteForTask("t1");
    }

    @Test
    void restoreOfActiveTaskIsConflict() {
        when(taskStore.findById("t1", true)).thenReturn(Optional.of(task("t1")));

        assertThatThrownBy(() -> service.restore("t1")).isInstanceOf(ConflictException.class);
        verify(taskStore, never()).restore(any());
    }

    @Test
    void restoreCascadesToChildren() {
        TaskDocument deleted = task("t1");
        deleted.setDeletedAt(Instant.now());
        TaskDocument restored = task("t1");
        when(taskStore.findById("t1", true)).thenReturn(Optional.of(deleted), Optional.of(restored));
        when(taskStore.restore("t1")).thenReturn(true);

        TaskDto result = service.restore("t1");

        assertThat(result.deletedAt()).isNull();
        verify(timelineCommandService).restoreForTask("t1");
        verify(boardCommandService).restoreForTask("t1");
    }

    @Test
    void restoreOfUnknownTaskIsNotFound() {
        when(taskStore.findById("t1", true)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.restore("t1")).isInstanceOf(NotFoundException.class);
    }

    private static TaskDocument task(String id) {
        TaskDocument doc = new TaskDocument();
        doc.setTaskId(id);
        doc.setTitle("Original");
        doc.setStatus(TaskDto.TaskStatus.PENDING);
        doc.setPriority(TaskDto.TaskPriority.HIGH);
        doc.setCreatedAt(Instant.now());
        doc.setUpdatedAt(Instant.now());
        return doc;
    }
}
