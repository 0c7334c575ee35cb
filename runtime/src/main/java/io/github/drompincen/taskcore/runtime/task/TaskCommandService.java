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
import io.github.drompincen.taskcore.runtime.mapping.DtoMapper;
import io.github.drompincen.taskcore.runtime.timeline.TimelineCommandService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Instant;
import java.util.UUID;

/**
 * Task use cases. Delete and restore cascade to the task's timeline and board rows as separate
 * child commands after the task itself has changed; a failing child is logged and left behind
 * rather than undoing the parent.
 */
@Service
public class TaskCommandService {

    private static final Logger log = LoggerFactory.getLogger(TaskCommandService.class);
    private static final int MAX_TITLE_LENGTH = 255;
    private static final int MAX_DESCRIPTION_LENGTH = 10000;

    private final TaskStore taskStore;
    private final TimelineCommandService timelineCommandService;
    private final BoardCommandService boardCommandService;
    private final EventAnnouncer announcer;
    private final TransactionOperations transactions;

    public TaskCommandService(TaskStore taskStore, TimelineCommandService timelineCommandService,
                              BoardCommandService boardCommandService, EventAnnouncer announcer,
                              TransactionOperations transactions) {
        this.taskStore = taskStore;
        this.timelineCommandService = timelineCommandService;
        this.boardCommandService = boardCommandService;
        this.announcer = announcer;
        this.transactions = transactions;
    }

    public TaskDto create(CreateTaskRequest request) {
        validateTitle(request.title());
        validateDescription(request.description());
        Instant now = Instant.now();
        TaskDocument task = new TaskDocument();
        task.setTaskId(UUID.randomUUID().toString());
        task.setTitle(request.title().trim());
        task.setDescription(request.description());
        task.setStatus(request.status() != null ? request.status() : TaskDto.TaskStatus.PENDING);
        task.setPriority(request.priority() != null ? request.priority() : TaskDto.TaskPriority.MEDIUM);
        task.setCreatedAt(now);
        task.setUpdatedAt(now);
        taskStore.create(task);

        TaskDto dto = DtoMapper.toDto(task);
        announcer.announce(DomainEvent.of(EventType.TASK_CREATED, dto));
        log.info("Created task {}", task.getTaskId());
        return dto;
    }

    public TaskDto update(String taskId, UpdateTaskRequest request) {
        if (request.title() != null) {
            validateTitle(request.title());
        }
        validateDescription(request.description());
        TaskDocument task = transactions.execute(status -> {
            TaskDocument doc = taskStore.findActiveById(taskId)
                    .orElseThrow(() -> NotFoundException.of("Task", taskId));
            if (request.title() != null) doc.setTitle(request.title().trim());
            if (request.description() != null) doc.setDescription(request.description());
            if (request.status() != null) doc.setStatus(request.status());
            if (request.priority() != null) doc.setPriority(request.priority());
            doc.setUpdatedAt(Instant.now());
            if (!taskStore.update(doc)) {
                throw NotFoundException.of("Task", taskId);
            }
            return doc;
        });
        TaskDto dto = DtoMapper.toDto(task);
        announcer.announce(DomainEvent.of(EventType.TASK_UPDATED, dto));
        return dto;
    }

    public TaskDto delete(String taskId) {
        TaskDocument task = transactions.execute(status -> {
            TaskDocument doc = taskStore.findActiveById(taskId)
                    .orElseThrow(() -> NotFoundException.of("Task", taskId));
            if (!taskStore.softDelete(taskId)) {
                throw NotFoundException.of("Task", taskId);
            }
            return taskStore.findById(taskId, true).orElse(doc);
        });
        TaskDto dto = DtoMapper.toDto(task);
        announcer.announce(DomainEvent.of(EventType.TASK_DELETED, dto));
        log.info("Deleted task {}", taskId);

        cascade(taskId, "timeline row delete", () -> timelineCommandService.deleteForTask(taskId));
        cascade(taskId, "board row delete", () -> boardCommandService.deleteForTask(taskId));
        return dto;
    }

    public TaskDto restore(String taskId) {
        TaskDocument task = transactions.execute(status -> {
            TaskDocument doc = taskStore.findById(taskId, true)
                    .orElseThrow(() -> NotFoundException.of("Task", taskId));
            if (doc.isActive()) {
                throw new ConflictException("Task is not deleted: " + taskId);
            }
            if (!taskStore.restore(taskId)) {
                throw new ConflictException("Task is not deleted: " + taskId);
            }
            return taskStore.findById(taskId, true).orElse(doc);
        });
        TaskDto dto = DtoMapper.toDto(task);
        announcer.announce(DomainEvent.of(EventType.TASK_RESTORED, dto));
        log.info("Restored task {}", taskId);

        cascade(taskId, "timeline row restore", () -> timelineCommandService.restoreForTask(taskId));
        cascade(taskId, "board row restore", () -> boardCommandService.restoreForTask(taskId));
        return dto;
    }

    private void cascade(String taskId, String step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Cascade {} failed for task {}; child row left as is: {}", step, taskId, e.getMessage());
        }
    }

    private static void validateTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new InvalidArgumentException("title must not be blank");
        }
        if (title.length() > MAX_TITLE_LENGTH) {
            throw new InvalidArgumentException("title must be at most " + MAX_TITLE_LENGTH + " characters");
        }
    }

    private static void validateDescription(String description) {
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            throw new InvalidArgumentException("description must be at most " + MAX_DESCRIPTION_LENGTH + " characters");
        }
    }
}
