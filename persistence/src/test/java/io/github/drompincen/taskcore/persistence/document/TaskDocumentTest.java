package io.github.drompincen.taskcore.persistence.document;

import io.github.drompincen.taskcore.protocol.api.TaskDto;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TaskDocumentTest {

    @Test
    void fieldsAreSetCorrectly() {
        TaskDocument doc = new TaskDocument();
        Instant now = Instant.now();

        doc.setTaskId("t1");
        doc.setTitle("Write report");
        doc.setDescription("quarterly");
        doc.setStatus(TaskDto.TaskStatus.IN_PROGRESS);
        doc.setPriority(TaskDto.TaskPriority.HIGH);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);

        assertThat(doc.getTaskId()).isEqualTo("t1");
        assertThat(doc.getTitle()).isEqualTo("Write report");
        assertThat(doc.getDescription()).isEqualTo("quarterly");
        assertThat(doc.getStatus()).isEqualTo(TaskDto.TaskStatus.IN_PROGRESS);
        assertThat(doc.getPriority()).isEqualTo(TaskDto.TaskPriority.HIGH);
        assertThat(doc.getCreatedAt()).isEqualTo(now);
        assertThat(doc.isActive()).isTrue();

        doc.setDeletedAt(now);
        assertThat(doc.isActive()).isFalse();
    }
}
