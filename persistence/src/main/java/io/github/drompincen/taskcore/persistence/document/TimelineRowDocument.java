package io.github.drompincen.taskcore.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "timeline_rows")
public class TimelineRowDocument {

    @Id
    private String rowId;
    @Indexed
    private String taskId;
    private Instant startAt;
    private Instant endAt;
    private int progress;
    private Instant deletedAt;
    /** Copy of taskId while the row is active, absent once deleted. */
    @Indexed(name = "task_active", unique = true, sparse = true)
    private String activeTaskId;

    public TimelineRowDocument() {}

    public boolean isActive() { return deletedAt == null; }

    public String getRowId() { return rowId; }
    public void setRowId(String rowId) { this.rowId = rowId; }

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }

    public Instant getStartAt() { return startAt; }
    public void setStartAt(Instant startAt) { this.startAt = startAt; }

    public Instant getEndAt() { return endAt; }
    public void setEndAt(Instant endAt) { this.endAt = endAt; }

    public int getProgress() { return progress; }
    public void setProgress(int progress) { this.progress = progress; }

    public Instant getDeletedAt() { return deletedAt; }
    public void setDeletedAt(Instant deletedAt) { this.deletedAt = deletedAt; }

    public String getActiveTaskId() { return activeTaskId; }
    public void setActiveTaskId(String activeTaskId) { this.activeTaskId = activeTaskId; }
}
