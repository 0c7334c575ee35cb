package io.github.drompincen.taskcore.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "board_rows")
@CompoundIndexes({
        @CompoundIndex(name = "list_position", def = "{'listKey': 1, 'deletedAt': 1, 'position': 1}"),
        @CompoundIndex(name = "task_deleted", def = "{'taskId': 1, 'deletedAt': 1}")
})
public class BoardRowDocument {

    @Id
    private String rowId;
    private String taskId;
    private String listKey;
    private int position;
    private Instant deletedAt;
    /** Copy of taskId while the row is active, absent once deleted. */
    @Indexed(name = "task_active", unique = true, sparse = true)
    private String activeTaskId;

    public BoardRowDocument() {}

    public boolean isActive() { return deletedAt == null; }

    public String getRowId() { return rowId; }
    public void setRowId(String rowId) { this.rowId = rowId; }

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }

    public String getListKey() { return listKey; }
    public void setListKey(String listKey) { this.listKey = listKey; }

    public int getPosition() { return position; }
    public void setPosition(int position) { this.position = position; }

    public Instant getDeletedAt() { return deletedAt; }
    public void setDeletedAt(Instant deletedAt) { this.deletedAt = deletedAt; }

    public String getActiveTaskId() { return activeTaskId; }
    public void setActiveTaskId(String activeTaskId) { this.activeTaskId = activeTaskId; }
}
