package io.github.drompincen.folioagent.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Document(collection = "checkpoint_writes")
@CompoundIndex(name = "thread_ns_checkpoint_task_idx",
        def = "{'threadId': 1, 'namespace': 1, 'checkpointId': 1, 'taskId': 1, 'idx': 1}", unique = true)
public class CheckpointWriteDocument {

    @Id
    private String id;
    private String threadId;
    private String namespace;
    private String checkpointId;
    private String taskId;
    private int idx;
    private String channel;
    private String type;
    private String value;
    private String taskPath;
    private Instant createdAt;

    public CheckpointWriteDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getThreadId() { return threadId; }
    public void setThreadId(String threadId) { this.threadId = threadId; }

    public String getNamespace() { return namespace; }
    public void setNamespace(String namespace) { this.namespace = namespace; }

    public String getCheckpointId() { return checkpointId; }
    public void setCheckpointId(String checkpointId) { this.checkpointId = checkpointId; }

    public String getTaskId() { return taskId; }
    public void setTaskId(String taskId) { this.taskId = taskId; }

    public int getIdx() { return idx; }
    public void setIdx(int idx) { this.idx = idx; }

    public String getChannel() { return channel; }
    public void setChannel(String channel) { this.channel = channel; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getValue() { return value; }
    public void setValue(String value) { this.value = value; }

    public String getTaskPath() { return taskPath; }
    public void setTaskPath(String taskPath) { this.taskPath = taskPath; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
