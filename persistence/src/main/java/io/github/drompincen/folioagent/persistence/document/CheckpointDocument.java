package io.github.drompincen.folioagent.persistence.document;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One committed snapshot of a thread's conversation. The state and metadata are kept
 * as JSON strings so the mapping layer never has to guess concrete types on read.
 */
@Document(collection = "checkpoints")
@CompoundIndexes({
        @CompoundIndex(name = "thread_ns_checkpoint", def = "{'threadId': 1, 'namespace': 1, 'checkpointId': 1}", unique = true),
        @CompoundIndex(name = "thread_ns_parent", def = "{'threadId': 1, 'namespace': 1, 'parentCheckpointId': 1}", unique = true),
        @CompoundIndex(name = "thread_ns_seq", def = "{'threadId': 1, 'namespace': 1, 'seq': -1}")
})
public class CheckpointDocument {

    @Id
    private String id;
    private String threadId;
    private String namespace;
    private String checkpointId;
    private String parentCheckpointId;
    private long seq;
    private String type;
    private String checkpoint;
    private String metadata;
    private Instant createdAt;

    public CheckpointDocument() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getThreadId() { return threadId; }
    public void setThreadId(String threadId) { this.threadId = threadId; }

    public String getNamespace() { return namespace; }
    public void setNamespace(String namespace) { this.namespace = namespace; }

    public String getCheckpointId() { return checkpointId; }
    public void setCheckpointId(String checkpointId) { this.checkpointId = checkpointId; }

    public String getParentCheckpointId() { return parentCheckpointId; }
    public void setParentCheckpointId(String parentCheckpointId) { this.parentCheckpointId = parentCheckpointId; }

    public long getSeq() { return seq; }
    public void setSeq(long seq) { this.seq = seq; }

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getCheckpoint() { return checkpoint; }
    public void setCheckpoint(String checkpoint) { this.checkpoint = checkpoint; }

    public String getMetadata() { return metadata; }
    public void setMetadata(String metadata) { this.metadata = metadata; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
