package io.github.drompincen.folioagent.runtime.thread;

import io.github.drompincen.folioagent.runtime.checkpoint.Checkpoint;
import io.github.drompincen.folioagent.runtime.checkpoint.CheckpointMetadata;
import io.github.drompincen.folioagent.runtime.checkpoint.CheckpointStore;
import io.github.drompincen.folioagent.runtime.checkpoint.ConversationState;
import io.github.drompincen.folioagent.runtime.checkpoint.PendingWrite;

import java.util.List;
import java.util.Optional;

/**
 * A thread whose ownership has already been checked. All store access for the thread goes
 * through here.
 */
public class ThreadHandle {

    private final ThreadKey key;
    private final String namespace;
    private final CheckpointStore store;

    ThreadHandle(ThreadKey key, String namespace, CheckpointStore store) {
        this.key = key;
        this.namespace = namespace;
        this.store = store;
    }

    public ThreadKey key() { return key; }
    public String threadId() { return key.format(); }
    public long accountId() { return key.accountId(); }
    public String namespace() { return namespace; }

    public Optional<Checkpoint> loadState() {
        return store.loadLatest(threadId(), namespace);
    }

    /**
     * @throws io.github.drompincen.folioagent.runtime.checkpoint.CheckpointConflictException unchanged from the store
     */
    public Checkpoint commit(String parentCheckpointId, ConversationState baseState,
                             List<PendingWrite> writes, CheckpointMetadata metadata) {
        return store.append(threadId(), namespace, parentCheckpointId, baseState, writes, metadata);
    }

    public void stage(String parentCheckpointId, String taskId, List<PendingWrite> writes) {
        store.putWrites(threadId(), namespace, parentCheckpointId, taskId, writes);
    }

    /**
     * Drops writes staged against a checkpoint this thread has moved past.
     */
    public void discardStaged(String parentCheckpointId) {
        store.deleteWrites(threadId(), namespace, parentCheckpointId);
    }

    public List<Checkpoint> history(int limit) {
        return store.history(threadId(), namespace, limit);
    }
}
