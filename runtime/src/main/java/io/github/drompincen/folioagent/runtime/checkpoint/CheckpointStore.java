package io.github.drompincen.folioagent.runtime.checkpoint;

import java.util.List;
import java.util.Optional;

/**
 * Append-only storage of conversation checkpoints, chained per (thread, namespace).
 */
public interface CheckpointStore {

    Optional<Checkpoint> loadLatest(String threadId, String namespace);

    Optional<Checkpoint> load(String threadId, String namespace, String checkpointId);

    /**
     * Newest first, following parent pointers from the latest checkpoint.
     */
    List<Checkpoint> history(String threadId, String namespace, int limit);

    /**
     * Merges {@code pendingWrites} into {@code baseState} and commits the result as the child
     * of {@code parentCheckpointId}. Either the whole checkpoint becomes visible or nothing does.
     *
     * @throws CheckpointConflictException if {@code parentCheckpointId} is not the current latest
     * @throws CheckpointStorageException  if the store cannot be reached
     */
    Checkpoint append(String threadId, String namespace, String parentCheckpointId,
                      ConversationState baseState, List<PendingWrite> pendingWrites,
                      CheckpointMetadata metadata);

    void putWrites(String threadId, String namespace, String checkpointId, String taskId,
                   List<PendingWrite> writes);

    /**
     * Staged writes for a checkpoint, ordered by task id then idx.
     */
    List<PendingWrite> listWrites(String threadId, String namespace, String checkpointId);

    /**
     * Best effort: called once the checkpoint the writes were staged for has been passed, so a
     * failure is logged rather than thrown.
     */
    void deleteWrites(String threadId, String namespace, String checkpointId);

    /** Key under which writes staged before the first checkpoint are kept. */
    static String stagingKey(String checkpointId) {
        return checkpointId == null ? "" : checkpointId;
    }
}
