package io.github.drompincen.folioagent.runtime.thread;

import java.util.List;
import java.util.Optional;

/**
 * Tracks thread lifecycle per account. Implementations report failures as
 * {@link io.github.drompincen.folioagent.runtime.checkpoint.CheckpointStorageException}.
 */
public interface ThreadRegistry {

    Optional<ThreadRecord> find(String threadId);

    Optional<ThreadRecord> mostRecentActive(long accountId);

    /**
     * Active threads of the account, most recently used first.
     */
    List<ThreadRecord> listActive(long accountId, int limit);

    void save(ThreadRecord record);
}
