package io.github.drompincen.folioagent.runtime.checkpoint;

import io.github.drompincen.folioagent.protocol.api.TurnStatus;

public record CheckpointMetadata(
        CheckpointSource source,
        TurnStatus status,
        String error,
        int iterations,
        Long accountId,
        int writes
) {
    public static CheckpointMetadata turn(long accountId) {
        return new CheckpointMetadata(CheckpointSource.TURN, null, null, 0, accountId, 0);
    }

    public static CheckpointMetadata compaction(long accountId) {
        return new CheckpointMetadata(CheckpointSource.COMPACTION, null, null, 0, accountId, 0);
    }

    /** Copies the control values of the merged state into this metadata. */
    public CheckpointMetadata completedFrom(ConversationState merged, int writeCount) {
        return new CheckpointMetadata(source, merged.getStatus(), merged.getError(),
                merged.getIterations(), accountId, writeCount);
    }
}
