package io.github.drompincen.folioagent.runtime.checkpoint;

import java.time.Instant;

public record Checkpoint(
        String threadId,
        String namespace,
        String checkpointId,
        String parentCheckpointId,
        long seq,
        ConversationState state,
        CheckpointMetadata metadata,
        Instant createdAt
) {}
