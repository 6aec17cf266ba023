package io.github.drompincen.folioagent.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record CheckpointDto(
        String threadId,
        String namespace,
        String checkpointId,
        String parentCheckpointId,
        long seq,
        int turn,
        String status,
        int messageCount,
        Instant createdAt,
        JsonNode metadata
) {}
