package io.github.drompincen.folioagent.protocol.event;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

public record StreamEvent(
        String threadId,
        long seq,
        StreamEventType type,
        JsonNode payload,
        Instant timestamp
) {}
