package io.github.drompincen.folioagent.protocol.api;

import java.time.Instant;

public record ThreadSummaryDto(
        String threadId,
        String title,
        boolean active,
        Instant lastActivity,
        Instant createdAt
) {}
