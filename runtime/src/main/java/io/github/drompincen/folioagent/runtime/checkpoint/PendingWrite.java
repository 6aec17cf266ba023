package io.github.drompincen.folioagent.runtime.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A delta produced by one task, targeted at a single channel. Not part of the conversation
 * until merged by a successful append.
 */
public record PendingWrite(
        String taskId,
        int idx,
        String channel,
        JsonNode value,
        String taskPath
) {}
