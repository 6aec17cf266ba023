package io.github.drompincen.folioagent.runtime.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolCallRequest(
        String id,
        String name,
        JsonNode arguments
) {}
