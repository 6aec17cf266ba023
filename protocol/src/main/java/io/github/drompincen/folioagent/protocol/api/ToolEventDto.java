package io.github.drompincen.folioagent.protocol.api;

import com.fasterxml.jackson.databind.JsonNode;

public record ToolEventDto(
        String callId,
        String toolName,
        JsonNode input,
        JsonNode output,
        boolean success,
        String error
) {}
