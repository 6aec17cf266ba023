package io.github.drompincen.folioagent.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.folioagent.runtime.checkpoint.ToolCallRequest;

public record ToolOutcome(
        ToolCallRequest call,
        boolean success,
        JsonNode output,
        String error
) {
    public static ToolOutcome success(ToolCallRequest call, JsonNode output) {
        return new ToolOutcome(call, true, output, null);
    }

    public static ToolOutcome failure(ToolCallRequest call, String error) {
        return new ToolOutcome(call, false, null, error);
    }
}
