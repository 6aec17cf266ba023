package io.github.drompincen.folioagent.runtime.agent.llm;

import io.github.drompincen.folioagent.runtime.checkpoint.ToolCallRequest;

import java.util.List;

public record ModelResponse(
        String text,
        List<ToolCallRequest> toolCalls
) {
    public static ModelResponse answer(String text) {
        return new ModelResponse(text, List.of());
    }

    public static ModelResponse toolCalls(String text, List<ToolCallRequest> toolCalls) {
        return new ModelResponse(text, List.copyOf(toolCalls));
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
