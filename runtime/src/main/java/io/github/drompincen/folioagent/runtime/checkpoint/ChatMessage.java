package io.github.drompincen.folioagent.runtime.checkpoint;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One transcript entry. Assistant messages may carry tool-call requests; tool messages
 * answer exactly one of those requests by id.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatMessage(
        String role,
        String content,
        List<ToolCallRequest> toolCalls,
        String toolCallId,
        String toolName,
        ToolCallStatus status
) {
    public static final String SYSTEM = "system";
    public static final String USER = "user";
    public static final String ASSISTANT = "assistant";
    public static final String TOOL = "tool";

    public static ChatMessage user(String content) {
        return new ChatMessage(USER, content, null, null, null, null);
    }

    public static ChatMessage assistant(String content) {
        return new ChatMessage(ASSISTANT, content, null, null, null, null);
    }

    public static ChatMessage assistantToolCalls(String content, List<ToolCallRequest> toolCalls) {
        return new ChatMessage(ASSISTANT, content, List.copyOf(toolCalls), null, null, null);
    }

    public static ChatMessage toolResult(String toolCallId, String toolName, ToolCallStatus status, String content) {
        return new ChatMessage(TOOL, content, null, toolCallId, toolName, status);
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }
}
