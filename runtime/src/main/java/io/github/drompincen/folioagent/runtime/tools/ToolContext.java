package io.github.drompincen.folioagent.runtime.tools;

public record ToolContext(
        long accountId,
        String threadId,
        String callId
) {}
