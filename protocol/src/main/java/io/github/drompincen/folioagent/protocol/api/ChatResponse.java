package io.github.drompincen.folioagent.protocol.api;

import java.util.List;

public record ChatResponse(
        String threadId,
        String checkpointId,
        TurnStatus status,
        String answer,
        List<ToolEventDto> toolEvents,
        String error
) {}
