package io.github.drompincen.folioagent.runtime.agent;

import io.github.drompincen.folioagent.protocol.api.ToolEventDto;
import io.github.drompincen.folioagent.protocol.api.TurnStatus;

import java.util.List;

public record TurnResult(
        String threadId,
        String checkpointId,
        TurnStatus status,
        String answer,
        List<ToolEventDto> toolEvents,
        String errorKind,
        String error
) {}
