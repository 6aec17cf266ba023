package io.github.drompincen.folioagent.runtime.agent.llm;

import io.github.drompincen.folioagent.protocol.api.ToolDescriptor;
import io.github.drompincen.folioagent.runtime.checkpoint.ChatMessage;

import java.util.List;

public record ModelRequest(
        String systemPrompt,
        List<ChatMessage> transcript,
        List<ToolDescriptor> tools
) {}
