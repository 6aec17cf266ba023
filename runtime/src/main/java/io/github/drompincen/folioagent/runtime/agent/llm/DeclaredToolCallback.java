package io.github.drompincen.folioagent.runtime.agent.llm;

import io.github.drompincen.folioagent.protocol.api.ToolDescriptor;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * Advertises a tool to the model. Execution stays with the orchestrator, so this callback
 * is never invoked by Spring AI.
 */
class DeclaredToolCallback implements ToolCallback {

    private final ToolDefinition definition;

    DeclaredToolCallback(ToolDescriptor descriptor) {
        this.definition = ToolDefinition.builder()
                .name(descriptor.name())
                .description(descriptor.description())
                .inputSchema(descriptor.inputSchema().toString())
                .build();
    }

    @Override
    public ToolDefinition getToolDefinition() {
        return definition;
    }

    @Override
    public String call(String toolInput) {
        throw new UnsupportedOperationException("Tool " + definition.name() + " is executed by the orchestrator");
    }
}
