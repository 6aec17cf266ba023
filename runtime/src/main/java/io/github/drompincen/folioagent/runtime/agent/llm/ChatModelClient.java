package io.github.drompincen.folioagent.runtime.agent.llm;

import io.github.drompincen.folioagent.runtime.agent.CancellationToken;

import java.util.function.Consumer;

/**
 * Boundary to the language model. One call produces one step: either final text or a
 * list of tool calls.
 */
public interface ChatModelClient {

    boolean isConfigured();

    String modelName();

    /**
     * @param tokenSink receives text fragments as they are generated
     * @throws ModelNotConfiguredException if no backend is configured
     * @throws ModelUnavailableException   if the backend call fails
     */
    ModelResponse generate(ModelRequest request, Consumer<String> tokenSink, CancellationToken cancellation);
}
