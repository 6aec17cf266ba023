package io.github.drompincen.folioagent.runtime.agent.llm;

public class ModelNotConfiguredException extends RuntimeException {

    public ModelNotConfiguredException() {
        super("No language model is configured. Set an Anthropic or OpenAI API key.");
    }
}
