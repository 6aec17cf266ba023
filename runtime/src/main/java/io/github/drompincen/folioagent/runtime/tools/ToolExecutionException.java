package io.github.drompincen.folioagent.runtime.tools;

/**
 * A tool call that could not produce a result: bad arguments, a failing domain call or a
 * timeout. Recorded in the transcript as an error result.
 */
public class ToolExecutionException extends RuntimeException {

    private final String toolName;

    public ToolExecutionException(String toolName, String message) {
        super(message);
        this.toolName = toolName;
    }

    public ToolExecutionException(String toolName, String message, Throwable cause) {
        super(message, cause);
        this.toolName = toolName;
    }

    public String getToolName() { return toolName; }
}
