package io.github.drompincen.folioagent.runtime.tools;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A domain operation the model may call. Implementations never receive an account id from
 * their input; the caller's account arrives through {@link ToolContext}.
 */
public interface Tool {

    String name();

    String description();

    JsonNode inputSchema();

    ToolResult execute(ToolContext ctx, JsonNode input);

    /** Short progress line shown to the user while the tool runs. */
    default String statusMessage() {
        return "Running " + name() + "...";
    }
}
