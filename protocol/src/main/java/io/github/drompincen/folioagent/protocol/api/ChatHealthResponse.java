package io.github.drompincen.folioagent.protocol.api;

public record ChatHealthResponse(
        String status,
        boolean modelConfigured,
        String modelName
) {
    public static ChatHealthResponse of(boolean configured, String modelName) {
        return new ChatHealthResponse(configured ? "healthy" : "not_configured",
                configured, configured ? modelName : "not_configured");
    }
}
