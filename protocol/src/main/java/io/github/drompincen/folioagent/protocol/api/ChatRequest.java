package io.github.drompincen.folioagent.protocol.api;

/**
 * Chat request body. The account is never part of the body: it comes from the
 * authenticated caller context resolved upstream.
 */
public record ChatRequest(
        String query,
        String threadId,
        boolean voiceMode
) {
    public ChatRequest(String query, String threadId) {
        this(query, threadId, false);
    }
}
