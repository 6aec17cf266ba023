package io.github.drompincen.folioagent.runtime.thread;

/**
 * The thread belongs to a different account than the authenticated caller.
 */
public class AuthorizationException extends RuntimeException {

    private final long authenticatedAccountId;

    public AuthorizationException(String threadId, long authenticatedAccountId) {
        super("Account " + authenticatedAccountId + " is not allowed to access thread " + threadId);
        this.authenticatedAccountId = authenticatedAccountId;
    }

    public long getAuthenticatedAccountId() { return authenticatedAccountId; }
}
