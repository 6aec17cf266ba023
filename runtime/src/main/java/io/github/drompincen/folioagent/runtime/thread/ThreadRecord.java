package io.github.drompincen.folioagent.runtime.thread;

import java.time.Instant;

/**
 * Registry entry for a conversation thread: who owns it, when it was last used and
 * whether it may still be continued.
 */
public record ThreadRecord(
        String threadId,
        long accountId,
        String title,
        boolean active,
        Instant lastActivity,
        Instant createdAt,
        Instant updatedAt
) {
    public static ThreadRecord opened(ThreadKey key, String title, Instant now) {
        return new ThreadRecord(key.format(), key.accountId(), title, true, now, now, now);
    }

    public ThreadRecord touched(Instant now) {
        return new ThreadRecord(threadId, accountId, title, active, now, createdAt, now);
    }

    public ThreadRecord closed(Instant now) {
        return new ThreadRecord(threadId, accountId, title, false, lastActivity, createdAt, now);
    }
}
