package io.github.drompincen.folioagent.runtime.thread;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed form of {@code account_<accountId>_thread_<threadId>}.
 */
public record ThreadKey(long accountId, String threadId) {

    private static final Pattern FORMAT = Pattern.compile("^account_([1-9][0-9]{0,17})_thread_([A-Za-z0-9_-]+)$");
    private static final Pattern THREAD_TOKEN = Pattern.compile("^[A-Za-z0-9_-]+$");

    public ThreadKey {
        if (accountId <= 0) {
            throw new InvalidThreadIdException("Account id must be positive: " + accountId);
        }
        if (threadId == null || !THREAD_TOKEN.matcher(threadId).matches()) {
            throw new InvalidThreadIdException("Invalid thread token: " + threadId);
        }
    }

    public static ThreadKey parse(String raw) {
        if (raw == null) {
            throw new InvalidThreadIdException("Thread id is required");
        }
        Matcher m = FORMAT.matcher(raw);
        if (!m.matches()) {
            throw new InvalidThreadIdException("Malformed thread id: " + raw);
        }
        return new ThreadKey(Long.parseLong(m.group(1)), m.group(2));
    }

    public String format() {
        return "account_" + accountId + "_thread_" + threadId;
    }

    @Override
    public String toString() {
        return format();
    }
}
