package io.github.drompincen.folioagent.runtime.thread;

import io.github.drompincen.folioagent.runtime.checkpoint.CheckpointStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public class ThreadManager {

    private static final Logger log = LoggerFactory.getLogger(ThreadManager.class);
    private static final DateTimeFormatter TITLE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneOffset.UTC);
    static final Duration DEFAULT_INACTIVITY = Duration.ofMinutes(30);

    private final CheckpointStore store;
    private final ThreadRegistry registry;
    private final Clock clock;
    private final String namespace;
    private final Duration inactivityTimeout;

    @Autowired
    public ThreadManager(CheckpointStore store,
                         ThreadRegistry registry,
                         Clock clock,
                         @Value("${folioagent.agent.namespace:}") String namespace,
                         @Value("${folioagent.threads.inactivity-timeout:30m}") Duration inactivityTimeout) {
        this.store = store;
        this.registry = registry;
        this.clock = clock;
        this.namespace = namespace == null ? "" : namespace;
        this.inactivityTimeout = inactivityTimeout;
    }

    public ThreadManager(CheckpointStore store, String namespace) {
        this(store, new InMemoryThreadRegistry(), Clock.systemUTC(), namespace, DEFAULT_INACTIVITY);
    }

    /**
     * Checks that {@code rawThreadId} belongs to the authenticated account. Nothing is read
     * from the store before the check passes.
     *
     * @throws InvalidThreadIdException if the id is not of the form {@code account_<n>_thread_<token>}
     * @throws AuthorizationException   if the embedded account differs from the caller's
     */
    public ThreadHandle resolve(String rawThreadId, long authenticatedAccountId) {
        ThreadKey key = ThreadKey.parse(rawThreadId);
        if (key.accountId() != authenticatedAccountId) {
            log.warn("Account {} attempted to access thread {}", authenticatedAccountId, rawThreadId);
            throw new AuthorizationException(rawThreadId, authenticatedAccountId);
        }
        return new ThreadHandle(key, namespace, store);
    }

    /**
     * Picks the thread a turn runs on. A given id is continued unless it was closed; without
     * one, the account's most recently used thread is continued if it saw activity within the
     * inactivity timeout. Otherwise a new thread is started.
     */
    public ThreadHandle open(long authenticatedAccountId, String rawThreadIdOrNull) {
        Instant now = clock.instant();
        if (rawThreadIdOrNull != null && !rawThreadIdOrNull.isBlank()) {
            ThreadHandle handle = resolve(rawThreadIdOrNull, authenticatedAccountId);
            Optional<ThreadRecord> known = registry.find(handle.threadId());
            if (known.isEmpty()) {
                registry.save(ThreadRecord.opened(handle.key(), title(now), now));
                return handle;
            }
            if (known.get().active()) {
                registry.save(known.get().touched(now));
                return handle;
            }
            log.warn("Thread {} is closed for account {}, continuing elsewhere", handle.threadId(), authenticatedAccountId);
        }

        Optional<ThreadRecord> recent = registry.mostRecentActive(authenticatedAccountId);
        if (recent.isPresent()) {
            ThreadRecord record = recent.get();
            Duration idle = Duration.between(record.lastActivity(), now);
            if (idle.compareTo(inactivityTimeout) <= 0) {
                registry.save(record.touched(now));
                return new ThreadHandle(ThreadKey.parse(record.threadId()), namespace, store);
            }
            log.info("Closing thread {} for account {} after {} of inactivity",
                    record.threadId(), authenticatedAccountId, idle);
            registry.save(record.closed(now));
        }
        return create(authenticatedAccountId, now);
    }

    public List<ThreadRecord> listActive(long authenticatedAccountId, int limit) {
        return registry.listActive(authenticatedAccountId, limit);
    }

    /**
     * Marks a thread closed so it is no longer continued. Its checkpoints are kept.
     *
     * @return false if the thread was never registered
     */
    public boolean close(String rawThreadId, long authenticatedAccountId) {
        ThreadHandle handle = resolve(rawThreadId, authenticatedAccountId);
        Optional<ThreadRecord> known = registry.find(handle.threadId());
        if (known.isEmpty()) {
            log.warn("Thread {} not found for account {}", handle.threadId(), authenticatedAccountId);
            return false;
        }
        if (known.get().active()) {
            registry.save(known.get().closed(clock.instant()));
            log.info("Closed thread {}", handle.threadId());
        }
        return true;
    }

    private ThreadHandle create(long accountId, Instant now) {
        String token = UUID.randomUUID().toString().replace("-", "");
        ThreadKey key = new ThreadKey(accountId, token);
        registry.save(ThreadRecord.opened(key, title(now), now));
        log.info("Opened new thread {}", key);
        return new ThreadHandle(key, namespace, store);
    }

    private static String title(Instant now) {
        return "Conversation " + TITLE_FORMAT.format(now);
    }
}
