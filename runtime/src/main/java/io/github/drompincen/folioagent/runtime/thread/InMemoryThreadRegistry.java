package io.github.drompincen.folioagent.runtime.thread;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(name = "folioagent.checkpoint.store", havingValue = "memory")
public class InMemoryThreadRegistry implements ThreadRegistry {

    private final Map<String, ThreadRecord> records = new ConcurrentHashMap<>();

    @Override
    public Optional<ThreadRecord> find(String threadId) {
        return Optional.ofNullable(records.get(threadId));
    }

    @Override
    public Optional<ThreadRecord> mostRecentActive(long accountId) {
        return activeFor(accountId).stream().findFirst();
    }

    @Override
    public List<ThreadRecord> listActive(long accountId, int limit) {
        return activeFor(accountId).stream().limit(limit).toList();
    }

    @Override
    public void save(ThreadRecord record) {
        records.put(record.threadId(), record);
    }

    private List<ThreadRecord> activeFor(long accountId) {
        return records.values().stream()
                .filter(r -> r.accountId() == accountId && r.active())
                .sorted(Comparator.comparing(ThreadRecord::lastActivity).reversed())
                .toList();
    }
}
