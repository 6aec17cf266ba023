package io.github.drompincen.folioagent.runtime.checkpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Heap-backed store for local runs and tests. Each chain is replaced atomically through
 * {@link ConcurrentHashMap#compute}, which gives the same compare-and-append semantics as
 * the Mongo unique index.
 */
@Component
@ConditionalOnProperty(name = "folioagent.checkpoint.store", havingValue = "memory")
public class InMemoryCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryCheckpointStore.class);

    private final StateMerger stateMerger;
    private final Map<String, List<Checkpoint>> chains = new ConcurrentHashMap<>();
    private final Map<String, List<PendingWrite>> writes = new ConcurrentHashMap<>();

    public InMemoryCheckpointStore(StateMerger stateMerger) {
        this.stateMerger = stateMerger;
    }

    @Override
    public Optional<Checkpoint> loadLatest(String threadId, String namespace) {
        List<Checkpoint> chain = chains.get(chainKey(threadId, namespace));
        if (chain == null || chain.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(chain.get(chain.size() - 1));
    }

    @Override
    public Optional<Checkpoint> load(String threadId, String namespace, String checkpointId) {
        List<Checkpoint> chain = chains.getOrDefault(chainKey(threadId, namespace), List.of());
        return chain.stream().filter(c -> c.checkpointId().equals(checkpointId)).findFirst();
    }

    @Override
    public List<Checkpoint> history(String threadId, String namespace, int limit) {
        List<Checkpoint> result = new ArrayList<>();
        Optional<Checkpoint> current = loadLatest(threadId, namespace);
        while (current.isPresent() && result.size() < limit) {
            Checkpoint cp = current.get();
            result.add(cp);
            current = cp.parentCheckpointId() == null
                    ? Optional.empty()
                    : load(threadId, namespace, cp.parentCheckpointId());
        }
        return result;
    }

    @Override
    public Checkpoint append(String threadId, String namespace, String parentCheckpointId,
                             ConversationState baseState, List<PendingWrite> pendingWrites,
                             CheckpointMetadata metadata) {
        ConversationState merged = stateMerger.merge(baseState, pendingWrites, metadata.source());
        Checkpoint[] committed = new Checkpoint[1];
        chains.compute(chainKey(threadId, namespace), (key, chain) -> {
            List<Checkpoint> current = chain == null ? List.of() : chain;
            String latestId = current.isEmpty() ? null : current.get(current.size() - 1).checkpointId();
            if (!Objects.equals(latestId, parentCheckpointId)) {
                throw new CheckpointConflictException(threadId, parentCheckpointId, latestId);
            }
            long seq = current.isEmpty() ? 1 : current.get(current.size() - 1).seq() + 1;
            Checkpoint cp = new Checkpoint(threadId, namespace, UUID.randomUUID().toString(),
                    parentCheckpointId, seq, merged, metadata.completedFrom(merged, pendingWrites.size()),
                    Instant.now());
            List<Checkpoint> next = new ArrayList<>(current);
            next.add(cp);
            committed[0] = cp;
            return List.copyOf(next);
        });
        deleteWrites(threadId, namespace, parentCheckpointId);
        log.debug("Appended checkpoint {} (seq {}) to thread {}", committed[0].checkpointId(),
                committed[0].seq(), threadId);
        return committed[0];
    }

    @Override
    public void putWrites(String threadId, String namespace, String checkpointId, String taskId,
                          List<PendingWrite> taskWrites) {
        writes.compute(writesKey(threadId, namespace, CheckpointStore.stagingKey(checkpointId)), (key, existing) -> {
            List<PendingWrite> next = new ArrayList<>();
            if (existing != null) {
                existing.stream()
                        .filter(w -> !w.taskId().equals(taskId) || taskWrites.stream().noneMatch(n -> n.idx() == w.idx()))
                        .forEach(next::add);
            }
            next.addAll(taskWrites);
            return List.copyOf(next);
        });
    }

    @Override
    public List<PendingWrite> listWrites(String threadId, String namespace, String checkpointId) {
        List<PendingWrite> staged = writes.getOrDefault(
                writesKey(threadId, namespace, CheckpointStore.stagingKey(checkpointId)), List.of());
        List<PendingWrite> sorted = new ArrayList<>(staged);
        sorted.sort(Comparator.comparing(PendingWrite::taskId).thenComparingInt(PendingWrite::idx));
        return sorted;
    }

    @Override
    public void deleteWrites(String threadId, String namespace, String checkpointId) {
        writes.remove(writesKey(threadId, namespace, CheckpointStore.stagingKey(checkpointId)));
    }

    private static String chainKey(String threadId, String namespace) {
        return threadId + "|" + (namespace == null ? "" : namespace);
    }

    private static String writesKey(String threadId, String namespace, String checkpointId) {
        return chainKey(threadId, namespace) + "|" + checkpointId;
    }
}
