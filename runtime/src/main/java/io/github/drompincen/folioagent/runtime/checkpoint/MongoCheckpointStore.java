package io.github.drompincen.folioagent.runtime.checkpoint;

import io.github.drompincen.folioagent.persistence.document.CheckpointBlobDocument;
import io.github.drompincen.folioagent.persistence.document.CheckpointDocument;
import io.github.drompincen.folioagent.persistence.document.CheckpointKeys;
import io.github.drompincen.folioagent.persistence.document.CheckpointWriteDocument;
import io.github.drompincen.folioagent.persistence.repository.CheckpointBlobRepository;
import io.github.drompincen.folioagent.persistence.repository.CheckpointRepository;
import io.github.drompincen.folioagent.persistence.repository.CheckpointWriteRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Checkpoint store on MongoDB. Blobs are upserted first; they stay unreferenced until the
 * checkpoint insert, which is the commit point. The unique (thread, namespace, parent) index
 * lets only one child per parent ever be inserted.
 */
@Component
@ConditionalOnProperty(name = "folioagent.checkpoint.store", havingValue = "mongo", matchIfMissing = true)
public class MongoCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(MongoCheckpointStore.class);

    private final CheckpointRepository checkpointRepository;
    private final CheckpointWriteRepository writeRepository;
    private final CheckpointBlobRepository blobRepository;
    private final MongoTemplate mongoTemplate;
    private final CheckpointCodec codec;
    private final StateMerger stateMerger;
    private volatile boolean indexesReady;

    public MongoCheckpointStore(CheckpointRepository checkpointRepository,
                                CheckpointWriteRepository writeRepository,
                                CheckpointBlobRepository blobRepository,
                                MongoTemplate mongoTemplate,
                                CheckpointCodec codec,
                                StateMerger stateMerger) {
        this.checkpointRepository = checkpointRepository;
        this.writeRepository = writeRepository;
        this.blobRepository = blobRepository;
        this.mongoTemplate = mongoTemplate;
        this.codec = codec;
        this.stateMerger = stateMerger;
    }

    @PostConstruct
    public void ensureIndexes() {
        try {
            createIndexes();
        } catch (DataAccessException e) {
            // Mongo may come up after the application; append retries before its first insert
            log.warn("Could not ensure checkpoint indexes: {}", e.getMessage());
        }
    }

    /**
     * The parent-uniqueness index is what makes append a compare-and-set, so no checkpoint is
     * inserted until it is known to exist.
     */
    private void requireIndexes() {
        if (indexesReady) {
            return;
        }
        synchronized (this) {
            if (indexesReady) {
                return;
            }
            try {
                createIndexes();
            } catch (DataAccessException e) {
                throw new CheckpointStorageException("Checkpoint indexes are not in place", e);
            }
        }
    }

    private void createIndexes() {
        IndexOperations checkpoints = mongoTemplate.indexOps(CheckpointDocument.class);
        checkpoints.ensureIndex(new Index().on("threadId", Sort.Direction.ASC).on("namespace", Sort.Direction.ASC)
                .on("checkpointId", Sort.Direction.ASC).unique().named("thread_ns_checkpoint"));
        checkpoints.ensureIndex(new Index().on("threadId", Sort.Direction.ASC).on("namespace", Sort.Direction.ASC)
                .on("parentCheckpointId", Sort.Direction.ASC).unique().named("thread_ns_parent"));
        checkpoints.ensureIndex(new Index().on("threadId", Sort.Direction.ASC).on("namespace", Sort.Direction.ASC)
                .on("seq", Sort.Direction.DESC).named("thread_ns_seq"));
        indexesReady = true;
        log.info("Checkpoint indexes ensured");
    }

    @Override
    public Optional<Checkpoint> loadLatest(String threadId, String namespace) {
        try {
            return checkpointRepository.findTopByThreadIdAndNamespaceOrderBySeqDesc(threadId, ns(namespace))
                    .map(this::toCheckpoint);
        } catch (DataAccessException e) {
            throw new CheckpointStorageException("Failed to load latest checkpoint for " + threadId, e);
        }
    }

    @Override
    public Optional<Checkpoint> load(String threadId, String namespace, String checkpointId) {
        try {
            return checkpointRepository.findByThreadIdAndNamespaceAndCheckpointId(threadId, ns(namespace), checkpointId)
                    .map(this::toCheckpoint);
        } catch (DataAccessException e) {
            throw new CheckpointStorageException("Failed to load checkpoint " + checkpointId, e);
        }
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
        String namespaceKey = ns(namespace);
        ConversationState merged = stateMerger.merge(baseState, pendingWrites, metadata.source());
        CheckpointMetadata completed = metadata.completedFrom(merged, pendingWrites.size());
        requireIndexes();
        try {
            Optional<CheckpointDocument> latest =
                    checkpointRepository.findTopByThreadIdAndNamespaceOrderBySeqDesc(threadId, namespaceKey);
            String latestId = latest.map(CheckpointDocument::getCheckpointId).orElse(null);
            if (!Objects.equals(latestId, parentCheckpointId)) {
                throw new CheckpointConflictException(threadId, parentCheckpointId, latestId);
            }

            byte[] messagesBlob = codec.encodeMessages(merged.getMessages());
            String version = codec.version(messagesBlob);
            saveBlob(threadId, namespaceKey, Channels.MESSAGES, version, messagesBlob);

            Map<String, String> channelVersions = new LinkedHashMap<>();
            channelVersions.put(Channels.MESSAGES, version);

            String checkpointId = UUID.randomUUID().toString();
            CheckpointDocument doc = new CheckpointDocument();
            doc.setId(CheckpointKeys.checkpointId(threadId, namespaceKey, checkpointId));
            doc.setThreadId(threadId);
            doc.setNamespace(namespaceKey);
            doc.setCheckpointId(checkpointId);
            doc.setParentCheckpointId(parentCheckpointId);
            doc.setSeq(latest.map(CheckpointDocument::getSeq).orElse(0L) + 1);
            doc.setType(CheckpointCodec.TYPE_JSON);
            doc.setCheckpoint(codec.writeString(codec.storedState(merged, channelVersions)));
            doc.setMetadata(codec.writeString(completed));
            doc.setCreatedAt(Instant.now());
            checkpointRepository.insert(doc);

            deleteWrites(threadId, namespaceKey, parentCheckpointId);
            log.debug("Appended checkpoint {} (seq {}) to thread {}", checkpointId, doc.getSeq(), threadId);
            return new Checkpoint(threadId, namespaceKey, checkpointId, parentCheckpointId, doc.getSeq(),
                    merged, completed, doc.getCreatedAt());
        } catch (DuplicateKeyException e) {
            throw new CheckpointConflictException(threadId, parentCheckpointId, e);
        } catch (DataAccessException e) {
            throw new CheckpointStorageException("Failed to append checkpoint to " + threadId, e);
        }
    }

    @Override
    public void putWrites(String threadId, String namespace, String checkpointId, String taskId,
                          List<PendingWrite> writes) {
        String namespaceKey = ns(namespace);
        String stagingId = CheckpointStore.stagingKey(checkpointId);
        List<CheckpointWriteDocument> docs = new ArrayList<>();
        for (PendingWrite write : writes) {
            CheckpointWriteDocument doc = new CheckpointWriteDocument();
            doc.setId(CheckpointKeys.writeId(threadId, namespaceKey, stagingId, taskId, write.idx()));
            doc.setThreadId(threadId);
            doc.setNamespace(namespaceKey);
            doc.setCheckpointId(stagingId);
            doc.setTaskId(taskId);
            doc.setIdx(write.idx());
            doc.setChannel(write.channel());
            doc.setType(CheckpointCodec.TYPE_JSON);
            doc.setValue(write.value() == null ? null : write.value().toString());
            doc.setTaskPath(write.taskPath());
            doc.setCreatedAt(Instant.now());
            docs.add(doc);
        }
        try {
            writeRepository.saveAll(docs);
        } catch (DataAccessException e) {
            throw new CheckpointStorageException("Failed to stage writes for task " + taskId, e);
        }
    }

    @Override
    public List<PendingWrite> listWrites(String threadId, String namespace, String checkpointId) {
        try {
            return writeRepository.findByThreadIdAndNamespaceAndCheckpointIdOrderByTaskIdAscIdxAsc(
                            threadId, ns(namespace), CheckpointStore.stagingKey(checkpointId)).stream()
                    .map(doc -> new PendingWrite(doc.getTaskId(), doc.getIdx(), doc.getChannel(),
                            codec.readTree(doc.getValue()), doc.getTaskPath()))
                    .toList();
        } catch (DataAccessException e) {
            throw new CheckpointStorageException("Failed to list writes for " + checkpointId, e);
        }
    }

    private void saveBlob(String threadId, String namespace, String channel, String version, byte[] bytes) {
        String id = CheckpointKeys.blobId(threadId, namespace, channel, version);
        if (blobRepository.existsById(id)) {
            return;
        }
        CheckpointBlobDocument blob = new CheckpointBlobDocument();
        blob.setId(id);
        blob.setThreadId(threadId);
        blob.setNamespace(namespace);
        blob.setChannel(channel);
        blob.setVersion(version);
        blob.setType(CheckpointCodec.TYPE_JSON);
        blob.setBlob(bytes);
        blobRepository.save(blob);
    }

    @Override
    public void deleteWrites(String threadId, String namespace, String checkpointId) {
        try {
            writeRepository.deleteByThreadIdAndNamespaceAndCheckpointId(threadId, ns(namespace),
                    CheckpointStore.stagingKey(checkpointId));
        } catch (DataAccessException e) {
            log.warn("Failed to discard staged writes for {} on {}: {}", checkpointId, threadId, e.getMessage());
        }
    }

    private Checkpoint toCheckpoint(CheckpointDocument doc) {
        CheckpointCodec.StoredState stored = codec.readString(doc.getCheckpoint(), CheckpointCodec.StoredState.class);
        String version = stored.channelVersions() == null ? null : stored.channelVersions().get(Channels.MESSAGES);
        List<ChatMessage> messages = List.of();
        if (version != null) {
            CheckpointBlobDocument blob = blobRepository
                    .findByThreadIdAndNamespaceAndChannelAndVersion(doc.getThreadId(), doc.getNamespace(),
                            Channels.MESSAGES, version)
                    .orElseThrow(() -> new CheckpointStorageException(
                            "Missing messages blob " + version + " for checkpoint " + doc.getCheckpointId(), null));
            messages = codec.decodeMessages(blob.getBlob());
        }
        CheckpointMetadata metadata = doc.getMetadata() == null
                ? null
                : codec.readString(doc.getMetadata(), CheckpointMetadata.class);
        return new Checkpoint(doc.getThreadId(), doc.getNamespace(), doc.getCheckpointId(),
                doc.getParentCheckpointId(), doc.getSeq(), codec.restore(stored, messages), metadata,
                doc.getCreatedAt());
    }

    private static String ns(String namespace) {
        return namespace == null ? "" : namespace;
    }
}
