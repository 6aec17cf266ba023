package io.github.drompincen.folioagent.runtime.thread;

import io.github.drompincen.folioagent.persistence.document.ConversationThreadDocument;
import io.github.drompincen.folioagent.persistence.repository.ConversationThreadRepository;
import io.github.drompincen.folioagent.runtime.checkpoint.CheckpointStorageException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
@ConditionalOnProperty(name = "folioagent.checkpoint.store", havingValue = "mongo", matchIfMissing = true)
public class MongoThreadRegistry implements ThreadRegistry {

    private final ConversationThreadRepository repository;

    public MongoThreadRegistry(ConversationThreadRepository repository) {
        this.repository = repository;
    }

    @Override
    public Optional<ThreadRecord> find(String threadId) {
        try {
            return repository.findById(threadId).map(MongoThreadRegistry::toRecord);
        } catch (DataAccessException e) {
            throw new CheckpointStorageException("Failed to load thread " + threadId, e);
        }
    }

    @Override
    public Optional<ThreadRecord> mostRecentActive(long accountId) {
        try {
            return repository.findFirstByAccountIdAndActiveTrueOrderByLastActivityDesc(accountId)
                    .map(MongoThreadRegistry::toRecord);
        } catch (DataAccessException e) {
            throw new CheckpointStorageException("Failed to load active thread for account " + accountId, e);
        }
    }

    @Override
    public List<ThreadRecord> listActive(long accountId, int limit) {
        try {
            return repository.findByAccountIdAndActiveTrueOrderByLastActivityDesc(accountId, PageRequest.of(0, limit))
                    .stream().map(MongoThreadRegistry::toRecord).toList();
        } catch (DataAccessException e) {
            throw new CheckpointStorageException("Failed to list threads for account " + accountId, e);
        }
    }

    @Override
    public void save(ThreadRecord record) {
        ConversationThreadDocument doc = new ConversationThreadDocument();
        doc.setThreadId(record.threadId());
        doc.setAccountId(record.accountId());
        doc.setTitle(record.title());
        doc.setActive(record.active());
        doc.setLastActivity(record.lastActivity());
        doc.setCreatedAt(record.createdAt());
        doc.setUpdatedAt(record.updatedAt());
        try {
            repository.save(doc);
        } catch (DataAccessException e) {
            throw new CheckpointStorageException("Failed to save thread " + record.threadId(), e);
        }
    }

    private static ThreadRecord toRecord(ConversationThreadDocument doc) {
        return new ThreadRecord(doc.getThreadId(), doc.getAccountId(), doc.getTitle(), doc.isActive(),
                doc.getLastActivity(), doc.getCreatedAt(), doc.getUpdatedAt());
    }
}
