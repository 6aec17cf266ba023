package io.github.drompincen.folioagent.persistence.repository;

import io.github.drompincen.folioagent.persistence.document.CheckpointWriteDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface CheckpointWriteRepository extends MongoRepository<CheckpointWriteDocument, String> {
    List<CheckpointWriteDocument> findByThreadIdAndNamespaceAndCheckpointIdOrderByTaskIdAscIdxAsc(
            String threadId, String namespace, String checkpointId);
    void deleteByThreadIdAndNamespaceAndCheckpointId(String threadId, String namespace, String checkpointId);
}
