package io.github.drompincen.folioagent.persistence.repository;

import io.github.drompincen.folioagent.persistence.document.CheckpointDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface CheckpointRepository extends MongoRepository<CheckpointDocument, String> {
    Optional<CheckpointDocument> findTopByThreadIdAndNamespaceOrderBySeqDesc(String threadId, String namespace);
    Optional<CheckpointDocument> findByThreadIdAndNamespaceAndCheckpointId(String threadId, String namespace, String checkpointId);
    long countByThreadIdAndNamespace(String threadId, String namespace);
}
