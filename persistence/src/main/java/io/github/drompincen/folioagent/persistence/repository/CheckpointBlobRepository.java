package io.github.drompincen.folioagent.persistence.repository;

import io.github.drompincen.folioagent.persistence.document.CheckpointBlobDocument;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.Optional;

public interface CheckpointBlobRepository extends MongoRepository<CheckpointBlobDocument, String> {
    Optional<CheckpointBlobDocument> findByThreadIdAndNamespaceAndChannelAndVersion(
            String threadId, String namespace, String channel, String version);
}
