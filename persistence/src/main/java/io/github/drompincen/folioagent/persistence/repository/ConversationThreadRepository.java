package io.github.drompincen.folioagent.persistence.repository;

import io.github.drompincen.folioagent.persistence.document.ConversationThreadDocument;
import org.springframework.data.domain.Pageable;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface ConversationThreadRepository extends MongoRepository<ConversationThreadDocument, String> {
    Optional<ConversationThreadDocument> findFirstByAccountIdAndActiveTrueOrderByLastActivityDesc(long accountId);
    List<ConversationThreadDocument> findByAccountIdAndActiveTrueOrderByLastActivityDesc(long accountId, Pageable pageable);
}
