package io.github.drompincen.folioagent.runtime.thread;

import io.github.drompincen.folioagent.runtime.checkpoint.ChatMessage;
import io.github.drompincen.folioagent.runtime.checkpoint.Checkpoint;
import io.github.drompincen.folioagent.runtime.checkpoint.CheckpointMetadata;
import io.github.drompincen.folioagent.runtime.checkpoint.ConversationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Shortens a thread's transcript by appending a compaction checkpoint. Earlier checkpoints
 * keep the full history.
 */
@Service
public class ConversationCompactor {

    private static final Logger log = LoggerFactory.getLogger(ConversationCompactor.class);

    public Optional<Checkpoint> compact(ThreadHandle handle, int keepLastMessages) {
        if (keepLastMessages < 1) {
            throw new IllegalArgumentException("keepLastMessages must be at least 1");
        }
        Optional<Checkpoint> latest = handle.loadState();
        if (latest.isEmpty()) {
            return Optional.empty();
        }
        Checkpoint parent = latest.get();
        List<ChatMessage> messages = parent.state().getMessages();
        if (messages.size() <= keepLastMessages) {
            return Optional.empty();
        }
        int cut = safeCut(messages, messages.size() - keepLastMessages);
        if (cut == 0) {
            return Optional.empty();
        }
        ConversationState compacted = parent.state().withMessages(messages.subList(cut, messages.size()));
        Checkpoint cp = handle.commit(parent.checkpointId(), compacted, List.of(),
                CheckpointMetadata.compaction(handle.accountId()));
        log.info("Compacted thread {} from {} to {} messages", handle.threadId(), messages.size(),
                compacted.getMessages().size());
        return Optional.of(cp);
    }

    /**
     * Moves the cut back so it never lands on a tool result, whose requesting assistant
     * message would otherwise be dropped.
     */
    static int safeCut(List<ChatMessage> messages, int cut) {
        int i = cut;
        while (i > 0 && ChatMessage.TOOL.equals(messages.get(i).role())) {
            i--;
        }
        return i;
    }
}
