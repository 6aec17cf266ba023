package io.github.drompincen.folioagent.runtime.thread;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.folioagent.runtime.checkpoint.Channels;
import io.github.drompincen.folioagent.runtime.checkpoint.ChatMessage;
import io.github.drompincen.folioagent.runtime.checkpoint.Checkpoint;
import io.github.drompincen.folioagent.runtime.checkpoint.CheckpointMetadata;
import io.github.drompincen.folioagent.runtime.checkpoint.CheckpointSource;
import io.github.drompincen.folioagent.runtime.checkpoint.ConversationState;
import io.github.drompincen.folioagent.runtime.checkpoint.InMemoryCheckpointStore;
import io.github.drompincen.folioagent.runtime.checkpoint.PendingWrite;
import io.github.drompincen.folioagent.runtime.checkpoint.StateMerger;
import io.github.drompincen.folioagent.runtime.checkpoint.ToolCallRequest;
import io.github.drompincen.folioagent.runtime.checkpoint.ToolCallStatus;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConversationCompactorTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final InMemoryCheckpointStore store = new InMemoryCheckpointStore(new StateMerger(mapper));
    private final ThreadHandle handle = new ThreadManager(store, "").resolve("account_42_thread_7", 42);
    private final ConversationCompactor compactor = new ConversationCompactor();

    private Checkpoint seed(List<ChatMessage> messages) {
        List<PendingWrite> writes = new ArrayList<>();
        for (int i = 0; i < messages.size(); i++) {
            writes.add(new PendingWrite("seed", i, Channels.MESSAGES, mapper.valueToTree(messages.get(i)), "seed"));
        }
        return handle.commit(null, ConversationState.empty(), writes, CheckpointMetadata.turn(42));
    }

    @Test
    void keepsTailAndLeavesParentIntact() {
        Checkpoint parent = seed(List.of(ChatMessage.user("1"), ChatMessage.assistant("2"),
                ChatMessage.user("3"), ChatMessage.assistant("4")));

        Checkpoint compacted = compactor.compact(handle, 2).orElseThrow();

        assertThat(compacted.parentCheckpointId()).isEqualTo(parent.checkpointId());
        assertThat(compacted.metadata().source()).isEqualTo(CheckpointSource.COMPACTION);
        assertThat(compacted.state().getMessages()).extracting(ChatMessage::content).containsExactly("3", "4");
        assertThat(compacted.state().getTurn()).isEqualTo(parent.state().getTurn());
        assertThat(store.load("account_42_thread_7", "", parent.checkpointId()).orElseThrow()
                .state().getMessages()).hasSize(4);
    }

    @Test
    void neverSplitsToolCallFromItsResult() {
        ChatMessage call = ChatMessage.assistantToolCalls("", List.of(
                new ToolCallRequest("c1", "get_holdings", mapper.createObjectNode())));
        seed(List.of(ChatMessage.user("q"), call,
                ChatMessage.toolResult("c1", "get_holdings", ToolCallStatus.SUCCESS, "{}"),
                ChatMessage.assistant("a")));

        Checkpoint compacted = compactor.compact(handle, 2).orElseThrow();

        assertThat(compacted.state().getMessages()).extracting(ChatMessage::role)
                .containsExactly("assistant", "tool", "assistant");
    }

    @Test
    void shortThreadIsLeftAlone() {
        seed(List.of(ChatMessage.user("hi"), ChatMessage.assistant("hello")));

        Optional<Checkpoint> result = compactor.compact(handle, 5);

        assertThat(result).isEmpty();
        assertThat(store.history("account_42_thread_7", "", 10)).hasSize(1);
    }

    @Test
    void emptyThreadIsLeftAlone() {
        assertThat(compactor.compact(handle, 2)).isEmpty();
    }

    @Test
    void rejectsNonPositiveKeep() {
        assertThatThrownBy(() -> compactor.compact(handle, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
