package io.github.drompincen.folioagent.runtime.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.github.drompincen.folioagent.protocol.api.TurnStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StateMergerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final StateMerger merger = new StateMerger(mapper);

    private PendingWrite message(String task, int idx, ChatMessage msg) {
        return new PendingWrite(task, idx, Channels.MESSAGES, mapper.valueToTree(msg), "input");
    }

    @Test
    void messagesAppendInWriteOrder() {
        ConversationState base = ConversationState.empty().withMessage(ChatMessage.user("earlier"));

        ConversationState merged = merger.merge(base, List.of(
                message("t1", 0, ChatMessage.user("hi")),
                message("t2", 0, ChatMessage.assistant("hello"))), CheckpointSource.TURN);

        assertThat(merged.getMessages()).extracting(ChatMessage::content)
                .containsExactly("earlier", "hi", "hello");
        assertThat(base.getMessages()).hasSize(1);
    }

    @Test
    void controlChannelsOverwrite() {
        ConversationState base = ConversationState.empty()
                .withStatus(TurnStatus.FAILED).withError("old").withIterations(3);
        JsonNodeFactory f = JsonNodeFactory.instance;

        ConversationState merged = merger.merge(base, List.of(
                new PendingWrite("c", 0, Channels.STATUS, f.textNode("COMPLETED"), "commit"),
                new PendingWrite("c", 1, Channels.ERROR, f.nullNode(), "commit"),
                new PendingWrite("c", 2, Channels.ITERATIONS, f.numberNode(1), "commit")), CheckpointSource.TURN);

        assertThat(merged.getStatus()).isEqualTo(TurnStatus.COMPLETED);
        assertThat(merged.getError()).isNull();
        assertThat(merged.getIterations()).isEqualTo(1);
    }

    @Test
    void turnSourceAdvancesTurnCounterAndCompactionDoesNot() {
        ConversationState base = ConversationState.empty().withTurn(4);

        assertThat(merger.merge(base, List.of(), CheckpointSource.TURN).getTurn()).isEqualTo(5);
        assertThat(merger.merge(base, List.of(), CheckpointSource.COMPACTION).getTurn()).isEqualTo(4);
    }

    @Test
    void nullBaseStartsFromEmptyState() {
        ConversationState merged = merger.merge(null, List.of(message("t", 0, ChatMessage.user("x"))),
                CheckpointSource.TURN);

        assertThat(merged.getMessages()).hasSize(1);
        assertThat(merged.getTurn()).isEqualTo(1);
    }

    @Test
    void unknownChannelIsRejected() {
        PendingWrite bogus = new PendingWrite("t", 0, "scratchpad", JsonNodeFactory.instance.textNode("x"), "t");

        assertThatThrownBy(() -> merger.merge(ConversationState.empty(), List.of(bogus), CheckpointSource.TURN))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("scratchpad");
    }
}
