package io.github.drompincen.folioagent.runtime.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.folioagent.protocol.api.TurnStatus;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Folds pending writes into a state. {@code messages} appends, the control channels
 * overwrite, anything else is rejected.
 */
@Component
public class StateMerger {

    private final ObjectMapper objectMapper;

    public StateMerger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ConversationState merge(ConversationState base, List<PendingWrite> writes, CheckpointSource source) {
        ConversationState merged = base == null ? ConversationState.empty() : base;
        for (PendingWrite write : writes) {
            merged = apply(merged, write);
        }
        if (source == CheckpointSource.TURN) {
            merged = merged.withTurn((base == null ? 0 : base.getTurn()) + 1);
        }
        return merged;
    }

    private ConversationState apply(ConversationState state, PendingWrite write) {
        JsonNode value = write.value();
        return switch (write.channel()) {
            case Channels.MESSAGES -> state.withMessage(toMessage(value));
            case Channels.STATUS -> state.withStatus(value == null || value.isNull() ? null : TurnStatus.valueOf(value.asText()));
            case Channels.ERROR -> state.withError(value == null || value.isNull() ? null : value.asText());
            case Channels.ITERATIONS -> state.withIterations(value == null ? 0 : value.asInt());
            default -> throw new IllegalArgumentException("Unknown channel '" + write.channel()
                    + "' in write " + write.taskId() + "/" + write.idx());
        };
    }

    private ChatMessage toMessage(JsonNode value) {
        try {
            return objectMapper.treeToValue(value, ChatMessage.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid message write: " + e.getOriginalMessage(), e);
        }
    }
}
