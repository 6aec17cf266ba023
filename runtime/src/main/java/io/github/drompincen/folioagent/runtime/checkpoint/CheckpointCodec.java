package io.github.drompincen.folioagent.runtime.checkpoint;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.folioagent.protocol.api.TurnStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

/**
 * JSON encoding of checkpoint parts. Channel values become blobs whose version is the
 * SHA-256 of their bytes, so equal values share one blob.
 */
@Component
public class CheckpointCodec {

    public static final String TYPE_JSON = "json";

    private static final TypeReference<List<ChatMessage>> MESSAGE_LIST = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public CheckpointCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /** Control values of a checkpoint plus the blob version of each channel. */
    public record StoredState(
            int turn,
            TurnStatus status,
            String error,
            int iterations,
            Map<String, String> channelVersions
    ) {}

    public byte[] encodeMessages(List<ChatMessage> messages) {
        try {
            return objectMapper.writeValueAsBytes(messages);
        } catch (JsonProcessingException e) {
            throw new CheckpointStorageException("Failed to encode messages", e);
        }
    }

    public List<ChatMessage> decodeMessages(byte[] blob) {
        try {
            return objectMapper.readValue(blob, MESSAGE_LIST);
        } catch (IOException e) {
            throw new CheckpointStorageException("Failed to decode messages blob", e);
        }
    }

    public String version(byte[] blob) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(blob));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public StoredState storedState(ConversationState state, Map<String, String> channelVersions) {
        return new StoredState(state.getTurn(), state.getStatus(), state.getError(),
                state.getIterations(), channelVersions);
    }

    public ConversationState restore(StoredState stored, List<ChatMessage> messages) {
        return ConversationState.empty()
                .withMessages(messages)
                .withTurn(stored.turn())
                .withStatus(stored.status())
                .withError(stored.error())
                .withIterations(stored.iterations());
    }

    public String writeString(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new CheckpointStorageException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    public <T> T readString(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new CheckpointStorageException("Failed to decode " + type.getSimpleName(), e);
        }
    }

    public JsonNode readTree(String json) {
        try {
            return json == null ? null : objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new CheckpointStorageException("Failed to decode pending write value", e);
        }
    }
}
