package io.github.drompincen.folioagent.runtime.checkpoint;

import io.github.drompincen.folioagent.protocol.api.TurnStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversation state carried by a checkpoint: the transcript plus the control values of the
 * last turn. Instances are treated as immutable; the {@code with*} methods return copies.
 */
public class ConversationState {

    private List<ChatMessage> messages;
    private int turn;
    private TurnStatus status;
    private String error;
    private int iterations;

    public ConversationState() {
        this.messages = new ArrayList<>();
    }

    public static ConversationState empty() {
        return new ConversationState();
    }

    public ConversationState withMessage(ChatMessage message) {
        ConversationState copy = copy();
        copy.messages.add(message);
        return copy;
    }

    public ConversationState withMessages(List<ChatMessage> replacement) {
        ConversationState copy = copy();
        copy.messages = new ArrayList<>(replacement);
        return copy;
    }

    public ConversationState withTurn(int turn) {
        ConversationState copy = copy();
        copy.turn = turn;
        return copy;
    }

    public ConversationState withStatus(TurnStatus status) {
        ConversationState copy = copy();
        copy.status = status;
        return copy;
    }

    public ConversationState withError(String error) {
        ConversationState copy = copy();
        copy.error = error;
        return copy;
    }

    public ConversationState withIterations(int iterations) {
        ConversationState copy = copy();
        copy.iterations = iterations;
        return copy;
    }

    private ConversationState copy() {
        ConversationState s = new ConversationState();
        s.messages = new ArrayList<>(this.messages);
        s.turn = this.turn;
        s.status = this.status;
        s.error = this.error;
        s.iterations = this.iterations;
        return s;
    }

    public List<ChatMessage> getMessages() { return messages; }
    public void setMessages(List<ChatMessage> messages) { this.messages = messages; }

    public int getTurn() { return turn; }
    public void setTurn(int turn) { this.turn = turn; }

    public TurnStatus getStatus() { return status; }
    public void setStatus(TurnStatus status) { this.status = status; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    public int getIterations() { return iterations; }
    public void setIterations(int iterations) { this.iterations = iterations; }
}
