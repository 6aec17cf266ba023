package io.github.drompincen.folioagent.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.folioagent.protocol.api.ToolEventDto;
import io.github.drompincen.folioagent.runtime.checkpoint.ChatMessage;
import io.github.drompincen.folioagent.runtime.checkpoint.Checkpoint;
import io.github.drompincen.folioagent.runtime.checkpoint.Channels;
import io.github.drompincen.folioagent.runtime.checkpoint.ConversationState;
import io.github.drompincen.folioagent.runtime.checkpoint.PendingWrite;
import io.github.drompincen.folioagent.runtime.checkpoint.ToolCallRequest;
import io.github.drompincen.folioagent.runtime.checkpoint.ToolCallStatus;
import io.github.drompincen.folioagent.runtime.thread.ThreadHandle;
import io.github.drompincen.folioagent.runtime.tools.ToolSet;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Mutable bookkeeping for one running turn. Confined to the turn's thread.
 */
class TurnContext {

    private final String turnId = UUID.randomUUID().toString().substring(0, 8);
    private final ThreadHandle handle;
    private final ToolSet tools;
    private final String systemPrompt;
    private final CancellationToken cancellation;
    private final TurnEventEmitter emitter;
    private final ObjectMapper objectMapper;
    private final long deadlineNanos;
    private final Duration turnTimeout;

    private TurnPhase phase = TurnPhase.AWAITING_INPUT;
    private String baseCheckpointId;
    private ConversationState baseState = ConversationState.empty();
    private final List<ChatMessage> transcript = new ArrayList<>();
    private final List<PendingWrite> writes = new ArrayList<>();
    private final List<ToolEventDto> toolEvents = new ArrayList<>();
    private int iterations;
    private int modelSteps;
    private String answer;
    private RuntimeException unrecordedFailure;

    TurnContext(ThreadHandle handle, ToolSet tools, String systemPrompt, CancellationToken cancellation,
                TurnEventEmitter emitter, ObjectMapper objectMapper, Duration turnTimeout) {
        this.handle = handle;
        this.tools = tools;
        this.systemPrompt = systemPrompt;
        this.cancellation = cancellation;
        this.emitter = emitter;
        this.objectMapper = objectMapper;
        this.turnTimeout = turnTimeout;
        this.deadlineNanos = System.nanoTime() + turnTimeout.toNanos();
    }

    void transition(TurnPhase next) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal turn transition " + phase + " -> " + next);
        }
        phase = next;
    }

    void start(Checkpoint latest) {
        if (latest != null) {
            baseCheckpointId = latest.checkpointId();
            baseState = latest.state();
            transcript.addAll(latest.state().getMessages());
        }
    }

    /**
     * Appends a message to the working transcript and records it as a pending write of {@code taskId}.
     */
    PendingWrite record(String taskId, int idx, ChatMessage message) {
        transcript.add(message);
        PendingWrite write = new PendingWrite(taskId, idx, Channels.MESSAGES,
                objectMapper.valueToTree(message), taskPath(taskId));
        writes.add(write);
        return write;
    }

    /**
     * Records an error result for every tool call of the last assistant message that has no
     * result yet, so the transcript never ends with an unanswered call.
     */
    void closeDanglingToolCalls(String reason) {
        int last = -1;
        for (int i = transcript.size() - 1; i >= 0; i--) {
            if (transcript.get(i).hasToolCalls()) {
                last = i;
                break;
            }
        }
        if (last < 0) return;
        Set<String> answered = new HashSet<>();
        for (int i = last + 1; i < transcript.size(); i++) {
            if (transcript.get(i).toolCallId() != null) {
                answered.add(transcript.get(i).toolCallId());
            }
        }
        int idx = 0;
        for (ToolCallRequest call : transcript.get(last).toolCalls()) {
            if (!answered.contains(call.id())) {
                record(taskId("abort"), idx++, ChatMessage.toolResult(call.id(), call.name(), ToolCallStatus.ERROR, reason));
            }
        }
    }

    List<PendingWrite> controlWrites(String status, String error) {
        String taskId = taskId("commit");
        List<PendingWrite> control = new ArrayList<>();
        control.add(new PendingWrite(taskId, 0, Channels.STATUS, objectMapper.getNodeFactory().textNode(status), "commit"));
        JsonNode errorNode = error == null
                ? objectMapper.getNodeFactory().nullNode()
                : objectMapper.getNodeFactory().textNode(error);
        control.add(new PendingWrite(taskId, 1, Channels.ERROR, errorNode, "commit"));
        control.add(new PendingWrite(taskId, 2, Channels.ITERATIONS,
                objectMapper.getNodeFactory().numberNode(iterations), "commit"));
        return control;
    }

    String taskId(String suffix) {
        return turnId + ":" + suffix;
    }

    private String taskPath(String taskId) {
        int sep = taskId.indexOf(':');
        String path = sep < 0 ? taskId : taskId.substring(sep + 1);
        int next = path.indexOf(':');
        return next < 0 ? path : path.substring(0, next);
    }

    Duration remaining() {
        long left = deadlineNanos - System.nanoTime();
        if (left <= 0) {
            throw new TurnTimeoutException(turnTimeout);
        }
        return Duration.ofNanos(left);
    }

    void addToolEvent(ToolOutcome outcome) {
        toolEvents.add(new ToolEventDto(outcome.call().id(), outcome.call().name(), outcome.call().arguments(),
                outcome.output(), outcome.success(), outcome.error()));
    }

    int nextModelStep() { return ++modelSteps; }
    int incrementIterations() { return ++iterations; }

    ThreadHandle handle() { return handle; }
    ToolSet tools() { return tools; }
    String systemPrompt() { return systemPrompt; }
    CancellationToken cancellation() { return cancellation; }
    TurnEventEmitter emitter() { return emitter; }
    TurnPhase phase() { return phase; }
    String baseCheckpointId() { return baseCheckpointId; }
    ConversationState baseState() { return baseState; }
    List<ChatMessage> transcript() { return Collections.unmodifiableList(transcript); }
    List<PendingWrite> writes() { return Collections.unmodifiableList(writes); }
    List<ToolEventDto> toolEvents() { return List.copyOf(toolEvents); }
    int iterations() { return iterations; }
    String answer() { return answer; }
    void answer(String answer) { this.answer = answer; }

    /** Storage failure that left the turn without a checkpoint; rethrown to blocking callers. */
    RuntimeException unrecordedFailure() { return unrecordedFailure; }
    void unrecordedFailure(RuntimeException cause) { this.unrecordedFailure = cause; }
}
