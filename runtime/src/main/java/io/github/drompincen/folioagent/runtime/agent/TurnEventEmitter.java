package io.github.drompincen.folioagent.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.folioagent.protocol.api.TurnStatus;
import io.github.drompincen.folioagent.protocol.event.StreamEvent;
import io.github.drompincen.folioagent.protocol.event.StreamEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Instant;

/**
 * Ordered event channel for one turn. Events carry a per-turn sequence number starting at 1.
 * Nothing is emitted after a terminal event or after the subscriber cancels; cancelling the
 * subscription cancels the turn.
 */
public class TurnEventEmitter {

    private static final Logger log = LoggerFactory.getLogger(TurnEventEmitter.class);

    private final String threadId;
    private final CancellationToken cancellation;
    private final ObjectMapper objectMapper;
    private final Sinks.Many<StreamEvent> sink;
    private long seq;
    private boolean closed;

    public TurnEventEmitter(String threadId, CancellationToken cancellation, ObjectMapper objectMapper) {
        this(threadId, cancellation, objectMapper, true);
    }

    private TurnEventEmitter(String threadId, CancellationToken cancellation, ObjectMapper objectMapper,
                             boolean publishing) {
        this.threadId = threadId;
        this.cancellation = cancellation;
        this.objectMapper = objectMapper;
        this.sink = publishing ? Sinks.many().unicast().onBackpressureBuffer() : null;
    }

    /**
     * An emitter that only counts events, for callers that collect the result instead.
     */
    public static TurnEventEmitter discarding(String threadId, CancellationToken cancellation,
                                              ObjectMapper objectMapper) {
        return new TurnEventEmitter(threadId, cancellation, objectMapper, false);
    }

    public Flux<StreamEvent> flux() {
        if (sink == null) {
            return Flux.empty();
        }
        return sink.asFlux().doOnCancel(() -> {
            log.info("Subscriber cancelled stream for thread {}", threadId);
            cancellation.cancel();
        });
    }

    public void token(String text) {
        if (text == null || text.isEmpty()) return;
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("text", text);
        emit(StreamEventType.TOKEN, payload);
    }

    public void toolCallStarted(String callId, String toolName, JsonNode arguments, String statusMessage) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("callId", callId);
        payload.put("toolName", toolName);
        payload.set("arguments", arguments);
        payload.put("status", statusMessage);
        emit(StreamEventType.TOOL_CALL_STARTED, payload);
    }

    public void toolCallResult(String callId, String toolName, boolean success, JsonNode output, String error) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("callId", callId);
        payload.put("toolName", toolName);
        payload.put("success", success);
        if (success) {
            payload.set("output", output);
        } else {
            payload.put("error", error);
        }
        emit(StreamEventType.TOOL_CALL_RESULT, payload);
    }

    public void turnComplete(String checkpointId, TurnStatus status, String answer) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("checkpointId", checkpointId);
        payload.put("status", status.name());
        payload.put("answer", answer);
        emit(StreamEventType.TURN_COMPLETE, payload);
    }

    public void error(String kind, String message, String checkpointId) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("kind", kind);
        payload.put("message", message);
        if (checkpointId != null) {
            payload.put("checkpointId", checkpointId);
        }
        emit(StreamEventType.ERROR, payload);
    }

    /**
     * Ends the stream without a terminal event, used when the turn was cancelled.
     */
    public synchronized void close() {
        if (closed) return;
        closed = true;
        if (sink != null) {
            sink.tryEmitComplete();
        }
    }

    synchronized long emittedCount() {
        return seq;
    }

    private synchronized void emit(StreamEventType type, JsonNode payload) {
        if (closed || cancellation.isCancelled()) {
            log.debug("Dropping {} event for thread {}", type.wireName(), threadId);
            return;
        }
        seq++;
        if (sink != null) {
            Sinks.EmitResult result = sink.tryEmitNext(new StreamEvent(threadId, seq, type, payload, Instant.now()));
            if (result.isFailure()) {
                log.debug("Emit of {} failed for thread {}: {}", type.wireName(), threadId, result);
            }
        }
        if (type.isTerminal()) {
            closed = true;
            if (sink != null) {
                sink.tryEmitComplete();
            }
        }
    }
}
