package io.github.drompincen.folioagent.gateway.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.folioagent.protocol.api.ChatHealthResponse;
import io.github.drompincen.folioagent.protocol.api.ChatRequest;
import io.github.drompincen.folioagent.protocol.api.ChatResponse;
import io.github.drompincen.folioagent.protocol.api.CheckpointDto;
import io.github.drompincen.folioagent.protocol.api.ThreadSummaryDto;
import io.github.drompincen.folioagent.protocol.api.ToolDescriptor;
import io.github.drompincen.folioagent.protocol.event.StreamEvent;
import io.github.drompincen.folioagent.runtime.agent.AgentOrchestrator;
import io.github.drompincen.folioagent.runtime.agent.TurnResult;
import io.github.drompincen.folioagent.runtime.agent.llm.ChatModelClient;
import io.github.drompincen.folioagent.runtime.checkpoint.Checkpoint;
import io.github.drompincen.folioagent.runtime.thread.ThreadManager;
import io.github.drompincen.folioagent.runtime.thread.ThreadRecord;
import io.github.drompincen.folioagent.runtime.tools.ToolFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Chat endpoints. Authentication happens upstream; the resolved account arrives in
 * {@value #ACCOUNT_HEADER} and is the only account a turn ever runs as.
 */
@RestController
@RequestMapping("/api/ai/chat")
public class ChatController {

    public static final String ACCOUNT_HEADER = "X-Account-Id";

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);
    private static final int MAX_HISTORY = 100;

    private final AgentOrchestrator orchestrator;
    private final ThreadManager threadManager;
    private final ToolFactory toolFactory;
    private final ChatModelClient modelClient;
    private final ObjectMapper objectMapper;

    public ChatController(AgentOrchestrator orchestrator,
                          ThreadManager threadManager,
                          ToolFactory toolFactory,
                          ChatModelClient modelClient,
                          ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.threadManager = threadManager;
        this.toolFactory = toolFactory;
        this.modelClient = modelClient;
        this.objectMapper = objectMapper;
    }

    @PostMapping(path = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<StreamEvent>> stream(@RequestHeader(ACCOUNT_HEADER) long accountId,
                                                     @RequestBody ChatRequest req) {
        requireAccount(accountId);
        log.info("Streaming turn for account {} on thread {}", accountId, req.threadId());
        return orchestrator.stream(accountId, req.threadId(), req.query(), req.voiceMode())
                .map(event -> ServerSentEvent.builder(event)
                        .id(String.valueOf(event.seq()))
                        .event(event.type().wireName())
                        .build());
    }

    @PostMapping
    public ChatResponse chat(@RequestHeader(ACCOUNT_HEADER) long accountId, @RequestBody ChatRequest req) {
        requireAccount(accountId);
        TurnResult result = orchestrator.chat(accountId, req.threadId(), req.query(), req.voiceMode());
        return new ChatResponse(result.threadId(), result.checkpointId(), result.status(),
                result.answer(), result.toolEvents(), result.error());
    }

    @GetMapping("/health")
    public ChatHealthResponse health() {
        return ChatHealthResponse.of(modelClient.isConfigured(), modelClient.modelName());
    }

    @GetMapping("/threads")
    public List<ThreadSummaryDto> threads(@RequestHeader(ACCOUNT_HEADER) long accountId,
                                          @RequestParam(defaultValue = "20") int limit) {
        requireAccount(accountId);
        int bounded = Math.max(1, Math.min(limit, MAX_HISTORY));
        return threadManager.listActive(accountId, bounded).stream()
                .map(ChatController::toDto)
                .toList();
    }

    @DeleteMapping("/threads/{threadId}")
    public ResponseEntity<Void> closeThread(@RequestHeader(ACCOUNT_HEADER) long accountId,
                                            @PathVariable String threadId) {
        requireAccount(accountId);
        return threadManager.close(threadId, accountId)
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @GetMapping("/threads/{threadId}/checkpoints")
    public List<CheckpointDto> checkpoints(@RequestHeader(ACCOUNT_HEADER) long accountId,
                                           @PathVariable String threadId,
                                           @RequestParam(defaultValue = "20") int limit) {
        requireAccount(accountId);
        int bounded = Math.max(1, Math.min(limit, MAX_HISTORY));
        return threadManager.resolve(threadId, accountId).history(bounded).stream()
                .map(this::toDto)
                .toList();
    }

    @GetMapping("/tools")
    public List<ToolDescriptor> tools(@RequestHeader(ACCOUNT_HEADER) long accountId) {
        requireAccount(accountId);
        return toolFactory.build(accountId).descriptors();
    }

    private static void requireAccount(long accountId) {
        if (accountId <= 0) {
            throw new IllegalArgumentException("Account id must be positive");
        }
    }

    private static ThreadSummaryDto toDto(ThreadRecord record) {
        return new ThreadSummaryDto(record.threadId(), record.title(), record.active(),
                record.lastActivity(), record.createdAt());
    }

    private CheckpointDto toDto(Checkpoint cp) {
        int turn = cp.state() != null ? cp.state().getTurn() : 0;
        int messageCount = cp.state() != null ? cp.state().getMessages().size() : 0;
        String status = cp.metadata() != null && cp.metadata().status() != null
                ? cp.metadata().status().name() : null;
        return new CheckpointDto(cp.threadId(), cp.namespace(), cp.checkpointId(), cp.parentCheckpointId(),
                cp.seq(), turn, status, messageCount, cp.createdAt(),
                cp.metadata() != null ? objectMapper.valueToTree(cp.metadata()) : null);
    }
}
