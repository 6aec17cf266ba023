package io.github.drompincen.folioagent.gateway.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.folioagent.protocol.api.ChatHealthResponse;
import io.github.drompincen.folioagent.protocol.api.ChatRequest;
import io.github.drompincen.folioagent.protocol.api.ChatResponse;
import io.github.drompincen.folioagent.protocol.api.CheckpointDto;
import io.github.drompincen.folioagent.protocol.api.ThreadSummaryDto;
import io.github.drompincen.folioagent.protocol.api.ToolDescriptor;
import io.github.drompincen.folioagent.protocol.api.TurnStatus;
import io.github.drompincen.folioagent.protocol.event.StreamEvent;
import io.github.drompincen.folioagent.protocol.event.StreamEventType;
import io.github.drompincen.folioagent.runtime.agent.AgentOrchestrator;
import io.github.drompincen.folioagent.runtime.agent.TurnResult;
import io.github.drompincen.folioagent.runtime.agent.llm.ChatModelClient;
import io.github.drompincen.folioagent.runtime.checkpoint.ChatMessage;
import io.github.drompincen.folioagent.runtime.checkpoint.Checkpoint;
import io.github.drompincen.folioagent.runtime.checkpoint.CheckpointConflictException;
import io.github.drompincen.folioagent.runtime.checkpoint.CheckpointMetadata;
import io.github.drompincen.folioagent.runtime.checkpoint.ConversationState;
import io.github.drompincen.folioagent.runtime.thread.AuthorizationException;
import io.github.drompincen.folioagent.runtime.thread.ThreadHandle;
import io.github.drompincen.folioagent.runtime.thread.ThreadKey;
import io.github.drompincen.folioagent.runtime.thread.ThreadManager;
import io.github.drompincen.folioagent.runtime.thread.ThreadRecord;
import io.github.drompincen.folioagent.runtime.tools.ToolFactory;
import io.github.drompincen.folioagent.tools.GetMarketContextTool;
import io.github.drompincen.folioagent.tools.GetMarketSentimentTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ChatControllerTest {

    private static final String THREAD = "account_42_thread_7";

    @Mock private AgentOrchestrator orchestrator;
    @Mock private ThreadManager threadManager;
    @Mock private ChatModelClient modelClient;
    @Mock private ThreadHandle handle;

    private ChatController controller;

    @BeforeEach
    void setUp() {
        ToolFactory toolFactory = new ToolFactory(List.of(new GetMarketContextTool(), new GetMarketSentimentTool()));
        controller = new ChatController(orchestrator, threadManager, toolFactory, modelClient, new ObjectMapper());
    }

    @Test
    void chatReturnsTurnResultForTheHeaderAccount() {
        when(orchestrator.chat(42L, THREAD, "what do I hold?", false)).thenReturn(new TurnResult(
                THREAD, "cp-1", TurnStatus.COMPLETED, "You hold AAPL.", List.of(), null, null));

        ChatResponse response = controller.chat(42L, new ChatRequest("what do I hold?", THREAD));

        assertThat(response.threadId()).isEqualTo(THREAD);
        assertThat(response.checkpointId()).isEqualTo("cp-1");
        assertThat(response.status()).isEqualTo(TurnStatus.COMPLETED);
        assertThat(response.answer()).isEqualTo("You hold AAPL.");
        assertThat(response.error()).isNull();
    }

    @Test
    void chatRejectsNonPositiveAccountWithoutStartingATurn() {
        assertThatThrownBy(() -> controller.chat(0L, new ChatRequest("hi", null)))
                .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(orchestrator);
    }

    @Test
    void chatPropagatesUnrecordedTurnForErrorMapping() {
        when(orchestrator.chat(42L, THREAD, "hi", false))
                .thenThrow(new CheckpointConflictException(THREAD, "cp-1", "cp-2"));

        assertThatThrownBy(() -> controller.chat(42L, new ChatRequest("hi", THREAD)))
                .isInstanceOf(CheckpointConflictException.class);
    }

    @Test
    void chatPassesVoiceModeThrough() {
        when(orchestrator.chat(42L, null, "hi", true)).thenReturn(new TurnResult(
                THREAD, "cp-1", TurnStatus.COMPLETED, "Hello.", List.of(), null, null));

        controller.chat(42L, new ChatRequest("hi", null, true));

        verify(orchestrator).chat(42L, null, "hi", true);
    }

    @Test
    void streamWrapsEventsAsNamedServerSentEvents() {
        StreamEvent token = new StreamEvent(THREAD, 1, StreamEventType.TOKEN, null, Instant.now());
        StreamEvent done = new StreamEvent(THREAD, 2, StreamEventType.TURN_COMPLETE, null, Instant.now());
        when(orchestrator.stream(42L, THREAD, "hi", false)).thenReturn(Flux.just(token, done));

        StepVerifier.create(controller.stream(42L, new ChatRequest("hi", THREAD)))
                .assertNext(sse -> {
                    assertThat(sse.event()).isEqualTo("token");
                    assertThat(sse.id()).isEqualTo("1");
                    assertThat(sse.data()).isSameAs(token);
                })
                .assertNext(sse -> assertThat(sse.event()).isEqualTo("turn_complete"))
                .verifyComplete();
    }

    @Test
    void streamPropagatesOwnershipFailureBeforeReturning() {
        when(orchestrator.stream(99L, THREAD, "hi", false))
                .thenThrow(new AuthorizationException(THREAD, 99L));

        assertThatThrownBy(() -> controller.stream(99L, new ChatRequest("hi", THREAD)))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    void healthReportsConfiguredModel() {
        when(modelClient.isConfigured()).thenReturn(true);
        when(modelClient.modelName()).thenReturn("gpt-4o");

        ChatHealthResponse health = controller.health();

        assertThat(health.status()).isEqualTo("healthy");
        assertThat(health.modelConfigured()).isTrue();
        assertThat(health.modelName()).isEqualTo("gpt-4o");
    }

    @Test
    void healthReportsNotConfigured() {
        when(modelClient.isConfigured()).thenReturn(false);
        when(modelClient.modelName()).thenReturn("gpt-4o");

        ChatHealthResponse health = controller.health();

        assertThat(health.status()).isEqualTo("not_configured");
        assertThat(health.modelConfigured()).isFalse();
    }

    @Test
    void checkpointsAreMappedFromTheOwnedThreadHistory() {
        ConversationState state = ConversationState.empty()
                .withMessage(ChatMessage.user("hi"))
                .withMessage(ChatMessage.assistant("hello"))
                .withTurn(1)
                .withStatus(TurnStatus.COMPLETED);
        CheckpointMetadata metadata = CheckpointMetadata.turn(42L).completedFrom(state, 2);
        Checkpoint cp = new Checkpoint(THREAD, "", "cp-1", null, 1, state, metadata, Instant.now());
        when(threadManager.resolve(THREAD, 42L)).thenReturn(handle);
        when(handle.history(20)).thenReturn(List.of(cp));

        List<CheckpointDto> history = controller.checkpoints(42L, THREAD, 20);

        assertThat(history).hasSize(1);
        CheckpointDto dto = history.get(0);
        assertThat(dto.checkpointId()).isEqualTo("cp-1");
        assertThat(dto.parentCheckpointId()).isNull();
        assertThat(dto.turn()).isEqualTo(1);
        assertThat(dto.messageCount()).isEqualTo(2);
        assertThat(dto.status()).isEqualTo("COMPLETED");
        assertThat(dto.metadata().path("writes").asInt()).isEqualTo(2);
    }

    @Test
    void checkpointLimitIsClamped() {
        when(threadManager.resolve(THREAD, 42L)).thenReturn(handle);
        when(handle.history(anyInt())).thenReturn(List.of());

        controller.checkpoints(42L, THREAD, 10_000);
        controller.checkpoints(42L, THREAD, -3);

        verify(handle).history(100);
        verify(handle).history(1);
    }

    @Test
    void checkpointsOfForeignThreadAreRejected() {
        when(threadManager.resolve(THREAD, 99L)).thenThrow(new AuthorizationException(THREAD, 99L));

        assertThatThrownBy(() -> controller.checkpoints(99L, THREAD, 20))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    void threadsListsActiveThreadsOfTheHeaderAccount() {
        Instant now = Instant.parse("2026-03-02T09:15:00Z");
        ThreadRecord record = ThreadRecord.opened(new ThreadKey(42L, "7"), "Conversation 2026-03-02 09:15", now);
        when(threadManager.listActive(42L, 20)).thenReturn(List.of(record));

        List<ThreadSummaryDto> threads = controller.threads(42L, 20);

        assertThat(threads).singleElement().satisfies(t -> {
            assertThat(t.threadId()).isEqualTo(THREAD);
            assertThat(t.title()).isEqualTo("Conversation 2026-03-02 09:15");
            assertThat(t.active()).isTrue();
            assertThat(t.lastActivity()).isEqualTo(now);
        });
    }

    @Test
    void threadListLimitIsClamped() {
        when(threadManager.listActive(anyLong(), anyInt())).thenReturn(List.of());

        controller.threads(42L, 500);
        controller.threads(42L, 0);

        verify(threadManager).listActive(42L, 100);
        verify(threadManager).listActive(42L, 1);
    }

    @Test
    void closeThreadAnswersNoContentOrNotFound() {
        when(threadManager.close(THREAD, 42L)).thenReturn(true);
        when(threadManager.close("account_42_thread_gone", 42L)).thenReturn(false);

        ResponseEntity<Void> closed = controller.closeThread(42L, THREAD);
        ResponseEntity<Void> missing = controller.closeThread(42L, "account_42_thread_gone");

        assertThat(closed.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
        assertThat(missing.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void closingForeignThreadIsRejected() {
        when(threadManager.close(THREAD, 99L)).thenThrow(new AuthorizationException(THREAD, 99L));

        assertThatThrownBy(() -> controller.closeThread(99L, THREAD))
                .isInstanceOf(AuthorizationException.class);
    }

    @Test
    void toolsListsTheCatalogueWithoutAccountFields() {
        List<ToolDescriptor> tools = controller.tools(42L);

        assertThat(tools).extracting(ToolDescriptor::name)
                .containsExactlyInAnyOrder("get_market_context", "get_market_sentiment");
        assertThat(tools).allSatisfy(t ->
                assertThat(t.inputSchema().path("properties").has("account_id")).isFalse());
    }
}
