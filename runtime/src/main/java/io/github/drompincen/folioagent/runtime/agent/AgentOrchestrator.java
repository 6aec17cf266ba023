package io.github.drompincen.folioagent.runtime.agent;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.folioagent.protocol.api.TurnStatus;
import io.github.drompincen.folioagent.protocol.event.StreamEvent;
import io.github.drompincen.folioagent.runtime.agent.llm.ChatModelClient;
import io.github.drompincen.folioagent.runtime.agent.llm.ModelNotConfiguredException;
import io.github.drompincen.folioagent.runtime.agent.llm.ModelRequest;
import io.github.drompincen.folioagent.runtime.agent.llm.ModelResponse;
import io.github.drompincen.folioagent.runtime.agent.llm.ModelUnavailableException;
import io.github.drompincen.folioagent.runtime.checkpoint.ChatMessage;
import io.github.drompincen.folioagent.runtime.checkpoint.Checkpoint;
import io.github.drompincen.folioagent.runtime.checkpoint.CheckpointConflictException;
import io.github.drompincen.folioagent.runtime.checkpoint.CheckpointMetadata;
import io.github.drompincen.folioagent.runtime.checkpoint.CheckpointStorageException;
import io.github.drompincen.folioagent.runtime.checkpoint.ConversationState;
import io.github.drompincen.folioagent.runtime.checkpoint.PendingWrite;
import io.github.drompincen.folioagent.runtime.checkpoint.ToolCallRequest;
import io.github.drompincen.folioagent.runtime.checkpoint.ToolCallStatus;
import io.github.drompincen.folioagent.runtime.thread.ThreadHandle;
import io.github.drompincen.folioagent.runtime.thread.ThreadManager;
import io.github.drompincen.folioagent.runtime.tools.ToolFactory;
import io.github.drompincen.folioagent.runtime.tools.ToolSet;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Drives one turn: load the thread, alternate model steps and tool rounds until the model
 * answers or a limit is hit, then commit exactly one checkpoint. Failed turns are committed
 * with status FAILED; cancelled turns commit nothing.
 */
@Component
public class AgentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

    private final ThreadManager threadManager;
    private final ToolFactory toolFactory;
    private final ChatModelClient modelClient;
    private final SystemPromptService promptService;
    private final AgentSettings settings;
    private final ObjectMapper objectMapper;

    private final ExecutorService turnPool = Executors.newCachedThreadPool(daemonThreads("turn-"));
    private final ExecutorService toolPool = Executors.newCachedThreadPool(daemonThreads("tool-"));
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(daemonThreads("tool-timer-"));
    private final ToolDispatcher dispatcher;

    public AgentOrchestrator(ThreadManager threadManager,
                             ToolFactory toolFactory,
                             ChatModelClient modelClient,
                             SystemPromptService promptService,
                             AgentSettings settings,
                             ObjectMapper objectMapper) {
        this.threadManager = threadManager;
        this.toolFactory = toolFactory;
        this.modelClient = modelClient;
        this.promptService = promptService;
        this.settings = settings;
        this.objectMapper = objectMapper;
        this.dispatcher = new ToolDispatcher(toolPool, timer, settings.maxParallelTools());
    }

    /**
     * Starts a turn when the returned flux is subscribed. Ownership and model configuration
     * are checked before this method returns, so those failures surface to the caller directly.
     */
    public Flux<StreamEvent> stream(long accountId, String rawThreadId, String query, boolean voiceMode) {
        TurnContext ctx = prepare(accountId, rawThreadId, query, voiceMode, true);
        TurnEventEmitter emitter = ctx.emitter();
        return emitter.flux().doOnSubscribe(s -> turnPool.submit(() -> runStreamingTurn(ctx, query)));
    }

    /**
     * Runs a turn to completion and returns its collected result.
     */
    public TurnResult chat(long accountId, String rawThreadId, String query, boolean voiceMode) {
        TurnContext ctx = prepare(accountId, rawThreadId, query, voiceMode, false);
        Future<TurnResult> future = turnPool.submit(() -> runTurn(ctx, query));
        TurnResult result;
        try {
            result = future.get();
        } catch (InterruptedException e) {
            ctx.cancellation().cancel();
            Thread.currentThread().interrupt();
            throw new TurnCancelledException();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException(e.getCause());
        }
        if (ctx.unrecordedFailure() != null) {
            throw ctx.unrecordedFailure();
        }
        return result;
    }

    private TurnContext prepare(long accountId, String rawThreadId, String query, boolean voiceMode, boolean publishing) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be empty");
        }
        ThreadHandle handle = threadManager.open(accountId, rawThreadId);
        if (!modelClient.isConfigured()) {
            throw new ModelNotConfiguredException();
        }
        CancellationToken cancellation = new CancellationToken();
        TurnEventEmitter emitter = publishing
                ? new TurnEventEmitter(handle.threadId(), cancellation, objectMapper)
                : TurnEventEmitter.discarding(handle.threadId(), cancellation, objectMapper);
        ToolSet tools = toolFactory.build(accountId, handle.threadId());
        return new TurnContext(handle, tools, promptService.render(accountId, voiceMode), cancellation,
                emitter, objectMapper, settings.turnTimeout());
    }

    private void runStreamingTurn(TurnContext ctx, String query) {
        try {
            runTurn(ctx, query);
        } catch (RuntimeException e) {
            log.error("Unexpected error in turn on thread {}", ctx.handle().threadId(), e);
            ctx.emitter().error(errorKind(e), e.getMessage(), null);
        } finally {
            ctx.emitter().close();
        }
    }

    TurnResult runTurn(TurnContext ctx, String query) {
        ThreadHandle handle = ctx.handle();
        log.info("Turn started on thread {} for account {}", handle.threadId(), handle.accountId());
        try {
            Optional<Checkpoint> latest = handle.loadState();
            ctx.start(latest.orElse(null));
            stage(ctx, "input", List.of(ctx.record(ctx.taskId("input"), 0, ChatMessage.user(query))));

            while (true) {
                ctx.cancellation().throwIfCancelled();
                ctx.remaining();
                ctx.transition(TurnPhase.MODEL_GENERATING);
                int step = ctx.nextModelStep();
                ModelResponse response = callModel(ctx);
                String modelTask = "model:" + step;

                if (!response.hasToolCalls()) {
                    String answer = response.text() == null ? "" : response.text();
                    stage(ctx, modelTask, List.of(ctx.record(ctx.taskId(modelTask), 0, ChatMessage.assistant(answer))));
                    ctx.answer(answer);
                    ctx.cancellation().throwIfCancelled();
                    return complete(ctx);
                }

                stage(ctx, modelTask, List.of(ctx.record(ctx.taskId(modelTask), 0,
                        ChatMessage.assistantToolCalls(response.text(), response.toolCalls()))));
                ctx.cancellation().throwIfCancelled();
                int iterations = ctx.incrementIterations();
                if (iterations > settings.maxIterations()) {
                    throw new ToolLoopExceededException(iterations, settings.maxIterations());
                }
                ctx.transition(TurnPhase.TOOL_EXECUTING);
                runTools(ctx, response, step);
            }
        } catch (TurnCancelledException e) {
            return cancelled(ctx);
        } catch (CheckpointStorageException | CheckpointConflictException e) {
            if (ctx.cancellation().isCancelled() && ctx.phase() != TurnPhase.COMMITTING) {
                return cancelled(ctx);
            }
            return unrecorded(ctx, e);
        } catch (RuntimeException e) {
            if (ctx.cancellation().isCancelled()) {
                return cancelled(ctx);
            }
            return fail(ctx, e);
        }
    }

    private void runTools(TurnContext ctx, ModelResponse response, int step) {
        Duration timeout = min(settings.toolTimeout(), ctx.remaining());
        TurnEventEmitter emitter = ctx.emitter();
        List<ToolOutcome> outcomes = dispatcher.dispatch(response.toolCalls(), ctx.tools(), timeout,
                ctx.cancellation(), new ToolDispatcher.Listener() {
                    @Override
                    public void started(ToolCallRequest call, String statusMessage) {
                        emitter.toolCallStarted(call.id(), call.name(), call.arguments(), statusMessage);
                    }

                    @Override
                    public void finished(ToolOutcome outcome) {
                        emitter.toolCallResult(outcome.call().id(), outcome.call().name(), outcome.success(),
                                outcome.output(), outcome.error());
                    }
                });
        ctx.cancellation().throwIfCancelled();

        String toolTask = "tools:" + step;
        List<PendingWrite> written = new ArrayList<>();
        int idx = 0;
        for (ToolOutcome outcome : outcomes) {
            ctx.addToolEvent(outcome);
            ChatMessage result = outcome.success()
                    ? ChatMessage.toolResult(outcome.call().id(), outcome.call().name(), ToolCallStatus.SUCCESS,
                            outcome.output() == null ? "null" : outcome.output().toString())
                    : ChatMessage.toolResult(outcome.call().id(), outcome.call().name(), ToolCallStatus.ERROR,
                            outcome.error());
            written.add(ctx.record(ctx.taskId(toolTask), idx++, result));
        }
        stage(ctx, toolTask, written);
    }

    private ModelResponse callModel(TurnContext ctx) {
        ModelRequest request = new ModelRequest(ctx.systemPrompt(), ctx.transcript(), ctx.tools().descriptors());
        ModelUnavailableException last = null;
        for (int attempt = 0; attempt <= settings.modelMaxRetries(); attempt++) {
            ctx.cancellation().throwIfCancelled();
            Duration remaining = ctx.remaining();
            boolean boundedByTurn = remaining.compareTo(settings.modelTimeout()) < 0;
            Duration wait = boundedByTurn ? remaining : settings.modelTimeout();
            AtomicBoolean open = new AtomicBoolean(true);
            AtomicBoolean streamed = new AtomicBoolean();
            Consumer<String> tokens = token -> {
                synchronized (open) {
                    if (open.get()) {
                        streamed.set(true);
                        ctx.emitter().token(token);
                    }
                }
            };
            Future<ModelResponse> future = turnPool.submit(() ->
                    modelClient.generate(request, tokens, ctx.cancellation()));
            ctx.cancellation().onCancel(() -> future.cancel(true));
            try {
                return future.get(wait.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                future.cancel(true);
                if (boundedByTurn) {
                    throw new TurnTimeoutException(settings.turnTimeout());
                }
                last = new ModelUnavailableException("Model call timed out after " + wait.toMillis() + " ms", e);
            } catch (CancellationException e) {
                throw new TurnCancelledException();
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                throw new TurnCancelledException();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof ModelUnavailableException mue) {
                    last = mue;
                } else if (cause instanceof RuntimeException re
                        && !(cause instanceof ModelNotConfiguredException)
                        && !(cause instanceof TurnCancelledException)) {
                    last = new ModelUnavailableException("Model call failed: " + re.getMessage(), re);
                } else if (cause instanceof RuntimeException re) {
                    throw re;
                } else {
                    last = new ModelUnavailableException("Model call failed: " + cause, cause);
                }
            } finally {
                synchronized (open) {
                    open.set(false);
                }
            }
            if (streamed.get()) {
                // streamed tokens cannot be taken back
                log.warn("Model call failed on thread {} after streaming output, not retrying: {}",
                        ctx.handle().threadId(), last.getMessage());
                throw last;
            }
            if (attempt < settings.modelMaxRetries()) {
                long backoff = settings.modelBackoff().toMillis() << attempt;
                log.warn("Model call failed on thread {} (attempt {}), retrying in {} ms: {}",
                        ctx.handle().threadId(), attempt + 1, backoff, last.getMessage());
                try {
                    if (!ctx.cancellation().sleep(backoff, TimeUnit.MILLISECONDS)) {
                        throw new TurnCancelledException();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TurnCancelledException();
                }
            }
        }
        throw last;
    }

    private void stage(TurnContext ctx, String task, List<PendingWrite> writes) {
        ctx.handle().stage(ctx.baseCheckpointId(), ctx.taskId(task), writes);
    }

    private TurnResult complete(TurnContext ctx) {
        ctx.transition(TurnPhase.COMMITTING);
        Checkpoint cp = commit(ctx, TurnStatus.COMPLETED, null);
        ctx.transition(TurnPhase.DONE);
        log.info("Turn completed on thread {}: checkpoint {} (iterations {})",
                cp.threadId(), cp.checkpointId(), ctx.iterations());
        ctx.emitter().turnComplete(cp.checkpointId(), TurnStatus.COMPLETED, ctx.answer());
        return new TurnResult(cp.threadId(), cp.checkpointId(), TurnStatus.COMPLETED, ctx.answer(),
                ctx.toolEvents(), null, null);
    }

    private TurnResult fail(TurnContext ctx, RuntimeException cause) {
        String kind = errorKind(cause);
        log.error("Turn failed on thread {}: {}", ctx.handle().threadId(), cause.getMessage(), cause);
        try {
            if (ctx.phase() != TurnPhase.COMMITTING) {
                ctx.transition(TurnPhase.COMMITTING);
            }
            ctx.closeDanglingToolCalls("Not executed: " + cause.getMessage());
            Checkpoint cp = commit(ctx, TurnStatus.FAILED, cause.getMessage());
            ctx.transition(TurnPhase.FAILED);
            ctx.emitter().error(kind, cause.getMessage(), cp.checkpointId());
            return new TurnResult(cp.threadId(), cp.checkpointId(), TurnStatus.FAILED, null,
                    ctx.toolEvents(), kind, cause.getMessage());
        } catch (CheckpointStorageException | CheckpointConflictException e) {
            return unrecorded(ctx, e);
        }
    }

    private TurnResult unrecorded(TurnContext ctx, RuntimeException cause) {
        String kind = errorKind(cause);
        log.error("Turn on thread {} could not be recorded: {}", ctx.handle().threadId(), cause.getMessage(), cause);
        if (!ctx.phase().isTerminal()) {
            ctx.transition(TurnPhase.FAILED);
        }
        ctx.unrecordedFailure(cause);
        ctx.emitter().error(kind, cause.getMessage(), null);
        return new TurnResult(ctx.handle().threadId(), null, TurnStatus.FAILED, null,
                ctx.toolEvents(), kind, cause.getMessage());
    }

    private TurnResult cancelled(TurnContext ctx) {
        log.info("Turn cancelled on thread {}; nothing committed", ctx.handle().threadId());
        if (ctx.phase().canTransitionTo(TurnPhase.CANCELLED)) {
            ctx.transition(TurnPhase.CANCELLED);
        }
        ctx.emitter().close();
        return new TurnResult(ctx.handle().threadId(), null, TurnStatus.CANCELLED, null,
                ctx.toolEvents(), "cancelled", "Turn cancelled");
    }

    /**
     * Appends this turn's writes onto the base checkpoint. On conflict the latest checkpoint is
     * reloaded and the same writes are replayed onto it, up to the configured retry count.
     */
    private Checkpoint commit(TurnContext ctx, TurnStatus status, String error) {
        List<PendingWrite> writes = new ArrayList<>(ctx.writes());
        writes.addAll(ctx.controlWrites(status.name(), error));
        ThreadHandle handle = ctx.handle();
        String parentId = ctx.baseCheckpointId();
        ConversationState base = ctx.baseState();
        for (int attempt = 0; ; attempt++) {
            try {
                Checkpoint cp = handle.commit(parentId, base, writes, CheckpointMetadata.turn(handle.accountId()));
                if (!Objects.equals(parentId, ctx.baseCheckpointId())) {
                    handle.discardStaged(ctx.baseCheckpointId());
                }
                return cp;
            } catch (CheckpointConflictException e) {
                if (attempt >= settings.commitMaxRetries()) {
                    log.error("Commit on thread {} still conflicting after {} retries", handle.threadId(), attempt);
                    throw e;
                }
                log.warn("Commit conflict on thread {} (parent {}), replaying onto latest",
                        handle.threadId(), parentId);
                Optional<Checkpoint> latest = handle.loadState();
                parentId = latest.map(Checkpoint::checkpointId).orElse(null);
                base = latest.map(Checkpoint::state).orElse(ConversationState.empty());
            }
        }
    }

    static String errorKind(Throwable e) {
        if (e instanceof ToolLoopExceededException) return "tool_loop_exceeded";
        if (e instanceof ModelUnavailableException) return "model_unavailable";
        if (e instanceof ModelNotConfiguredException) return "model_not_configured";
        if (e instanceof TurnTimeoutException) return "turn_timeout";
        if (e instanceof CheckpointConflictException) return "checkpoint_conflict";
        if (e instanceof CheckpointStorageException) return "checkpoint_storage";
        return "internal";
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @PreDestroy
    public void shutdown() {
        turnPool.shutdownNow();
        toolPool.shutdownNow();
        timer.shutdownNow();
    }
}
