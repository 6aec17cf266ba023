package io.github.drompincen.folioagent.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.folioagent.runtime.checkpoint.ToolCallRequest;
import io.github.drompincen.folioagent.runtime.tools.Tool;
import io.github.drompincen.folioagent.runtime.tools.ToolContext;
import io.github.drompincen.folioagent.runtime.tools.ToolFactory;
import io.github.drompincen.folioagent.runtime.tools.ToolResult;
import io.github.drompincen.folioagent.runtime.tools.ToolSet;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.github.drompincen.folioagent.runtime.agent.TestTools.MAPPER;
import static io.github.drompincen.folioagent.runtime.agent.TestTools.args;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ToolDispatcherTest {

    private final ExecutorService pool = Executors.newCachedThreadPool();
    private final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();

    /** Tracks how many invocations overlap. */
    static class CountingTool implements Tool {
        final AtomicInteger running = new AtomicInteger();
        final AtomicInteger peak = new AtomicInteger();

        @Override
        public String name() { return "counting"; }

        @Override
        public String description() { return "Counts overlap"; }

        @Override
        public JsonNode inputSchema() { return MAPPER.createObjectNode().put("type", "object"); }

        @Override
        public ToolResult execute(ToolContext ctx, JsonNode input) {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                running.decrementAndGet();
            }
            return ToolResult.success(MAPPER.createObjectNode().put("call", ctx.callId()));
        }
    }

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
        timer.shutdownNow();
    }

    @Test
    void respectsParallelismLimitAndKeepsIssuedOrder() {
        CountingTool tool = new CountingTool();
        ToolSet tools = new ToolFactory(List.of(tool)).build(42);
        List<ToolCallRequest> calls = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            calls.add(new ToolCallRequest("c" + i, "counting", args()));
        }
        List<String> started = new ArrayList<>();
        List<String> finished = new ArrayList<>();

        List<ToolOutcome> outcomes = new ToolDispatcher(pool, timer, 2).dispatch(calls, tools, Duration.ofSeconds(5),
                new CancellationToken(), new ToolDispatcher.Listener() {
                    @Override
                    public void started(ToolCallRequest call, String statusMessage) {
                        started.add(call.id());
                    }

                    @Override
                    public void finished(ToolOutcome outcome) {
                        finished.add(outcome.call().id());
                    }
                });

        assertThat(tool.peak.get()).isLessThanOrEqualTo(2);
        assertThat(outcomes).extracting(o -> o.output().get("call").asText())
                .containsExactly("c0", "c1", "c2", "c3", "c4", "c5");
        assertThat(started).containsExactly("c0", "c1", "c2", "c3", "c4", "c5");
        assertThat(finished).isEqualTo(started);
    }

    @Test
    void timedOutCallReleasesItsSlot() {
        TestTools.SleepyTool sleepy = new TestTools.SleepyTool();
        ToolSet tools = new ToolFactory(List.of(sleepy)).build(42);
        List<ToolCallRequest> calls = List.of(
                new ToolCallRequest("slow", "sleepy", args("label", "slow", "delayMs", 10_000)),
                new ToolCallRequest("fast", "sleepy", args("label", "fast", "delayMs", 0)));

        List<ToolOutcome> outcomes = new ToolDispatcher(pool, timer, 1).dispatch(calls, tools, Duration.ofMillis(100),
                new CancellationToken(), new ToolDispatcher.Listener() {
                    @Override
                    public void started(ToolCallRequest call, String statusMessage) {
                    }

                    @Override
                    public void finished(ToolOutcome outcome) {
                    }
                });

        assertThat(outcomes.get(0).success()).isFalse();
        assertThat(outcomes.get(0).error()).isEqualTo("sleepy timed out after 100 ms");
        assertThat(outcomes.get(1).success()).isTrue();
    }

    @Test
    void toolIgnoringInterruptKeepsItsSlotPastTheTimeout() {
        TestTools.StubbornTool stubborn = new TestTools.StubbornTool();
        ToolSet tools = new ToolFactory(List.of(stubborn)).build(42);
        List<ToolCallRequest> calls = List.of(
                new ToolCallRequest("stuck", "stubborn", args("delayMs", 800)),
                new ToolCallRequest("next", "stubborn", args("delayMs", 0)));
        List<String> started = new ArrayList<>();

        List<ToolOutcome> outcomes = new ToolDispatcher(pool, timer, 1).dispatch(calls, tools, Duration.ofMillis(100),
                new CancellationToken(), new ToolDispatcher.Listener() {
                    @Override
                    public void started(ToolCallRequest call, String statusMessage) {
                        started.add(call.id());
                    }

                    @Override
                    public void finished(ToolOutcome outcome) {
                    }
                });

        assertThat(stubborn.peak.get()).isEqualTo(1);
        assertThat(stubborn.invocations.get()).isEqualTo(1);
        assertThat(outcomes.get(0).error()).isEqualTo("stubborn timed out after 100 ms");
        assertThat(outcomes.get(1).success()).isFalse();
        assertThat(outcomes.get(1).error()).contains("could not start");
        assertThat(started).containsExactly("stuck", "next");
    }

    @Test
    void cancellationInterruptsRunningToolAndAbortsDispatch() throws Exception {
        TestTools.BlockingTool blocking = new TestTools.BlockingTool();
        ToolSet tools = new ToolFactory(List.of(blocking)).build(42);
        CancellationToken cancellation = new CancellationToken();
        ToolDispatcher dispatcher = new ToolDispatcher(pool, timer, 2);

        Future<List<ToolOutcome>> dispatched = Executors.newSingleThreadExecutor().submit(() ->
                dispatcher.dispatch(List.of(new ToolCallRequest("b1", "blocking", args())), tools,
                        Duration.ofSeconds(30), cancellation, new ToolDispatcher.Listener() {
                            @Override
                            public void started(ToolCallRequest call, String statusMessage) {
                            }

                            @Override
                            public void finished(ToolOutcome outcome) {
                            }
                        }));
        assertThat(blocking.running.await(5, TimeUnit.SECONDS)).isTrue();

        cancellation.cancel();

        assertThat(blocking.interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        assertThatThrownBy(() -> dispatched.get(5, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(TurnCancelledException.class);
    }
}
