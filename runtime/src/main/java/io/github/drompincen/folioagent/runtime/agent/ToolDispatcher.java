package io.github.drompincen.folioagent.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.folioagent.runtime.checkpoint.ToolCallRequest;
import io.github.drompincen.folioagent.runtime.tools.BoundTool;
import io.github.drompincen.folioagent.runtime.tools.ToolExecutionException;
import io.github.drompincen.folioagent.runtime.tools.ToolSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the tool calls of one model step concurrently, at most {@code maxParallel} at a time.
 * Each call is cancelled once its timeout elapses. Outcomes are returned in the order the
 * calls were issued, whatever order they complete in.
 * <p>
 * A slot is held until its tool actually returns, so a tool that ignores interruption keeps
 * its slot past the timeout. A call that cannot get a slot within twice the timeout fails
 * without running.
 */
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    /** Receives progress for each call, on the dispatching thread and in issued order. */
    public interface Listener {
        void started(ToolCallRequest call, String statusMessage);

        void finished(ToolOutcome outcome);
    }

    private final ExecutorService toolPool;
    private final ScheduledExecutorService timer;
    private final int maxParallel;

    public ToolDispatcher(ExecutorService toolPool, ScheduledExecutorService timer, int maxParallel) {
        this.toolPool = toolPool;
        this.timer = timer;
        this.maxParallel = maxParallel;
    }

    public List<ToolOutcome> dispatch(List<ToolCallRequest> calls, ToolSet tools, Duration timeout,
                                      CancellationToken cancellation, Listener listener) {
        Semaphore permits = new Semaphore(maxParallel);
        List<Slot> slots = new ArrayList<>();
        for (ToolCallRequest call : calls) {
            cancellation.throwIfCancelled();
            Optional<BoundTool> tool = tools.get(call.name());
            if (tool.isEmpty()) {
                listener.started(call, "Unknown tool " + call.name());
                slots.add(Slot.resolved(ToolOutcome.failure(call, "Unknown tool: " + call.name())));
                continue;
            }
            boolean acquired = acquire(permits, timeout.multipliedBy(2), cancellation);
            listener.started(call, tool.get().statusMessage());
            if (!acquired) {
                log.warn("Tool {} ({}) found no free slot within {} ms", call.name(), call.id(), timeout.multipliedBy(2).toMillis());
                slots.add(Slot.resolved(ToolOutcome.failure(call, call.name() + " could not start within "
                        + timeout.multipliedBy(2).toMillis() + " ms: all tool slots are busy")));
                continue;
            }
            slots.add(submit(call, tool.get(), permits, timeout, cancellation));
        }

        List<ToolOutcome> outcomes = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            ToolOutcome outcome = slot.await(cancellation);
            listener.finished(outcome);
            outcomes.add(outcome);
        }
        return outcomes;
    }

    private Slot submit(ToolCallRequest call, BoundTool tool, Semaphore permits, Duration timeout,
                        CancellationToken cancellation) {
        // whoever claims first owns the permit: the task releases it when the tool returns,
        // an abort releases it only if the task never started
        AtomicBoolean claimed = new AtomicBoolean();
        Future<JsonNode> future = toolPool.submit(() -> {
            if (!claimed.compareAndSet(false, true)) {
                throw new CancellationException();
            }
            try {
                return tool.invoke(call.id(), call.arguments());
            } finally {
                permits.release();
            }
        });
        Runnable abort = () -> {
            if (claimed.compareAndSet(false, true)) {
                permits.release();
            }
            future.cancel(true);
        };
        Slot slot = new Slot(call, future, timeout);
        slot.timeoutTask = timer.schedule(() -> {
            if (!future.isDone()) {
                slot.timedOut.set(true);
                abort.run();
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        cancellation.onCancel(abort);
        return slot;
    }

    private static boolean acquire(Semaphore permits, Duration maxWait, CancellationToken cancellation) {
        long deadline = System.nanoTime() + maxWait.toNanos();
        try {
            while (!permits.tryAcquire(50, TimeUnit.MILLISECONDS)) {
                cancellation.throwIfCancelled();
                if (System.nanoTime() - deadline >= 0) {
                    return false;
                }
            }
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TurnCancelledException();
        }
    }

    private static final class Slot {
        private final ToolCallRequest call;
        private final Future<JsonNode> future;
        private final Duration timeout;
        private final ToolOutcome resolved;
        private final AtomicBoolean timedOut = new AtomicBoolean();
        private volatile Future<?> timeoutTask;

        private Slot(ToolCallRequest call, Future<JsonNode> future, Duration timeout) {
            this.call = call;
            this.future = future;
            this.timeout = timeout;
            this.resolved = null;
        }

        private Slot(ToolOutcome resolved) {
            this.call = resolved.call();
            this.future = null;
            this.timeout = null;
            this.resolved = resolved;
        }

        static Slot resolved(ToolOutcome outcome) {
            return new Slot(outcome);
        }

        ToolOutcome await(CancellationToken cancellation) {
            if (resolved != null) {
                return resolved;
            }
            try {
                JsonNode output = future.get();
                return ToolOutcome.success(call, output);
            } catch (CancellationException e) {
                if (timedOut.get()) {
                    log.warn("Tool {} ({}) timed out after {} ms", call.name(), call.id(), timeout.toMillis());
                    return ToolOutcome.failure(call, call.name() + " timed out after " + timeout.toMillis() + " ms");
                }
                cancellation.throwIfCancelled();
                return ToolOutcome.failure(call, call.name() + " was cancelled");
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                String message = cause instanceof ToolExecutionException
                        ? cause.getMessage()
                        : call.name() + " failed: " + cause.getMessage();
                log.warn("Tool {} ({}) failed: {}", call.name(), call.id(), message);
                return ToolOutcome.failure(call, message);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                future.cancel(true);
                throw new TurnCancelledException();
            } finally {
                Future<?> t = timeoutTask;
                if (t != null) {
                    t.cancel(false);
                }
            }
        }
    }
}
