package io.github.drompincen.folioagent.runtime.agent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation signal shared by everything a turn starts. Callbacks registered after
 * cancellation run immediately.
 */
public class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();
    private final Object monitor = new Object();

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void cancel() {
        if (!cancelled.compareAndSet(false, true)) {
            return;
        }
        synchronized (monitor) {
            monitor.notifyAll();
        }
        for (Runnable callback : callbacks) {
            if (callbacks.remove(callback)) {
                runQuietly(callback);
            }
        }
    }

    public void onCancel(Runnable callback) {
        callbacks.add(callback);
        if (cancelled.get() && callbacks.remove(callback)) {
            runQuietly(callback);
        }
    }

    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new TurnCancelledException();
        }
    }

    /**
     * Sleeps for the given delay unless cancelled first.
     *
     * @return true if the full delay elapsed
     */
    public boolean sleep(long delay, TimeUnit unit) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(delay);
        synchronized (monitor) {
            while (!cancelled.get()) {
                long remaining = deadline - System.nanoTime();
                if (remaining <= 0) {
                    return true;
                }
                TimeUnit.NANOSECONDS.timedWait(monitor, remaining);
            }
        }
        return false;
    }

    private static void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage());
        }
    }
}
