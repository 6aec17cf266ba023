package io.github.drompincen.folioagent.runtime.agent;

import java.time.Duration;

public record AgentSettings(
        int maxIterations,
        int maxParallelTools,
        Duration toolTimeout,
        Duration turnTimeout,
        Duration modelTimeout,
        int modelMaxRetries,
        Duration modelBackoff,
        int commitMaxRetries,
        String namespace
) {
    public AgentSettings {
        if (maxIterations < 1) throw new IllegalArgumentException("maxIterations must be >= 1");
        if (maxParallelTools < 1) throw new IllegalArgumentException("maxParallelTools must be >= 1");
        if (modelMaxRetries < 0) throw new IllegalArgumentException("modelMaxRetries must be >= 0");
        if (commitMaxRetries < 0) throw new IllegalArgumentException("commitMaxRetries must be >= 0");
        namespace = namespace == null ? "" : namespace;
    }

    public static AgentSettings defaults() {
        return new AgentSettings(8, 4, Duration.ofSeconds(15), Duration.ofSeconds(120),
                Duration.ofSeconds(60), 2, Duration.ofMillis(500), 3, "");
    }

    public AgentSettings withMaxIterations(int value) {
        return new AgentSettings(value, maxParallelTools, toolTimeout, turnTimeout, modelTimeout,
                modelMaxRetries, modelBackoff, commitMaxRetries, namespace);
    }

    public AgentSettings withToolTimeout(Duration value) {
        return new AgentSettings(maxIterations, maxParallelTools, value, turnTimeout, modelTimeout,
                modelMaxRetries, modelBackoff, commitMaxRetries, namespace);
    }

    public AgentSettings withTurnTimeout(Duration value) {
        return new AgentSettings(maxIterations, maxParallelTools, toolTimeout, value, modelTimeout,
                modelMaxRetries, modelBackoff, commitMaxRetries, namespace);
    }

    public AgentSettings withModelRetries(int retries, Duration backoff) {
        return new AgentSettings(maxIterations, maxParallelTools, toolTimeout, turnTimeout, modelTimeout,
                retries, backoff, commitMaxRetries, namespace);
    }
}
