package io.github.drompincen.folioagent.gateway.config;

import io.github.drompincen.folioagent.runtime.agent.AgentSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.convert.DurationStyle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Clock;
import java.time.Duration;

/**
 * Binds the {@code folioagent.agent.*} keys once into the immutable settings handed to the orchestrator.
 */
@Configuration
public class AgentConfig {

    private static final Logger log = LoggerFactory.getLogger(AgentConfig.class);

    static final String PREFIX = "folioagent.agent.";

    @Bean
    AgentSettings agentSettings(Environment environment) {
        AgentSettings settings = bind(environment);
        log.info("Agent settings: {}", settings);
        return settings;
    }

    @Bean
    Clock clock() {
        return Clock.systemDefaultZone();
    }

    static AgentSettings bind(Environment env) {
        AgentSettings d = AgentSettings.defaults();
        return new AgentSettings(
                env.getProperty(PREFIX + "max-iterations", Integer.class, d.maxIterations()),
                env.getProperty(PREFIX + "max-parallel-tools", Integer.class, d.maxParallelTools()),
                duration(env, "tool-timeout", d.toolTimeout()),
                duration(env, "turn-timeout", d.turnTimeout()),
                duration(env, "model-timeout", d.modelTimeout()),
                env.getProperty(PREFIX + "model-max-retries", Integer.class, d.modelMaxRetries()),
                duration(env, "model-backoff", d.modelBackoff()),
                env.getProperty(PREFIX + "commit-max-retries", Integer.class, d.commitMaxRetries()),
                env.getProperty(PREFIX + "namespace", d.namespace()));
    }

    private static Duration duration(Environment env, String key, Duration fallback) {
        String raw = env.getProperty(PREFIX + key);
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return DurationStyle.detectAndParse(raw.trim());
    }
}
