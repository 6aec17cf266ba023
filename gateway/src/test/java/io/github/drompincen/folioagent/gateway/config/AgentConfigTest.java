package io.github.drompincen.folioagent.gateway.config;

import io.github.drompincen.folioagent.runtime.agent.AgentSettings;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgentConfigTest {

    @Test
    void emptyEnvironmentYieldsDefaults() {
        assertThat(AgentConfig.bind(new MockEnvironment())).isEqualTo(AgentSettings.defaults());
    }

    @Test
    void bindsOverridesIncludingDurationSuffixes() {
        MockEnvironment env = new MockEnvironment()
                .withProperty("folioagent.agent.max-iterations", "3")
                .withProperty("folioagent.agent.max-parallel-tools", "2")
                .withProperty("folioagent.agent.tool-timeout", "5s")
                .withProperty("folioagent.agent.turn-timeout", "2m")
                .withProperty("folioagent.agent.model-backoff", "250ms")
                .withProperty("folioagent.agent.namespace", "eval");

        AgentSettings settings = AgentConfig.bind(env);

        assertThat(settings.maxIterations()).isEqualTo(3);
        assertThat(settings.maxParallelTools()).isEqualTo(2);
        assertThat(settings.toolTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.turnTimeout()).isEqualTo(Duration.ofMinutes(2));
        assertThat(settings.modelBackoff()).isEqualTo(Duration.ofMillis(250));
        assertThat(settings.modelTimeout()).isEqualTo(AgentSettings.defaults().modelTimeout());
        assertThat(settings.namespace()).isEqualTo("eval");
    }

    @Test
    void rejectsZeroIterations() {
        MockEnvironment env = new MockEnvironment().withProperty("folioagent.agent.max-iterations", "0");

        assertThatThrownBy(() -> AgentConfig.bind(env)).isInstanceOf(IllegalArgumentException.class);
    }
}
