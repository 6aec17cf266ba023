package io.github.drompincen.folioagent.runtime.agent;

import org.junit.jupiter.api.Test;

import static io.github.drompincen.folioagent.runtime.agent.TestTools.MAPPER;
import static org.assertj.core.api.Assertions.assertThat;

class SystemPromptServiceTest {

    @Test
    void rendersConfiguredPromptForAccount() {
        SystemPromptService service = new SystemPromptService(MAPPER, "classpath:prompts/agent-prompts.json");

        String prompt = service.render(42, false);

        assertThat(prompt).contains("Account ID 42")
                .contains("YOUR AVAILABLE TOOLS:")
                .contains("- get_holdings")
                .contains("\"Show me my portfolio\"")
                .doesNotContain("{accountId}")
                .doesNotContain("VOICE MODE");
    }

    @Test
    void voiceModeAppendsSpokenInstructions() {
        SystemPromptService service = new SystemPromptService(MAPPER, "classpath:prompts/agent-prompts.json");

        String prompt = service.render(7, true);

        assertThat(prompt).contains("Account ID 7").contains("VOICE MODE:").contains("read aloud");
    }

    @Test
    void missingConfigurationFallsBackToDefaultPrompt() {
        SystemPromptService service = new SystemPromptService(MAPPER, "classpath:prompts/does-not-exist.json");

        assertThat(service.render(42, false))
                .isEqualTo(SystemPromptService.FALLBACK_PROMPT.replace("{accountId}", "42"));
        assertThat(service.render(42, true)).contains("VOICE MODE");
    }
}
