package io.github.drompincen.folioagent.runtime.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;

/**
 * Renders the portfolio advisor system prompt from the JSON prompt configuration.
 * Prompts are rendered per request and never stored in a checkpoint.
 */
@Service
public class SystemPromptService {

    private static final Logger log = LoggerFactory.getLogger(SystemPromptService.class);

    static final String FALLBACK_PROMPT =
            "You are a helpful financial advisor for Account ID {accountId}. "
                    + "Provide clear, friendly assistance with portfolio questions.";

    private final JsonNode config;

    @Autowired
    public SystemPromptService(ObjectMapper objectMapper,
                               @Value("${folioagent.prompts.location:classpath:prompts/agent-prompts.json}") String location) {
        this(objectMapper, new DefaultResourceLoader(), location);
    }

    SystemPromptService(ObjectMapper objectMapper, ResourceLoader resourceLoader, String location) {
        this.config = load(objectMapper, resourceLoader.getResource(location), location);
    }

    private static JsonNode load(ObjectMapper objectMapper, Resource resource, String location) {
        if (!resource.exists()) {
            log.warn("Prompt configuration not found at {}, using fallback prompt", location);
            return null;
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode node = objectMapper.readTree(in);
            log.info("Loaded agent prompt configuration from {}", location);
            return node;
        } catch (IOException e) {
            log.error("Failed to read prompt configuration {}, using fallback prompt", location, e);
            return null;
        }
    }

    public String render(long accountId, boolean voiceMode) {
        String prompt = advisorPrompt(accountId);
        if (voiceMode) {
            prompt = prompt + "\n\n" + voiceSection();
        }
        return prompt;
    }

    private String advisorPrompt(long accountId) {
        JsonNode advisor = config == null ? null : config.get("portfolioAdvisor");
        if (advisor == null || !advisor.hasNonNull("baseInstructions")) {
            return substitute(FALLBACK_PROMPT, accountId);
        }
        StringBuilder sb = new StringBuilder();
        sb.append(substitute(advisor.get("baseInstructions").asText(), accountId)).append("\n\n");
        appendList(sb, "Use your tools when someone asks things like:", advisor.path("whenToUseTools"), true);
        appendList(sb, "Just have a normal chat for:", advisor.path("whenNotToUseTools"), true);
        appendList(sb, "YOUR AVAILABLE TOOLS:", advisor.path("availableTools"), false);
        appendList(sb, "FORMATTING:", advisor.path("formattingGuidelines"), false);
        appendList(sb, "REMEMBER:", advisor.path("keyReminders"), false);
        if (advisor.hasNonNull("personality")) {
            sb.append(advisor.get("personality").asText());
        }
        return sb.toString().trim();
    }

    private String voiceSection() {
        JsonNode instructions = config == null ? null : config.path("voiceMode").path("instructions");
        if (instructions == null || !instructions.isArray() || instructions.isEmpty()) {
            return "VOICE MODE: answer in at most three short spoken sentences without markdown.";
        }
        StringBuilder sb = new StringBuilder("VOICE MODE:");
        for (JsonNode line : instructions) {
            sb.append("\n- ").append(line.asText());
        }
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String heading, JsonNode items, boolean quoted) {
        if (!items.isArray() || items.isEmpty()) return;
        sb.append(heading).append('\n');
        for (JsonNode item : items) {
            sb.append("- ");
            if (quoted) sb.append('"').append(item.asText()).append('"');
            else sb.append(item.asText());
            sb.append('\n');
        }
        sb.append('\n');
    }

    private static String substitute(String template, long accountId) {
        return template.replace("{accountId}", Long.toString(accountId));
    }
}
