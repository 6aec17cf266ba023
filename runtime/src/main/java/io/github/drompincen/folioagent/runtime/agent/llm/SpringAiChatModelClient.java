package io.github.drompincen.folioagent.runtime.agent.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import io.github.drompincen.folioagent.runtime.agent.CancellationToken;
import io.github.drompincen.folioagent.runtime.agent.TurnCancelledException;
import io.github.drompincen.folioagent.runtime.checkpoint.ChatMessage;
import io.github.drompincen.folioagent.runtime.checkpoint.ToolCallRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.chat.prompt.Prompt;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;

/**
 * Model client backed by Spring AI. Uses whichever provider has a real (non-placeholder)
 * key configured; Anthropic is checked first, then OpenAI. Tool execution is disabled inside
 * Spring AI so every tool call comes back to the orchestrator.
 */
@Service
@ConditionalOnProperty(name = "folioagent.llm.provider", havingValue = "default", matchIfMissing = true)
public class SpringAiChatModelClient implements ChatModelClient {

    private static final Logger log = LoggerFactory.getLogger(SpringAiChatModelClient.class);

    static final String ANTHROPIC_KEY = "folioagent.llm.anthropic.api-key";
    static final String OPENAI_KEY = "folioagent.llm.openai.api-key";

    private final Environment environment;
    private final ObjectMapper objectMapper;

    private volatile ChatModel anthropicModel;
    private volatile ChatModel openAiModel;

    public SpringAiChatModelClient(Environment environment, ObjectMapper objectMapper) {
        this.environment = environment;
        this.objectMapper = objectMapper;
        log.info("SpringAiChatModelClient initialized, provider={}", resolveProvider());
    }

    enum Provider { ANTHROPIC, OPENAI, NONE }

    private static boolean hasRealKey(String key, String placeholderPrefix) {
        return key != null && !key.isBlank() && !key.startsWith(placeholderPrefix);
    }

    Provider resolveProvider() {
        if (hasRealKey(environment.getProperty(ANTHROPIC_KEY, ""), "sk-ant-placeholder")) {
            return Provider.ANTHROPIC;
        }
        if (hasRealKey(environment.getProperty(OPENAI_KEY, ""), "sk-placeholder")) {
            return Provider.OPENAI;
        }
        return Provider.NONE;
    }

    @Override
    public boolean isConfigured() {
        return resolveProvider() != Provider.NONE;
    }

    @Override
    public String modelName() {
        return switch (resolveProvider()) {
            case ANTHROPIC -> anthropicModelName();
            case OPENAI -> openAiModelName();
            case NONE -> "not_configured";
        };
    }

    private String anthropicModelName() {
        return environment.getProperty("folioagent.llm.anthropic.model", "claude-sonnet-4-5-20250929");
    }

    private String openAiModelName() {
        return environment.getProperty("folioagent.llm.openai.model", "gpt-4o");
    }

    @Override
    public ModelResponse generate(ModelRequest request, Consumer<String> tokenSink, CancellationToken cancellation) {
        Provider provider = resolveProvider();
        if (provider == Provider.NONE) {
            throw new ModelNotConfiguredException();
        }
        List<ToolCallback> callbacks = request.tools().stream()
                .map(DeclaredToolCallback::new)
                .map(ToolCallback.class::cast)
                .toList();
        ChatModel model = provider == Provider.ANTHROPIC ? anthropic() : openAi();
        ChatOptions options = provider == Provider.ANTHROPIC
                ? AnthropicChatOptions.builder().model(anthropicModelName()).maxTokens(4096)
                        .toolCallbacks(callbacks).internalToolExecutionEnabled(false).build()
                : OpenAiChatOptions.builder().model(openAiModelName())
                        .toolCallbacks(callbacks).internalToolExecutionEnabled(false).build();
        Prompt prompt = new Prompt(toMessages(request), options);
        log.debug("Generating via {} with {} messages and {} tools", provider,
                prompt.getInstructions().size(), callbacks.size());

        StringBuilder text = new StringBuilder();
        Map<String, ToolCallRequest> toolCalls = new LinkedHashMap<>();
        CompletableFuture<Void> done = new CompletableFuture<>();
        Disposable subscription = model.stream(prompt).subscribe(
                response -> collect(response, text, toolCalls, tokenSink),
                done::completeExceptionally,
                () -> done.complete(null));
        cancellation.onCancel(subscription::dispose);
        cancellation.onCancel(() -> done.cancel(false));
        try {
            done.get();
        } catch (InterruptedException e) {
            subscription.dispose();
            Thread.currentThread().interrupt();
            throw new TurnCancelledException();
        } catch (CancellationException e) {
            throw new TurnCancelledException();
        } catch (ExecutionException e) {
            throw new ModelUnavailableException("Model call failed: " + e.getCause().getMessage(), e.getCause());
        }
        if (!toolCalls.isEmpty()) {
            return ModelResponse.toolCalls(text.toString(), new ArrayList<>(toolCalls.values()));
        }
        return ModelResponse.answer(text.toString());
    }

    private void collect(ChatResponse response, StringBuilder text, Map<String, ToolCallRequest> toolCalls,
                         Consumer<String> tokenSink) {
        if (response == null || response.getResult() == null || response.getResult().getOutput() == null) {
            return;
        }
        AssistantMessage output = response.getResult().getOutput();
        String chunk = output.getText();
        if (chunk != null && !chunk.isEmpty()) {
            text.append(chunk);
            tokenSink.accept(chunk);
        }
        if (output.getToolCalls() != null) {
            for (AssistantMessage.ToolCall call : output.getToolCalls()) {
                toolCalls.put(call.id(), new ToolCallRequest(call.id(), call.name(), parseArguments(call.arguments())));
            }
        }
    }

    JsonNode parseArguments(String arguments) {
        if (arguments == null || arguments.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(arguments);
        } catch (JsonProcessingException e) {
            // left as text so schema validation reports it back to the model
            return TextNode.valueOf(arguments);
        }
    }

    List<Message> toMessages(ModelRequest request) {
        List<Message> messages = new ArrayList<>();
        if (request.systemPrompt() != null && !request.systemPrompt().isBlank()) {
            messages.add(new SystemMessage(request.systemPrompt()));
        }
        List<ToolResponseMessage.ToolResponse> pendingResponses = new ArrayList<>();
        for (ChatMessage msg : request.transcript()) {
            if (ChatMessage.TOOL.equals(msg.role())) {
                pendingResponses.add(new ToolResponseMessage.ToolResponse(
                        msg.toolCallId(), msg.toolName(), msg.content() == null ? "" : msg.content()));
                continue;
            }
            if (!pendingResponses.isEmpty()) {
                messages.add(new ToolResponseMessage(new ArrayList<>(pendingResponses)));
                pendingResponses.clear();
            }
            String content = msg.content() == null ? "" : msg.content();
            switch (msg.role()) {
                case ChatMessage.SYSTEM -> messages.add(new SystemMessage(content));
                case ChatMessage.ASSISTANT -> {
                    if (msg.hasToolCalls()) {
                        List<AssistantMessage.ToolCall> calls = msg.toolCalls().stream()
                                .map(c -> new AssistantMessage.ToolCall(c.id(), "function", c.name(),
                                        c.arguments() == null ? "{}" : c.arguments().toString()))
                                .toList();
                        messages.add(new AssistantMessage(content, Map.of(), calls));
                    } else {
                        messages.add(new AssistantMessage(content));
                    }
                }
                default -> messages.add(new UserMessage(content));
            }
        }
        if (!pendingResponses.isEmpty()) {
            messages.add(new ToolResponseMessage(new ArrayList<>(pendingResponses)));
        }
        return messages;
    }

    private ChatModel anthropic() {
        ChatModel model = anthropicModel;
        if (model == null) {
            synchronized (this) {
                if (anthropicModel == null) {
                    AnthropicApi api = AnthropicApi.builder()
                            .apiKey(environment.getProperty(ANTHROPIC_KEY))
                            .build();
                    anthropicModel = AnthropicChatModel.builder()
                            .anthropicApi(api)
                            .defaultOptions(AnthropicChatOptions.builder().model(anthropicModelName()).build())
                            .build();
                    log.info("Created Anthropic model {}", anthropicModelName());
                }
                model = anthropicModel;
            }
        }
        return model;
    }

    private ChatModel openAi() {
        ChatModel model = openAiModel;
        if (model == null) {
            synchronized (this) {
                if (openAiModel == null) {
                    OpenAiApi api = OpenAiApi.builder()
                            .baseUrl(environment.getProperty("folioagent.llm.openai.base-url", "https://api.openai.com"))
                            .apiKey(environment.getProperty(OPENAI_KEY))
                            .build();
                    openAiModel = OpenAiChatModel.builder()
                            .openAiApi(api)
                            .defaultOptions(OpenAiChatOptions.builder().model(openAiModelName()).build())
                            .build();
                    log.info("Created OpenAI model {}", openAiModelName());
                }
                model = openAiModel;
            }
        }
        return model;
    }
}
