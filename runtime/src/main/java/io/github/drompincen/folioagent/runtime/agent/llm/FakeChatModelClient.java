package io.github.drompincen.folioagent.runtime.agent.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.folioagent.protocol.api.ToolDescriptor;
import io.github.drompincen.folioagent.runtime.agent.CancellationToken;
import io.github.drompincen.folioagent.runtime.checkpoint.ChatMessage;
import io.github.drompincen.folioagent.runtime.checkpoint.ToolCallRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * Fake model for running without an API key. Questions about holdings, performance or
 * prices are answered by calling the matching tool first; everything else gets a canned reply.
 *
 * Activate with: FOLIOAGENT_LLM_PROVIDER=fake
 */
@Service
@ConditionalOnProperty(name = "folioagent.llm.provider", havingValue = "fake")
public class FakeChatModelClient implements ChatModelClient {

    private static final Logger log = LoggerFactory.getLogger(FakeChatModelClient.class);

    private final ObjectMapper objectMapper;

    public FakeChatModelClient(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    @Override
    public String modelName() {
        return "fake";
    }

    @Override
    public ModelResponse generate(ModelRequest request, Consumer<String> tokenSink, CancellationToken cancellation) {
        List<ChatMessage> transcript = request.transcript();
        ChatMessage last = transcript.isEmpty() ? null : transcript.get(transcript.size() - 1);

        if (last != null && ChatMessage.USER.equals(last.role())) {
            ToolCallRequest call = planToolCall(last.content(), request.tools());
            if (call != null) {
                log.debug("[FAKE LLM] calling {}", call.name());
                return ModelResponse.toolCalls("", List.of(call));
            }
        }

        String answer = last != null && ChatMessage.TOOL.equals(last.role())
                ? summarizeToolResults(transcript)
                : "I can help with questions about your holdings, portfolio performance and live prices.";
        for (String word : answer.split("(?<=\\s)")) {
            cancellation.throwIfCancelled();
            tokenSink.accept(word);
        }
        return ModelResponse.answer(answer);
    }

    private ToolCallRequest planToolCall(String question, List<ToolDescriptor> tools) {
        String lower = question == null ? "" : question.toLowerCase(Locale.ROOT);
        ObjectNode args = objectMapper.createObjectNode();
        String tool;
        if (lower.contains("compare")) {
            tool = "compare_portfolio_performance";
            args.put("start_date", "yesterday");
            args.put("end_date", "today");
        } else if (lower.contains("perform") || lower.contains("return")) {
            tool = "analyze_portfolio_performance";
            args.put("analysis_date", "today");
        } else if (lower.contains("holding") || lower.contains("portfolio") || lower.contains("position")) {
            tool = "get_holdings";
            args.put("date", "today");
        } else if (lower.contains("price")) {
            tool = "get_real_time_prices";
            args.putArray("tickers").add("AAPL");
        } else {
            return null;
        }
        String chosen = tool;
        boolean available = tools.stream().anyMatch(t -> t.name().equals(chosen));
        return available ? new ToolCallRequest("call_" + UUID.randomUUID().toString().substring(0, 8), chosen, args) : null;
    }

    private String summarizeToolResults(List<ChatMessage> transcript) {
        List<String> parts = new ArrayList<>();
        for (int i = transcript.size() - 1; i >= 0 && ChatMessage.TOOL.equals(transcript.get(i).role()); i--) {
            ChatMessage m = transcript.get(i);
            parts.add(0, m.toolName() + " returned " + m.content());
        }
        return "Here is what I found: " + String.join("; ", parts);
    }
}
