package io.github.drompincen.folioagent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.folioagent.runtime.tools.Tool;
import io.github.drompincen.folioagent.runtime.tools.ToolContext;
import io.github.drompincen.folioagent.runtime.tools.ToolResult;
import org.springframework.stereotype.Component;

@Component
public class GetMarketSentimentTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "get_market_sentiment"; }
    @Override public String description() { return "Get a sentiment reading for the market as a whole"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        return schema;
    }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        ObjectNode out = MAPPER.createObjectNode();
        out.put("status", "Stub");
        out.put("message", "Market sentiment analysis is not yet implemented.");
        out.put("overallScore", 0.0);
        out.put("label", "Neutral");
        return ToolResult.success(out);
    }
}
