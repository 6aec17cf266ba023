package io.github.drompincen.folioagent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.folioagent.runtime.tools.Tool;
import io.github.drompincen.folioagent.runtime.tools.ToolContext;
import io.github.drompincen.folioagent.runtime.tools.ToolResult;
import org.springframework.stereotype.Component;

/**
 * Placeholder until a market data feed is wired in; always reports {@code Status: Stub}.
 */
@Component
public class GetMarketContextTool implements Tool {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Override public String name() { return "get_market_context"; }
    @Override public String description() { return "Get an overview of current market conditions and major indices"; }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties");
        return schema;
    }

    @Override public String statusMessage() { return "Checking market conditions..."; }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        ObjectNode out = MAPPER.createObjectNode();
        out.put("status", "Stub");
        out.put("message", "Market intelligence integration is not yet implemented.");
        out.put("marketSummary", "Market intelligence requires external API integration");
        return ToolResult.success(out);
    }
}
