package io.github.drompincen.folioagent.tools;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.github.drompincen.folioagent.runtime.tools.Tool;
import io.github.drompincen.folioagent.runtime.tools.ToolContext;
import io.github.drompincen.folioagent.runtime.tools.ToolResult;
import io.github.drompincen.folioagent.tools.portfolio.PortfolioGateway;
import io.github.drompincen.folioagent.tools.portfolio.PortfolioGatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@Component
public class GetRealTimePricesTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(GetRealTimePricesTool.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PortfolioGateway portfolio;

    public GetRealTimePricesTool(PortfolioGateway portfolio) {
        this.portfolio = portfolio;
    }

    @Override public String name() { return "get_real_time_prices"; }

    @Override public String description() {
        return "Get live prices for one or more ticker symbols, e.g. [\"AAPL.US\", \"MSFT.US\"].";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode tickers = schema.putObject("properties").putObject("tickers");
        tickers.put("type", "array");
        tickers.put("minItems", 1);
        tickers.putObject("items").put("type", "string");
        tickers.put("description", "Ticker symbols to price");
        schema.putArray("required").add("tickers");
        schema.put("additionalProperties", false);
        return schema;
    }

    @Override public String statusMessage() { return "Fetching live prices..."; }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        Set<String> unique = new LinkedHashSet<>();
        for (JsonNode ticker : input.path("tickers")) {
            String t = ticker.asText().trim().toUpperCase(Locale.ROOT);
            if (!t.isEmpty()) unique.add(t);
        }
        if (unique.isEmpty()) {
            return ToolResult.failure("No ticker symbols provided. Please specify at least one ticker.");
        }
        List<String> tickers = new ArrayList<>(unique);
        log.info("Fetching real-time prices for {} tickers: {}", tickers.size(), tickers);
        try {
            JsonNode prices = portfolio.realTimePrices(ctx.accountId(), tickers);
            ObjectNode out = MAPPER.createObjectNode();
            out.set("prices", prices);
            out.put("message", "Retrieved " + prices.size() + " real-time prices out of "
                    + tickers.size() + " requested tickers");
            return ToolResult.success(out);
        } catch (PortfolioGatewayException e) {
            return ToolResult.failure("Failed to retrieve real-time prices: " + e.getMessage());
        }
    }
}
