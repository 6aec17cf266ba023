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

import java.time.Clock;
import java.time.LocalDate;

@Component
public class GetHoldingsTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(GetHoldingsTool.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PortfolioGateway portfolio;
    private final Clock clock;

    public GetHoldingsTool(PortfolioGateway portfolio, Clock clock) {
        this.portfolio = portfolio;
        this.clock = clock;
    }

    @Override public String name() { return "get_holdings"; }

    @Override public String description() {
        return "Retrieve the portfolio holdings of the signed-in account on a date: ticker, name, platform, "
                + "units, prices, values and totals. Use 'today' for current data.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("date").put("type", "string")
                .put("description", "Date for the holdings: 'today', YYYY-MM-DD, DD/MM/YYYY or D MMMM YYYY");
        schema.putArray("required").add("date");
        schema.put("additionalProperties", false);
        return schema;
    }

    @Override public String statusMessage() { return "Looking up your holdings..."; }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        LocalDate date;
        try {
            date = DateArguments.parse(input.path("date").asText(null), clock);
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage());
        }
        log.info("Getting holdings for account {} on {}", ctx.accountId(), date);
        try {
            JsonNode holdings = portfolio.holdings(ctx.accountId(), date);
            ObjectNode out = MAPPER.createObjectNode();
            out.put("accountId", ctx.accountId());
            out.put("date", date.toString());
            out.set("holdings", holdings);
            return ToolResult.success(out);
        } catch (PortfolioGatewayException e) {
            return ToolResult.failure("Failed to retrieve portfolio holdings: " + e.getMessage());
        }
    }
}
