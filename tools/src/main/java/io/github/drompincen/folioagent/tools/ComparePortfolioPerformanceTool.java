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

/**
 * Compares two dates. Dates given in the wrong order are swapped rather than rejected.
 */
@Component
public class ComparePortfolioPerformanceTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(ComparePortfolioPerformanceTool.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PortfolioGateway portfolio;
    private final Clock clock;

    public ComparePortfolioPerformanceTool(PortfolioGateway portfolio, Clock clock) {
        this.portfolio = portfolio;
        this.clock = clock;
    }

    @Override public String name() { return "compare_portfolio_performance"; }

    @Override public String description() {
        return "Compare the signed-in account's portfolio between two dates: value change, per-holding change "
                + "and holdings added or removed.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        ObjectNode props = schema.putObject("properties");
        props.putObject("start_date").put("type", "string").put("description", "Earlier date");
        props.putObject("end_date").put("type", "string").put("description", "Later date, usually 'today'");
        schema.putArray("required").add("start_date").add("end_date");
        schema.put("additionalProperties", false);
        return schema;
    }

    @Override public String statusMessage() { return "Comparing your portfolio between dates..."; }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        LocalDate start;
        LocalDate end;
        try {
            start = DateArguments.parse(input.path("start_date").asText(null), clock);
            end = DateArguments.parse(input.path("end_date").asText(null), clock);
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage());
        }
        if (start.isAfter(end)) {
            LocalDate swap = start;
            start = end;
            end = swap;
        }
        log.info("Comparing portfolio for account {} between {} and {}", ctx.accountId(), start, end);
        try {
            ObjectNode out = MAPPER.createObjectNode();
            out.put("accountId", ctx.accountId());
            out.put("startDate", start.toString());
            out.put("endDate", end.toString());
            out.set("comparison", portfolio.compare(ctx.accountId(), start, end));
            return ToolResult.success(out);
        } catch (PortfolioGatewayException e) {
            return ToolResult.failure("Failed to compare portfolio performance: " + e.getMessage());
        }
    }
}
