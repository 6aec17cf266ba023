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
public class AnalyzePortfolioPerformanceTool implements Tool {

    private static final Logger log = LoggerFactory.getLogger(AnalyzePortfolioPerformanceTool.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final PortfolioGateway portfolio;
    private final Clock clock;

    public AnalyzePortfolioPerformanceTool(PortfolioGateway portfolio, Clock clock) {
        this.portfolio = portfolio;
        this.clock = clock;
    }

    @Override public String name() { return "analyze_portfolio_performance"; }

    @Override public String description() {
        return "Analyse the signed-in account's portfolio performance on a date: daily change, best and worst "
                + "performers and gain/loss against cost.";
    }

    @Override public JsonNode inputSchema() {
        ObjectNode schema = MAPPER.createObjectNode();
        schema.put("type", "object");
        schema.putObject("properties").putObject("analysis_date").put("type", "string")
                .put("description", "Date to analyse: 'today', YYYY-MM-DD or DD/MM/YYYY");
        schema.putArray("required").add("analysis_date");
        schema.put("additionalProperties", false);
        return schema;
    }

    @Override public String statusMessage() { return "Analysing your portfolio performance..."; }

    @Override
    public ToolResult execute(ToolContext ctx, JsonNode input) {
        LocalDate date;
        try {
            date = DateArguments.parse(input.path("analysis_date").asText(null), clock);
        } catch (IllegalArgumentException e) {
            return ToolResult.failure(e.getMessage());
        }
        log.info("Analysing performance for account {} on {}", ctx.accountId(), date);
        try {
            ObjectNode out = MAPPER.createObjectNode();
            out.put("accountId", ctx.accountId());
            out.put("analysisDate", date.toString());
            out.set("analysis", portfolio.performance(ctx.accountId(), date));
            return ToolResult.success(out);
        } catch (PortfolioGatewayException e) {
            return ToolResult.failure("Failed to analyse portfolio performance: " + e.getMessage());
        }
    }
}
