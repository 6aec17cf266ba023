package io.github.drompincen.folioagent.tools.portfolio;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.LocalDate;
import java.util.List;

/**
 * Read access to the portfolio domain services. Every call is scoped to the account it is
 * given; callers pass the bound account, never one taken from model arguments.
 */
public interface PortfolioGateway {

    JsonNode holdings(long accountId, LocalDate date);

    JsonNode performance(long accountId, LocalDate date);

    JsonNode compare(long accountId, LocalDate start, LocalDate end);

    JsonNode realTimePrices(long accountId, List<String> tickers);
}
