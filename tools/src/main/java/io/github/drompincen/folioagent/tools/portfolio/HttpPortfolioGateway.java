package io.github.drompincen.folioagent.tools.portfolio;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;

/**
 * Calls the portfolio HTTP API. The account travels in the {@code X-Account-Id} header.
 */
@Component
public class HttpPortfolioGateway implements PortfolioGateway {

    private static final Logger log = LoggerFactory.getLogger(HttpPortfolioGateway.class);

    static final String ACCOUNT_HEADER = "X-Account-Id";

    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration timeout;

    public HttpPortfolioGateway(ObjectMapper objectMapper,
                                @Value("${folioagent.portfolio.base-url:http://localhost:8000}") String baseUrl,
                                @Value("${folioagent.portfolio.timeout:30s}") Duration timeout) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public JsonNode holdings(long accountId, LocalDate date) {
        return get(accountId, "/api/holdings/date/" + date);
    }

    @Override
    public JsonNode performance(long accountId, LocalDate date) {
        return get(accountId, "/api/analysis/performance?date=" + date);
    }

    @Override
    public JsonNode compare(long accountId, LocalDate start, LocalDate end) {
        return get(accountId, "/api/analysis/compare?start=" + start + "&end=" + end);
    }

    @Override
    public JsonNode realTimePrices(long accountId, List<String> tickers) {
        String joined = URLEncoder.encode(String.join(",", tickers), StandardCharsets.UTF_8);
        return get(accountId, "/api/prices/realtime?tickers=" + joined);
    }

    private JsonNode get(long accountId, String path) {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(timeout)
                .header(ACCOUNT_HEADER, Long.toString(accountId))
                .header("Accept", "application/json")
                .GET()
                .build();
        log.debug("GET {} for account {}", path, accountId);
        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new PortfolioGatewayException("Portfolio service unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PortfolioGatewayException("Interrupted calling portfolio service", e);
        }
        if (response.statusCode() / 100 != 2) {
            log.warn("Portfolio service returned {} for {}", response.statusCode(), path);
            throw new PortfolioGatewayException("Portfolio service returned HTTP " + response.statusCode(),
                    response.statusCode());
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new PortfolioGatewayException("Portfolio service returned invalid JSON", e);
        }
    }
}
