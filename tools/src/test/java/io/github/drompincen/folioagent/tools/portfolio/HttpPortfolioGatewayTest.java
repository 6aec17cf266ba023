package io.github.drompincen.folioagent.tools.portfolio;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpPortfolioGatewayTest {

    private HttpServer server;
    private HttpPortfolioGateway gateway;
    private final List<String> seenPaths = new CopyOnWriteArrayList<>();
    private final List<String> seenAccounts = new CopyOnWriteArrayList<>();
    private volatile int status = 200;
    private volatile String body = "{\"ok\":true}";

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
        gateway = new HttpPortfolioGateway(new ObjectMapper(),
                "http://127.0.0.1:" + server.getAddress().getPort() + "/", Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        seenPaths.add(exchange.getRequestURI().toString());
        seenAccounts.add(exchange.getRequestHeaders().getFirst(HttpPortfolioGateway.ACCOUNT_HEADER));
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    void sendsAccountHeaderAndBuildsPaths() {
        JsonNode holdings = gateway.holdings(42, LocalDate.of(2025, 3, 14));
        gateway.performance(42, LocalDate.of(2025, 3, 14));
        gateway.compare(42, LocalDate.of(2025, 1, 1), LocalDate.of(2025, 3, 14));
        gateway.realTimePrices(42, List.of("AAPL.US", "MSFT.US"));

        assertThat(holdings.get("ok").asBoolean()).isTrue();
        assertThat(seenPaths).containsExactly(
                "/api/holdings/date/2025-03-14",
                "/api/analysis/performance?date=2025-03-14",
                "/api/analysis/compare?start=2025-01-01&end=2025-03-14",
                "/api/prices/realtime?tickers=AAPL.US%2CMSFT.US");
        assertThat(seenAccounts).containsOnly("42");
    }

    @Test
    void errorStatusBecomesGatewayException() {
        status = 503;
        body = "{}";

        assertThatThrownBy(() -> gateway.holdings(42, LocalDate.of(2025, 3, 14)))
                .isInstanceOf(PortfolioGatewayException.class)
                .hasMessageContaining("503")
                .extracting("statusCode").isEqualTo(503);
    }

    @Test
    void invalidJsonBecomesGatewayException() {
        body = "<html>";

        assertThatThrownBy(() -> gateway.holdings(42, LocalDate.of(2025, 3, 14)))
                .isInstanceOf(PortfolioGatewayException.class)
                .hasMessageContaining("invalid JSON");
    }

    @Test
    void unreachableServiceBecomesGatewayException() {
        server.stop(0);

        assertThatThrownBy(() -> gateway.holdings(42, LocalDate.of(2025, 3, 14)))
                .isInstanceOf(PortfolioGatewayException.class)
                .hasMessageContaining("unreachable");
    }
}
