package io.github.drompincen.folioagent.tools.portfolio;

public class PortfolioGatewayException extends RuntimeException {

    private final int statusCode;

    public PortfolioGatewayException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public PortfolioGatewayException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    public int getStatusCode() { return statusCode; }
}
