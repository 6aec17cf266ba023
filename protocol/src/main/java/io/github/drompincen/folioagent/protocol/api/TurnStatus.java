package io.github.drompincen.folioagent.protocol.api;

public enum TurnStatus {
    COMPLETED,
    FAILED,
    CANCELLED
}
