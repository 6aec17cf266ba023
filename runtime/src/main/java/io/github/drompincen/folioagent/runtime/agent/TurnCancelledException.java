package io.github.drompincen.folioagent.runtime.agent;

public class TurnCancelledException extends RuntimeException {

    public TurnCancelledException() {
        super("Turn cancelled");
    }
}
