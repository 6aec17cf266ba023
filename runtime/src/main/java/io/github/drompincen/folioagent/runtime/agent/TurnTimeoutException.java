package io.github.drompincen.folioagent.runtime.agent;

import java.time.Duration;

public class TurnTimeoutException extends RuntimeException {

    public TurnTimeoutException(Duration limit) {
        super("Turn exceeded " + limit.toMillis() + " ms");
    }
}
