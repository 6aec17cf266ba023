package io.github.drompincen.folioagent.protocol.event;

import com.fasterxml.jackson.annotation.JsonValue;

public enum StreamEventType {
    TOKEN("token"),
    TOOL_CALL_STARTED("tool_call_started"),
    TOOL_CALL_RESULT("tool_call_result"),
    TURN_COMPLETE("turn_complete"),
    ERROR("error");

    private final String wireName;

    StreamEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == TURN_COMPLETE || this == ERROR;
    }
}
