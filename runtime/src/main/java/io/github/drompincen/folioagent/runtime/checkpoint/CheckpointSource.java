package io.github.drompincen.folioagent.runtime.checkpoint;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CheckpointSource {
    TURN("turn"),
    COMPACTION("compaction");

    private final String value;

    CheckpointSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
