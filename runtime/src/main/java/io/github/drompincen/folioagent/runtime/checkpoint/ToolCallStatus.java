package io.github.drompincen.folioagent.runtime.checkpoint;

public enum ToolCallStatus {
    SUCCESS,
    ERROR
}
