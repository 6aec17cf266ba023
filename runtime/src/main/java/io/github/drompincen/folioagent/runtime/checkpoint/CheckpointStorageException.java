package io.github.drompincen.folioagent.runtime.checkpoint;

public class CheckpointStorageException extends RuntimeException {

    public CheckpointStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
