package io.github.drompincen.folioagent.runtime.thread;

public class InvalidThreadIdException extends IllegalArgumentException {

    public InvalidThreadIdException(String message) {
        super(message);
    }
}
