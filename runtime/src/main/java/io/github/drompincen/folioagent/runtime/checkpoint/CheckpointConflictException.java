package io.github.drompincen.folioagent.runtime.checkpoint;

public class CheckpointConflictException extends RuntimeException {

    private final String threadId;
    private final String expectedParentId;

    public CheckpointConflictException(String threadId, String expectedParentId, String actualLatestId) {
        super("Checkpoint conflict on thread " + threadId + ": parent " + expectedParentId
                + " is not the latest (latest=" + actualLatestId + ")");
        this.threadId = threadId;
        this.expectedParentId = expectedParentId;
    }

    public CheckpointConflictException(String threadId, String expectedParentId, Throwable cause) {
        super("Checkpoint conflict on thread " + threadId + ": parent " + expectedParentId
                + " already has a committed child", cause);
        this.threadId = threadId;
        this.expectedParentId = expectedParentId;
    }

    public String getThreadId() { return threadId; }
    public String getExpectedParentId() { return expectedParentId; }
}
