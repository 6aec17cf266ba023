package io.github.drompincen.folioagent.runtime.agent;

public class ToolLoopExceededException extends RuntimeException {

    private final int iterations;

    public ToolLoopExceededException(int iterations, int maxIterations) {
        super("Tool loop exceeded: " + iterations + " tool rounds (max " + maxIterations + ")");
        this.iterations = iterations;
    }

    public int getIterations() { return iterations; }
}
