package io.github.drompincen.folioagent.runtime.agent;

import java.util.EnumSet;
import java.util.Set;

/**
 * Phases of one turn. A failed turn passes through COMMITTING so the failure is recorded;
 * a cancelled turn never does.
 */
public enum TurnPhase {
    AWAITING_INPUT,
    MODEL_GENERATING,
    TOOL_EXECUTING,
    COMMITTING,
    DONE,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(TurnPhase next) {
        return allowedNext().contains(next);
    }

    private Set<TurnPhase> allowedNext() {
        return switch (this) {
            case AWAITING_INPUT -> EnumSet.of(MODEL_GENERATING, COMMITTING, FAILED, CANCELLED);
            case MODEL_GENERATING -> EnumSet.of(TOOL_EXECUTING, COMMITTING, FAILED, CANCELLED);
            case TOOL_EXECUTING -> EnumSet.of(MODEL_GENERATING, COMMITTING, FAILED, CANCELLED);
            case COMMITTING -> EnumSet.of(DONE, FAILED);
            default -> EnumSet.noneOf(TurnPhase.class);
        };
    }
}
