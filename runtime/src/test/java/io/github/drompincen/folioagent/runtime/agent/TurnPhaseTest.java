package io.github.drompincen.folioagent.runtime.agent;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TurnPhaseTest {

    @Test
    void modelAndToolPhasesAlternate() {
        assertThat(TurnPhase.AWAITING_INPUT.canTransitionTo(TurnPhase.MODEL_GENERATING)).isTrue();
        assertThat(TurnPhase.MODEL_GENERATING.canTransitionTo(TurnPhase.TOOL_EXECUTING)).isTrue();
        assertThat(TurnPhase.TOOL_EXECUTING.canTransitionTo(TurnPhase.MODEL_GENERATING)).isTrue();
        assertThat(TurnPhase.AWAITING_INPUT.canTransitionTo(TurnPhase.TOOL_EXECUTING)).isFalse();
    }

    @Test
    void commitEndsInDoneOrFailedOnly() {
        assertThat(TurnPhase.COMMITTING.canTransitionTo(TurnPhase.DONE)).isTrue();
        assertThat(TurnPhase.COMMITTING.canTransitionTo(TurnPhase.FAILED)).isTrue();
        assertThat(TurnPhase.COMMITTING.canTransitionTo(TurnPhase.CANCELLED)).isFalse();
        assertThat(TurnPhase.COMMITTING.canTransitionTo(TurnPhase.MODEL_GENERATING)).isFalse();
    }

    @Test
    void cancellationIsReachableFromEveryRunningPhase() {
        assertThat(TurnPhase.AWAITING_INPUT.canTransitionTo(TurnPhase.CANCELLED)).isTrue();
        assertThat(TurnPhase.MODEL_GENERATING.canTransitionTo(TurnPhase.CANCELLED)).isTrue();
        assertThat(TurnPhase.TOOL_EXECUTING.canTransitionTo(TurnPhase.CANCELLED)).isTrue();
    }

    @Test
    void terminalPhasesGoNowhere() {
        for (TurnPhase terminal : new TurnPhase[]{TurnPhase.DONE, TurnPhase.FAILED, TurnPhase.CANCELLED}) {
            assertThat(terminal.isTerminal()).isTrue();
            for (TurnPhase next : TurnPhase.values()) {
                assertThat(terminal.canTransitionTo(next)).as(terminal + " -> " + next).isFalse();
            }
        }
        assertThat(TurnPhase.COMMITTING.isTerminal()).isFalse();
    }
}
