package com.craftsman.coordinator.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskStatusTest {

    @Test
    void delegated_neverReturnsToRunning() {
        assertThat(TaskStatus.DELEGATED.canTransitionTo(TaskStatus.RUNNING)).isFalse();
        assertThat(TaskStatus.DELEGATED.canTransitionTo(TaskStatus.SUCCEEDED)).isTrue();
        assertThat(TaskStatus.RUNNING.canTransitionTo(TaskStatus.DELEGATED)).isTrue();
    }

    @Test
    void terminalStates_allowNoTransition() {
        for (TaskStatus next : TaskStatus.values()) {
            assertThat(TaskStatus.SUCCEEDED.canTransitionTo(next)).isFalse();
            assertThat(TaskStatus.FAILED.canTransitionTo(next)).isFalse();
        }
    }

    @Test
    void pending_canFailWithoutRunning() {
        assertThat(TaskStatus.PENDING.canTransitionTo(TaskStatus.FAILED)).isTrue();
        assertThat(TaskStatus.PENDING.canTransitionTo(TaskStatus.DELEGATED)).isFalse();
    }

    // ------------------------------------------------------------------
    // Outcome
    // ------------------------------------------------------------------

    @Test
    void outcome_nonTerminalStatus_rejected() {
        assertThatThrownBy(() -> new Outcome(TaskStatus.RUNNING, "coder", null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void outcome_orThrow_reRaisesChildFailureWithItsChain() {
        TaskFailure failure = new TaskFailure(ErrorKind.TIMEOUT, "too slow", List.of("coder", "researcher"));
        Outcome failed = Outcome.failed("researcher", failure);

        assertThatThrownBy(failed::orThrow)
                .isInstanceOf(DelegationFailedException.class)
                .hasMessage("[TIMEOUT] too slow")
                .satisfies(e -> assertThat(((DelegationFailedException) e).getFailure()).isEqualTo(failure));
        assertThat(Outcome.succeeded("coder", 42).orThrow()).isEqualTo(42);
    }

    @Test
    void coordinationException_detailStripsKindPrefix() {
        CoordinationException e = new CoordinationException(ErrorKind.DEPTH_EXCEEDED, "too deep");

        assertThat(e.getMessage()).isEqualTo("[DEPTH_EXCEEDED] too deep");
        assertThat(e.getDetail()).isEqualTo("too deep");
    }
}
