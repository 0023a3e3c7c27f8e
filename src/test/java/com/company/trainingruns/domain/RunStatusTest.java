package com.company.trainingruns.domain;

import com.company.trainingruns.domain.enums.ExternalRunState;
import com.company.trainingruns.domain.enums.RunStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunStatusTest {

    @Test
    void fromDatabase_shouldMapLegacyTerminalLabels() {
        assertThat(RunStatus.fromDatabase("completed")).isEqualTo(RunStatus.NOT_RUNNING);
        assertThat(RunStatus.fromDatabase("CRASHED")).isEqualTo(RunStatus.NOT_RUNNING);
        assertThat(RunStatus.fromDatabase("running")).isEqualTo(RunStatus.RUNNING);
        assertThatThrownBy(() -> RunStatus.fromDatabase("paused")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void storedValues_shouldCoverLegacyLabelsOnlyForNotRunning() {
        assertThat(RunStatus.RUNNING.storedValues()).containsExactly("running");
        assertThat(RunStatus.NOT_RUNNING.storedValues())
                .startsWith("not_running")
                .contains("completed", "failed", "crashed");
        RunStatus.NOT_RUNNING.storedValues()
                .forEach(label -> assertThat(RunStatus.fromDatabase(label)).isEqualTo(RunStatus.NOT_RUNNING));
    }

    @Test
    void canTransitionTo_shouldOnlyMoveForward() {
        assertThat(RunStatus.LAUNCHED.canTransitionTo(RunStatus.NOT_RUNNING)).isTrue();
        assertThat(RunStatus.RUNNING.canTransitionTo(RunStatus.RUNNING)).isTrue();
        assertThat(RunStatus.NOT_RUNNING.canTransitionTo(RunStatus.RUNNING)).isFalse();
        assertThat(RunStatus.RUNNING.canTransitionTo(RunStatus.LAUNCHED)).isFalse();
        assertThat(RunStatus.NOT_RUNNING.laterStatuses()).isEmpty();
        assertThat(RunStatus.LAUNCHED.laterStatuses()).containsExactly(RunStatus.RUNNING, RunStatus.NOT_RUNNING);
    }

    @Test
    void externalStates_shouldCollapseToNotRunningExceptRunning() {
        assertThat(ExternalRunState.fromString("running").toRunStatus()).isEqualTo(RunStatus.RUNNING);
        assertThat(ExternalRunState.fromString("preempted").toRunStatus()).isEqualTo(RunStatus.NOT_RUNNING);
        assertThat(ExternalRunState.fromString("something-new")).isEqualTo(ExternalRunState.UNKNOWN);
        assertThat(ExternalRunState.KILLED.exitReason()).isEqualTo("tracker_killed");
    }
}
