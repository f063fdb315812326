package com.carepulse.model.enums;

import org.junit.jupiter.api.Test;

import static com.carepulse.model.enums.AppointmentStatus.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppointmentStatusTest {

    @Test
    void scheduledCanStartOrCancel() {
        assertThat(SCHEDULED.allowedTransitions()).containsExactlyInAnyOrder(IN_PROGRESS, CANCELLED);
        assertThat(SCHEDULED.canTransitionTo(COMPLETED)).isFalse();
        assertThat(SCHEDULED.canTransitionTo(NO_SHOW)).isFalse();
    }

    @Test
    void inProgressCanCompleteOrCancel() {
        assertThat(IN_PROGRESS.allowedTransitions()).containsExactlyInAnyOrder(COMPLETED, CANCELLED);
        assertThat(IN_PROGRESS.canTransitionTo(SCHEDULED)).isFalse();
    }

    @Test
    void terminalStatesAllowNothing() {
        for (AppointmentStatus terminal : new AppointmentStatus[] {COMPLETED, CANCELLED, NO_SHOW}) {
            assertThat(terminal.isTerminal()).isTrue();
            for (AppointmentStatus target : values()) {
                assertThat(terminal.canTransitionTo(target)).isFalse();
            }
        }
    }

    @Test
    void selfTransitionsAreNotAllowed() {
        for (AppointmentStatus status : values()) {
            assertThat(status.canTransitionTo(status)).isFalse();
        }
    }

    @Test
    void unknownValuesAreNeverAllowed() {
        assertThat(canTransition(null, SCHEDULED)).isFalse();
        assertThat(canTransition(SCHEDULED, null)).isFalse();
        assertThat(canTransition(SCHEDULED, IN_PROGRESS)).isTrue();
    }

    @Test
    void fromValueIgnoresCase() {
        assertThat(fromValue("in_progress")).isEqualTo(IN_PROGRESS);
        assertThatThrownBy(() -> fromValue("DONE")).isInstanceOf(IllegalArgumentException.class);
    }
}
