package com.carepulse.model.value;

import com.carepulse.exception.DurationOutOfRangeException;
import com.carepulse.exception.DurationOutOfRangeException.Kind;
import com.carepulse.exception.RangeException;
import com.carepulse.model.enums.AppointmentType;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppointmentDurationTest {

    @Test
    void acceptsBoundsAndFifteenMinuteSteps() {
        assertThat(AppointmentDuration.ofMinutes(30).getMinutes()).isEqualTo(30);
        assertThat(AppointmentDuration.ofMinutes(45).getMinutes()).isEqualTo(45);
        assertThat(AppointmentDuration.ofMinutes(90).getMinutes()).isEqualTo(90);
    }

    @Test
    void tooShortIsReportedBeforeIncrement() {
        assertThatThrownBy(() -> AppointmentDuration.ofMinutes(20))
            .isInstanceOf(RangeException.class)
            .satisfies(e -> assertThat(((DurationOutOfRangeException) e).getKind()).isEqualTo(Kind.TOO_SHORT));
    }

    @Test
    void tooLongIsReportedBeforeIncrement() {
        assertThatThrownBy(() -> AppointmentDuration.ofMinutes(100))
            .isInstanceOf(DurationOutOfRangeException.class)
            .satisfies(e -> assertThat(((DurationOutOfRangeException) e).getKind()).isEqualTo(Kind.TOO_LONG));
    }

    @Test
    void offStepIsRejected() {
        assertThatThrownBy(() -> AppointmentDuration.ofMinutes(40))
            .isInstanceOf(DurationOutOfRangeException.class)
            .hasMessageContaining("15-minute increments")
            .satisfies(e -> assertThat(((DurationOutOfRangeException) e).getMinutes()).isEqualTo(40));
    }

    @Test
    void defaultsPerAppointmentType() {
        assertThat(AppointmentDuration.forAppointmentType(AppointmentType.FIRST_CONSULT).getMinutes()).isEqualTo(90);
        assertThat(AppointmentDuration.forAppointmentType(AppointmentType.CHECK_UP).getMinutes()).isEqualTo(30);
        assertThat(AppointmentDuration.forAppointmentType(AppointmentType.FOLLOW_UP).getMinutes()).isEqualTo(30);
        assertThat(AppointmentDuration.forAppointmentType(null)).isEqualTo(AppointmentDuration.standard());
    }

    @Test
    void endTimeAddsMinutes() {
        LocalDateTime start = LocalDateTime.of(2025, 12, 1, 10, 0);

        assertThat(AppointmentDuration.ofMinutes(45).calculateEndTime(start))
            .isEqualTo(LocalDateTime.of(2025, 12, 1, 10, 45));
        assertThat(AppointmentDuration.consultation().toDuration()).isEqualTo(Duration.ofMinutes(90));
        assertThat(AppointmentDuration.consultation().getHours()).isEqualTo(1.5);
    }

    @Test
    void operatingHoursCompareHoursOnly() {
        AppointmentDuration thirty = AppointmentDuration.checkup();

        assertThat(thirty.fitsInOperatingHours(LocalDateTime.of(2025, 12, 1, 9, 0))).isTrue();
        assertThat(thirty.fitsInOperatingHours(LocalDateTime.of(2025, 12, 1, 8, 45))).isFalse();
        assertThat(thirty.fitsInOperatingHours(LocalDateTime.of(2025, 12, 1, 17, 30))).isTrue();
        assertThat(thirty.fitsInOperatingHours(LocalDateTime.of(2025, 12, 1, 17, 45))).isTrue();
        assertThat(AppointmentDuration.standard().fitsInOperatingHours(LocalDateTime.of(2025, 12, 1, 18, 0))).isFalse();
    }

    @Test
    void slotRunningPastMidnightDoesNotFit() {
        assertThat(AppointmentDuration.standard().fitsInOperatingHours(LocalDateTime.of(2025, 12, 1, 23, 30))).isFalse();
        assertThat(AppointmentDuration.checkup().fitsInOperatingHours(LocalDateTime.of(2025, 12, 1, 23, 45))).isFalse();
    }

    @Test
    void displayAndApiFormats() {
        assertThat(AppointmentDuration.ofMinutes(30).formatForDisplay()).isEqualTo("30 minutes");
        assertThat(AppointmentDuration.ofMinutes(60).formatForDisplay()).isEqualTo("1 hour");
        assertThat(AppointmentDuration.ofMinutes(90).formatForDisplay()).isEqualTo("1 hour 30 minutes");
        assertThat(AppointmentDuration.ofMinutes(90).formatForApi()).isEqualTo("PT1H30M");
        assertThat(AppointmentDuration.ofMinutes(45).formatForApi()).isEqualTo("PT0H45M");
    }

    @Test
    void addMinutesRevalidates() {
        assertThat(AppointmentDuration.ofMinutes(60).addMinutes(15).getMinutes()).isEqualTo(75);
        assertThatThrownBy(() -> AppointmentDuration.ofMinutes(90).addMinutes(15))
            .isInstanceOf(DurationOutOfRangeException.class);
    }

    @Test
    void ordering() {
        assertThat(AppointmentDuration.consultation().isLongerThan(AppointmentDuration.standard())).isTrue();
        assertThat(AppointmentDuration.checkup()).isLessThan(AppointmentDuration.standard());
        assertThat(AppointmentDuration.followUp()).isEqualTo(AppointmentDuration.checkup());
    }
}
