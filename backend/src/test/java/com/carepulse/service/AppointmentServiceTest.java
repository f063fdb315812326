package com.carepulse.service;

import com.carepulse.config.ClinicProperties;
import com.carepulse.dto.request.CreateAppointmentRequest;
import com.carepulse.dto.request.UpdateAppointmentRequest;
import com.carepulse.exception.ConflictException;
import com.carepulse.exception.DurationOutOfRangeException;
import com.carepulse.exception.InvalidStatusTransitionException;
import com.carepulse.exception.RangeException;
import com.carepulse.model.clinic.Doctor;
import com.carepulse.model.clinic.Patient;
import com.carepulse.model.enums.AppointmentStatus;
import com.carepulse.model.enums.AppointmentType;
import com.carepulse.model.id.AppointmentId;
import com.carepulse.model.id.DoctorId;
import com.carepulse.model.id.PatientId;
import com.carepulse.model.scheduling.Appointment;
import com.carepulse.model.value.AppointmentDuration;
import com.carepulse.repository.AppointmentRepository;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AppointmentServiceTest {

    private static final String PATIENT_ID = "patient_p1";
    private static final String DOCTOR_ID = "doctor_d1";
    private static final LocalDateTime TEN_AM = LocalDateTime.of(2025, 12, 1, 10, 0);

    @Mock
    private AppointmentRepository appointmentRepository;

    @Mock
    private PatientService patientService;

    @Mock
    private DoctorService doctorService;

    private ClinicProperties properties;
    private AppointmentService service;

    @BeforeEach
    void setUp() {
        properties = new ClinicProperties();
        service = new AppointmentService(appointmentRepository, patientService, doctorService, properties);
        lenient().when(appointmentRepository.save(any(Appointment.class))).thenAnswer(inv -> inv.getArgument(0));
    }

    private void givenPatientAndDoctor(boolean doctorActive) {
        when(patientService.getById(new PatientId(PATIENT_ID)))
            .thenReturn(Patient.builder().id(PATIENT_ID).build());
        when(doctorService.getById(new DoctorId(DOCTOR_ID)))
            .thenReturn(Doctor.builder().id(DOCTOR_ID).active(doctorActive).build());
    }

    private static Appointment appointment(String id, LocalDateTime start, int minutes, AppointmentStatus status) {
        return Appointment.builder()
            .id(id)
            .patientId(PATIENT_ID)
            .doctorId(DOCTOR_ID)
            .type(AppointmentType.CHECK_UP)
            .status(status)
            .scheduledAt(start)
            .duration(AppointmentDuration.ofMinutes(minutes))
            .build();
    }

    // ========================================================================
    // Booking
    // ========================================================================

    @Test
    void createUsesTypeDefaultDurationAndStartsScheduled() {
        givenPatientAndDoctor(true);
        when(appointmentRepository.findActiveForDoctorStartingBetween(eq(DOCTOR_ID), any(), any()))
            .thenReturn(List.of());

        Appointment created = service.create(new CreateAppointmentRequest(
            PATIENT_ID, DOCTOR_ID, "FOLLOW_UP", TEN_AM, null, "Knee", null));

        assertThat(created.getId()).startsWith("appt_");
        assertThat(created.getStatus()).isEqualTo(AppointmentStatus.SCHEDULED);
        assertThat(created.getDuration().getMinutes()).isEqualTo(30);
        assertThat(created.getEndTime()).isEqualTo(TEN_AM.plusMinutes(30));
    }

    @Test
    void createQueriesCandidatesFromLongestPossibleStartBefore() {
        givenPatientAndDoctor(true);
        when(appointmentRepository.findActiveForDoctorStartingBetween(anyString(), any(), any()))
            .thenReturn(List.of());

        service.create(new CreateAppointmentRequest(PATIENT_ID, DOCTOR_ID, "CHECK_UP", TEN_AM, 60, null, null));

        verify(appointmentRepository).findActiveForDoctorStartingBetween(
            DOCTOR_ID, TEN_AM.minusMinutes(90), TEN_AM.plusMinutes(60));
    }

    @Test
    void createRejectsOverlapWithExistingAppointment() {
        givenPatientAndDoctor(true);
        when(appointmentRepository.findActiveForDoctorStartingBetween(eq(DOCTOR_ID), any(), any()))
            .thenReturn(List.of(appointment("appt_other", TEN_AM.minusMinutes(30), 60, AppointmentStatus.SCHEDULED)));

        assertThatThrownBy(() -> service.create(new CreateAppointmentRequest(
            PATIENT_ID, DOCTOR_ID, "CHECK_UP", TEN_AM, null, null, null)))
            .isInstanceOf(ConflictException.class)
            .hasMessageContaining("appt_other");
        verify(appointmentRepository, never()).save(any());
    }

    @Test
    void backToBackAppointmentsDoNotOverlap() {
        givenPatientAndDoctor(true);
        when(appointmentRepository.findActiveForDoctorStartingBetween(eq(DOCTOR_ID), any(), any()))
            .thenReturn(List.of(appointment("appt_before", TEN_AM.minusMinutes(60), 60, AppointmentStatus.SCHEDULED)));

        Appointment created = service.create(new CreateAppointmentRequest(
            PATIENT_ID, DOCTOR_ID, "CHECK_UP", TEN_AM, null, null, null));

        assertThat(created.getScheduledAt()).isEqualTo(TEN_AM);
    }

    @Test
    void createRejectsInactiveDoctor() {
        givenPatientAndDoctor(false);

        assertThatThrownBy(() -> service.create(new CreateAppointmentRequest(
            PATIENT_ID, DOCTOR_ID, "CHECK_UP", TEN_AM, null, null, null)))
            .isInstanceOf(ConflictException.class);
    }

    @Test
    void createRejectsSlotOutsideOperatingHours() {
        givenPatientAndDoctor(true);

        assertThatThrownBy(() -> service.create(new CreateAppointmentRequest(
            PATIENT_ID, DOCTOR_ID, "CHECK_UP", TEN_AM.withHour(8), null, null, null)))
            .isInstanceOf(RangeException.class)
            .hasMessageContaining("outside operating hours");
    }

    @Test
    void operatingHoursCanBeDisabled() {
        properties.getScheduling().setEnforceOperatingHours(false);
        givenPatientAndDoctor(true);
        when(appointmentRepository.findActiveForDoctorStartingBetween(eq(DOCTOR_ID), any(), any()))
            .thenReturn(List.of());

        Appointment created = service.create(new CreateAppointmentRequest(
            PATIENT_ID, DOCTOR_ID, "CHECK_UP", TEN_AM.withHour(7), null, null, null));

        assertThat(created.getScheduledAt().getHour()).isEqualTo(7);
    }

    @Test
    void createRejectsInvalidDuration() {
        givenPatientAndDoctor(true);

        assertThatThrownBy(() -> service.create(new CreateAppointmentRequest(
            PATIENT_ID, DOCTOR_ID, "CHECK_UP", TEN_AM, 40, null, null)))
            .isInstanceOf(DurationOutOfRangeException.class);
    }

    @Test
    void createFailsForUnknownPatient() {
        when(patientService.getById(new PatientId(PATIENT_ID)))
            .thenThrow(new EntityNotFoundException("Patient not found: " + PATIENT_ID));

        assertThatThrownBy(() -> service.create(new CreateAppointmentRequest(
            PATIENT_ID, DOCTOR_ID, "CHECK_UP", TEN_AM, null, null, null)))
            .isInstanceOf(EntityNotFoundException.class);
    }

    // ========================================================================
    // Status transitions
    // ========================================================================

    @Test
    void legalTransitionIsSaved() {
        Appointment existing = appointment("appt_a1", TEN_AM, 30, AppointmentStatus.SCHEDULED);
        when(appointmentRepository.findById("appt_a1")).thenReturn(Optional.of(existing));

        Appointment saved = service.transitionStatus(new AppointmentId("appt_a1"), AppointmentStatus.IN_PROGRESS);

        assertThat(saved.getStatus()).isEqualTo(AppointmentStatus.IN_PROGRESS);
        verify(appointmentRepository).save(existing);
    }

    @Test
    void illegalTransitionIsRejectedWithoutSaving() {
        Appointment existing = appointment("appt_a1", TEN_AM, 30, AppointmentStatus.COMPLETED);
        when(appointmentRepository.findById("appt_a1")).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> service.transitionStatus(new AppointmentId("appt_a1"), AppointmentStatus.IN_PROGRESS))
            .isInstanceOf(InvalidStatusTransitionException.class)
            .hasMessage("Cannot change appointment status from COMPLETED to IN_PROGRESS");
        assertThat(existing.getStatus()).isEqualTo(AppointmentStatus.COMPLETED);
        verify(appointmentRepository, never()).save(any());
    }

    @Test
    void updateRoutesStatusThroughTransitionRules() {
        Appointment existing = appointment("appt_a1", TEN_AM, 30, AppointmentStatus.SCHEDULED);
        when(appointmentRepository.findById("appt_a1")).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> service.update(new AppointmentId("appt_a1"),
            new UpdateAppointmentRequest(null, null, null, null, "note", "COMPLETED")))
            .isInstanceOf(InvalidStatusTransitionException.class);
    }

    @Test
    void rescheduleExcludesTheAppointmentItself() {
        Appointment existing = appointment("appt_a1", TEN_AM, 30, AppointmentStatus.SCHEDULED);
        when(appointmentRepository.findById("appt_a1")).thenReturn(Optional.of(existing));
        when(appointmentRepository.findActiveForDoctorStartingBetween(eq(DOCTOR_ID), any(), any()))
            .thenReturn(List.of(existing));

        Appointment saved = service.update(new AppointmentId("appt_a1"),
            new UpdateAppointmentRequest(null, TEN_AM.plusMinutes(15), null, null, null, null));

        assertThat(saved.getScheduledAt()).isEqualTo(TEN_AM.plusMinutes(15));
    }

    @Test
    void rescheduleOfStartedAppointmentIsRejected() {
        Appointment existing = appointment("appt_a1", TEN_AM, 30, AppointmentStatus.IN_PROGRESS);
        when(appointmentRepository.findById("appt_a1")).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> service.update(new AppointmentId("appt_a1"),
            new UpdateAppointmentRequest(null, TEN_AM.plusHours(1), null, null, null, null)))
            .isInstanceOf(ConflictException.class);
    }

    // ========================================================================
    // Delete and stats
    // ========================================================================

    @Test
    void onlyScheduledAppointmentsCanBeDeleted() {
        Appointment started = appointment("appt_a1", TEN_AM, 30, AppointmentStatus.IN_PROGRESS);
        when(appointmentRepository.findById("appt_a1")).thenReturn(Optional.of(started));

        assertThatThrownBy(() -> service.delete(new AppointmentId("appt_a1")))
            .isInstanceOf(ConflictException.class);
        verify(appointmentRepository, never()).delete(any(Appointment.class));
    }

    @Test
    void statusCountsIncludeEveryStatus() {
        when(appointmentRepository.countByStatus(any())).thenReturn(0L);
        when(appointmentRepository.countByStatus(AppointmentStatus.SCHEDULED)).thenReturn(3L);

        Map<AppointmentStatus, Long> counts = service.getStatusCounts();

        assertThat(counts).hasSize(AppointmentStatus.values().length);
        assertThat(counts.get(AppointmentStatus.SCHEDULED)).isEqualTo(3L);
        assertThat(counts.get(AppointmentStatus.NO_SHOW)).isZero();
    }
}
