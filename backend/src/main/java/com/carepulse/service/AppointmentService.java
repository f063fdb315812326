package com.carepulse.service;

import com.carepulse.config.ClinicProperties;
import com.carepulse.dto.request.CreateAppointmentRequest;
import com.carepulse.dto.request.UpdateAppointmentRequest;
import com.carepulse.exception.ConflictException;
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
import jakarta.persistence.criteria.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Appointment booking and lifecycle.
 *
 * <p>Every persisted status change goes through {@link #transitionStatus}, which
 * consults {@link AppointmentStatus#canTransitionTo} before saving. Booking and
 * rescheduling reject slots that overlap another non-cancelled appointment of
 * the same doctor. The overlap check is not serialized across concurrent requests.
 */
@Service
@Transactional
@Slf4j
public class AppointmentService {

    private final AppointmentRepository appointmentRepository;
    private final PatientService patientService;
    private final DoctorService doctorService;
    private final ClinicProperties properties;

    public AppointmentService(
            AppointmentRepository appointmentRepository,
            PatientService patientService,
            DoctorService doctorService,
            ClinicProperties properties) {
        this.appointmentRepository = appointmentRepository;
        this.patientService = patientService;
        this.doctorService = doctorService;
        this.properties = properties;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    @Transactional(readOnly = true)
    public Optional<Appointment> findById(AppointmentId id) {
        return appointmentRepository.findById(id.value());
    }

    @Transactional(readOnly = true)
    public Appointment getById(AppointmentId id) {
        return findById(id).orElseThrow(() -> new EntityNotFoundException("Appointment not found: " + id));
    }

    /**
     * Filter appointments, ordered by start time. All arguments are optional;
     * {@code dateTo} is inclusive.
     */
    @Transactional(readOnly = true)
    public List<Appointment> search(PatientId patientId, DoctorId doctorId, AppointmentStatus status,
                                    AppointmentType type, LocalDate dateFrom, LocalDate dateTo) {
        Specification<Appointment> spec = (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (patientId != null) {
                predicates.add(cb.equal(root.get("patientId"), patientId.value()));
            }
            if (doctorId != null) {
                predicates.add(cb.equal(root.get("doctorId"), doctorId.value()));
            }
            if (status != null) {
                predicates.add(cb.equal(root.get("status"), status));
            }
            if (type != null) {
                predicates.add(cb.equal(root.get("type"), type));
            }
            if (dateFrom != null) {
                predicates.add(cb.greaterThanOrEqualTo(root.get("scheduledAt"), dateFrom.atStartOfDay()));
            }
            if (dateTo != null) {
                predicates.add(cb.lessThan(root.get("scheduledAt"), dateTo.plusDays(1).atStartOfDay()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
        return appointmentRepository.findAll(spec, Sort.by("scheduledAt"));
    }

    @Transactional(readOnly = true)
    public List<Appointment> findByDoctor(DoctorId doctorId) {
        doctorService.getById(doctorId);
        return appointmentRepository.findByDoctorIdOrderByScheduledAtAsc(doctorId.value());
    }

    /**
     * Appointment counts per status, including statuses with no appointments.
     */
    @Transactional(readOnly = true)
    public Map<AppointmentStatus, Long> getStatusCounts() {
        Map<AppointmentStatus, Long> counts = new EnumMap<>(AppointmentStatus.class);
        for (AppointmentStatus status : AppointmentStatus.values()) {
            counts.put(status, appointmentRepository.countByStatus(status));
        }
        return counts;
    }

    // ========================================================================
    // Booking
    // ========================================================================

    /**
     * Book a new appointment in status SCHEDULED.
     */
    public Appointment create(CreateAppointmentRequest request) {
        Patient patient = patientService.getById(PatientId.create(request.patientId()));
        Doctor doctor = doctorService.getById(DoctorId.create(request.doctorId()));
        if (!doctor.isActive()) {
            throw new ConflictException("Doctor " + doctor.getId() + " is not accepting appointments");
        }

        AppointmentType type = AppointmentType.fromValue(request.type());
        AppointmentDuration duration = request.durationMinutes() != null
            ? AppointmentDuration.ofMinutes(request.durationMinutes())
            : AppointmentDuration.forAppointmentType(type);
        LocalDateTime start = request.scheduledDateTime();

        checkOperatingHours(start, duration);
        checkNoOverlap(doctor.getId(), start, duration, null);

        Appointment appointment = Appointment.builder()
            .id(AppointmentId.create().value())
            .patientId(patient.getId())
            .doctorId(doctor.getId())
            .type(type)
            .status(AppointmentStatus.SCHEDULED)
            .scheduledAt(start)
            .duration(duration)
            .reasonForVisit(request.reasonForVisit())
            .notes(request.notes())
            .build();

        Appointment saved = appointmentRepository.save(appointment);
        log.info("Booked appointment {} for patient {} with doctor {} at {} ({})",
            saved.getId(), patient.getId(), doctor.getId(), start, duration.formatForDisplay());
        return saved;
    }

    /**
     * Partial update. Time or duration changes re-run the slot checks, excluding
     * this appointment; a status is applied last through {@link #transitionStatus}.
     */
    public Appointment update(AppointmentId id, UpdateAppointmentRequest request) {
        Appointment appointment = getById(id);

        if (request.type() != null) {
            appointment.setType(AppointmentType.fromValue(request.type()));
        }
        if (request.reasonForVisit() != null) {
            appointment.setReasonForVisit(request.reasonForVisit());
        }
        if (request.notes() != null) {
            appointment.setNotes(request.notes());
        }

        boolean rescheduled = request.scheduledDateTime() != null || request.durationMinutes() != null;
        if (rescheduled) {
            if (appointment.getStatus() != AppointmentStatus.SCHEDULED) {
                throw new ConflictException("Only scheduled appointments can be rescheduled (status is "
                    + appointment.getStatus() + ")");
            }
            LocalDateTime start = request.scheduledDateTime() != null
                ? request.scheduledDateTime()
                : appointment.getScheduledAt();
            AppointmentDuration duration = request.durationMinutes() != null
                ? AppointmentDuration.ofMinutes(request.durationMinutes())
                : appointment.getDuration();

            checkOperatingHours(start, duration);
            checkNoOverlap(appointment.getDoctorId(), start, duration, appointment.getId());

            appointment.setScheduledAt(start);
            appointment.setDuration(duration);
            log.info("Rescheduled appointment {} to {} ({})", id, start, duration.formatForDisplay());
        }

        Appointment saved = appointmentRepository.save(appointment);

        if (request.status() != null) {
            saved = transitionStatus(id, AppointmentStatus.fromValue(request.status()));
        }
        return saved;
    }

    /**
     * Move an appointment to {@code target}.
     *
     * @throws InvalidStatusTransitionException if the current status does not allow it
     */
    public Appointment transitionStatus(AppointmentId id, AppointmentStatus target) {
        Appointment appointment = getById(id);
        AppointmentStatus current = appointment.getStatus();
        if (!AppointmentStatus.canTransition(current, target)) {
            throw new InvalidStatusTransitionException(current, target);
        }
        appointment.setStatus(target);
        Appointment saved = appointmentRepository.save(appointment);
        log.info("Appointment {} status {} -> {}", id, current, target);
        return saved;
    }

    /**
     * Delete an appointment that has not started.
     */
    public void delete(AppointmentId id) {
        Appointment appointment = getById(id);
        if (appointment.getStatus() != AppointmentStatus.SCHEDULED) {
            throw new ConflictException("Only scheduled appointments can be deleted (status is "
                + appointment.getStatus() + ")");
        }
        appointmentRepository.delete(appointment);
        log.info("Deleted appointment {}", id);
    }

    // ========================================================================
    // Slot checks
    // ========================================================================

    private void checkOperatingHours(LocalDateTime start, AppointmentDuration duration) {
        if (properties.getScheduling().isEnforceOperatingHours() && !duration.fitsInOperatingHours(start)) {
            throw new RangeException(String.format(
                "Appointment at %s for %s is outside operating hours (%02d:00-%02d:00)",
                start, duration.formatForDisplay(),
                AppointmentDuration.OPENING_HOUR, AppointmentDuration.CLOSING_HOUR));
        }
    }

    private void checkNoOverlap(String doctorId, LocalDateTime start, AppointmentDuration duration,
                                String excludeAppointmentId) {
        LocalDateTime end = duration.calculateEndTime(start);
        LocalDateTime windowStart = start.minusMinutes(AppointmentDuration.MAX_MINUTES);

        Optional<Appointment> clash = appointmentRepository
            .findActiveForDoctorStartingBetween(doctorId, windowStart, end)
            .stream()
            .filter(a -> !a.getId().equals(excludeAppointmentId))
            .filter(a -> a.overlaps(start, end))
            .findFirst();

        if (clash.isPresent()) {
            Appointment other = clash.get();
            throw new ConflictException(String.format(
                "Doctor %s already has appointment %s from %s to %s",
                doctorId, other.getId(), other.getScheduledAt(), other.getEndTime()));
        }
    }
}
