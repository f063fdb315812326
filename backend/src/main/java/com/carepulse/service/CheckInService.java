package com.carepulse.service;

import com.carepulse.config.ClinicProperties;
import com.carepulse.exception.ConflictException;
import com.carepulse.model.enums.AppointmentStatus;
import com.carepulse.model.enums.QueueStatus;
import com.carepulse.model.id.AppointmentId;
import com.carepulse.model.id.QueueId;
import com.carepulse.model.scheduling.Appointment;
import com.carepulse.model.scheduling.QueueTicket;
import com.carepulse.repository.QueueTicketRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * Walk-in check-in queue. Each day's tickets are numbered from 1 in check-in order.
 */
@Service
@Transactional
@Slf4j
public class CheckInService {

    /**
     * Tickets in these states count as waiting ahead of a later ticket.
     */
    static final Set<QueueStatus> WAITING_STATES = EnumSet.of(QueueStatus.CHECKED_IN, QueueStatus.WAITING);

    /**
     * Queue standing of a ticket.
     */
    public record QueuePosition(
        String appointmentId,
        int queueNumber,
        long patientsAhead,
        long estimatedWaitMinutes,
        QueueStatus status
    ) {}

    private final QueueTicketRepository queueTicketRepository;
    private final AppointmentService appointmentService;
    private final ClinicProperties properties;
    private final Clock clock;

    public CheckInService(
            QueueTicketRepository queueTicketRepository,
            AppointmentService appointmentService,
            ClinicProperties properties,
            Clock clock) {
        this.queueTicketRepository = queueTicketRepository;
        this.appointmentService = appointmentService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Issue today's next queue ticket for a scheduled appointment.
     *
     * @throws ConflictException if the appointment is not SCHEDULED or is already checked in
     */
    public QueueTicket checkIn(AppointmentId appointmentId) {
        Appointment appointment = appointmentService.getById(appointmentId);
        if (appointment.getStatus() != AppointmentStatus.SCHEDULED) {
            throw new ConflictException("Only scheduled appointments can be checked in (status is "
                + appointment.getStatus() + ")");
        }
        if (queueTicketRepository.existsByAppointmentId(appointment.getId())) {
            throw new ConflictException("Appointment " + appointmentId + " is already checked in");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDate today = now.toLocalDate();
        int queueNumber = (int) queueTicketRepository.countByQueueDate(today) + 1;

        QueueTicket ticket = QueueTicket.builder()
            .id(QueueId.create().value())
            .appointmentId(appointment.getId())
            .patientId(appointment.getPatientId())
            .queueDate(today)
            .queueNumber(queueNumber)
            .status(QueueStatus.CHECKED_IN)
            .checkedInAt(now)
            .build();

        QueueTicket saved = queueTicketRepository.save(ticket);
        log.info("Checked in appointment {} as queue number {} on {}", appointmentId, queueNumber, today);
        return saved;
    }

    @Transactional(readOnly = true)
    public QueuePosition getQueuePosition(AppointmentId appointmentId) {
        QueueTicket ticket = queueTicketRepository.findByAppointmentId(appointmentId.value())
            .orElseThrow(() -> new EntityNotFoundException(
                "Appointment " + appointmentId + " has not been checked in"));

        long ahead = WAITING_STATES.contains(ticket.getStatus())
            ? queueTicketRepository.countByQueueDateAndStatusInAndQueueNumberLessThan(
                ticket.getQueueDate(), WAITING_STATES, ticket.getQueueNumber())
            : 0;
        long wait = ahead * properties.getScheduling().getMinutesPerQueuedPatient();

        return new QueuePosition(ticket.getAppointmentId(), ticket.getQueueNumber(), ahead, wait, ticket.getStatus());
    }
}
