package com.carepulse.controller;

import com.carepulse.dto.request.CreateAppointmentRequest;
import com.carepulse.dto.request.UpdateAppointmentRequest;
import com.carepulse.dto.request.UpdateAppointmentStatusRequest;
import com.carepulse.dto.response.AppointmentDto;
import com.carepulse.dto.response.AppointmentStatsDto;
import com.carepulse.dto.response.QueueTicketDto;
import com.carepulse.model.enums.AppointmentStatus;
import com.carepulse.model.enums.AppointmentType;
import com.carepulse.model.id.AppointmentId;
import com.carepulse.model.id.DoctorId;
import com.carepulse.model.id.PatientId;
import com.carepulse.model.scheduling.Appointment;
import com.carepulse.model.scheduling.QueueTicket;
import com.carepulse.service.AppointmentService;
import com.carepulse.service.CheckInService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for appointments, status changes and check-in.
 */
@RestController
@RequestMapping("/api/appointments")
@Slf4j
public class AppointmentController {

    private final AppointmentService appointmentService;
    private final CheckInService checkInService;

    public AppointmentController(AppointmentService appointmentService, CheckInService checkInService) {
        this.appointmentService = appointmentService;
        this.checkInService = checkInService;
    }

    // ========================================================================
    // Read Operations
    // ========================================================================

    /**
     * List appointments. {@code date} is shorthand for {@code dateFrom = dateTo = date}.
     */
    @GetMapping
    public ResponseEntity<List<AppointmentDto>> getAppointments(
            @RequestParam(required = false) String patientId,
            @RequestParam(required = false) String doctorId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String type,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo) {

        List<Appointment> appointments = appointmentService.search(
            isPresent(patientId) ? PatientId.create(patientId) : null,
            isPresent(doctorId) ? DoctorId.create(doctorId) : null,
            isPresent(status) ? AppointmentStatus.fromValue(status) : null,
            isPresent(type) ? AppointmentType.fromValue(type) : null,
            date != null ? date : dateFrom,
            date != null ? date : dateTo);

        return ResponseEntity.ok(appointments.stream().map(AppointmentDto::fromEntity).toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<AppointmentDto> getAppointment(@PathVariable String id) {
        return appointmentService.findById(AppointmentId.create(id))
            .map(AppointmentDto::fromEntity)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/stats")
    public ResponseEntity<AppointmentStatsDto> getStats() {
        Map<AppointmentStatus, Long> counts = appointmentService.getStatusCounts();
        long total = counts.values().stream().mapToLong(Long::longValue).sum();

        Map<String, Long> byStatus = new LinkedHashMap<>();
        counts.forEach((status, count) -> byStatus.put(status.name(), count));

        return ResponseEntity.ok(new AppointmentStatsDto(total, byStatus));
    }

    @GetMapping("/{id}/queue-position")
    public ResponseEntity<CheckInService.QueuePosition> getQueuePosition(@PathVariable String id) {
        return ResponseEntity.ok(checkInService.getQueuePosition(AppointmentId.create(id)));
    }

    // ========================================================================
    // Write Operations
    // ========================================================================

    @PostMapping
    public ResponseEntity<AppointmentDto> createAppointment(@Valid @RequestBody CreateAppointmentRequest request) {
        Appointment saved = appointmentService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(AppointmentDto.fromEntity(saved));
    }

    @PutMapping("/{id}")
    public ResponseEntity<AppointmentDto> updateAppointment(
            @PathVariable String id,
            @RequestBody UpdateAppointmentRequest request) {
        Appointment saved = appointmentService.update(AppointmentId.create(id), request);
        return ResponseEntity.ok(AppointmentDto.fromEntity(saved));
    }

    /**
     * Change status. Illegal transitions are rejected with 409.
     */
    @PatchMapping("/{id}/status")
    public ResponseEntity<AppointmentDto> updateStatus(
            @PathVariable String id,
            @Valid @RequestBody UpdateAppointmentStatusRequest request) {
        log.info("Status change requested for appointment {}: {}", id, request.status());
        Appointment saved = appointmentService.transitionStatus(
            AppointmentId.create(id), AppointmentStatus.fromValue(request.status()));
        return ResponseEntity.ok(AppointmentDto.fromEntity(saved));
    }

    @PostMapping("/{id}/check-in")
    public ResponseEntity<QueueTicketDto> checkIn(@PathVariable String id) {
        log.info("Check-in for appointment {}", id);
        QueueTicket ticket = checkInService.checkIn(AppointmentId.create(id));
        return ResponseEntity.status(HttpStatus.CREATED).body(QueueTicketDto.fromEntity(ticket));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteAppointment(@PathVariable String id) {
        appointmentService.delete(AppointmentId.create(id));
        return ResponseEntity.noContent().build();
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
