package com.carepulse.controller;

import com.carepulse.dto.request.CreateDoctorRequest;
import com.carepulse.dto.request.UpdateDoctorRequest;
import com.carepulse.dto.response.AppointmentDto;
import com.carepulse.dto.response.DoctorDto;
import com.carepulse.model.clinic.Doctor;
import com.carepulse.model.id.DoctorId;
import com.carepulse.service.AppointmentService;
import com.carepulse.service.DoctorService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for the doctor roster.
 */
@RestController
@RequestMapping("/api/doctors")
public class DoctorController {

    private final DoctorService doctorService;
    private final AppointmentService appointmentService;

    public DoctorController(DoctorService doctorService, AppointmentService appointmentService) {
        this.doctorService = doctorService;
        this.appointmentService = appointmentService;
    }

    @GetMapping
    public ResponseEntity<List<DoctorDto>> getDoctors(
            @RequestParam(required = false) Boolean active,
            @RequestParam(required = false) String specialization,
            @RequestParam(required = false) String search) {
        List<DoctorDto> doctors = doctorService.search(active, specialization, search).stream()
            .map(DoctorDto::fromEntity)
            .toList();
        return ResponseEntity.ok(doctors);
    }

    @GetMapping("/{id}")
    public ResponseEntity<DoctorDto> getDoctor(@PathVariable String id) {
        return doctorService.findById(DoctorId.create(id))
            .map(DoctorDto::fromEntity)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/appointments")
    public ResponseEntity<List<AppointmentDto>> getDoctorAppointments(@PathVariable String id) {
        List<AppointmentDto> appointments = appointmentService.findByDoctor(DoctorId.create(id)).stream()
            .map(AppointmentDto::fromEntity)
            .toList();
        return ResponseEntity.ok(appointments);
    }

    @PostMapping
    public ResponseEntity<DoctorDto> createDoctor(@Valid @RequestBody CreateDoctorRequest request) {
        Doctor saved = doctorService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(DoctorDto.fromEntity(saved));
    }

    @PutMapping("/{id}")
    public ResponseEntity<DoctorDto> updateDoctor(
            @PathVariable String id,
            @Valid @RequestBody UpdateDoctorRequest request) {
        return ResponseEntity.ok(DoctorDto.fromEntity(doctorService.update(DoctorId.create(id), request)));
    }

    /**
     * Remove a doctor. Doctors with appointments are deactivated and returned with 200;
     * otherwise the doctor is deleted and 204 is returned.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<DoctorDto> deleteDoctor(@PathVariable String id) {
        DoctorService.RemovalResult result = doctorService.delete(DoctorId.create(id));
        if (result.deactivated()) {
            return ResponseEntity.ok(DoctorDto.fromEntity(result.doctor()));
        }
        return ResponseEntity.noContent().build();
    }
}
