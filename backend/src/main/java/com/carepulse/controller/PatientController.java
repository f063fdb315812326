package com.carepulse.controller;

import com.carepulse.dto.request.CreatePatientRequest;
import com.carepulse.dto.request.UpdatePatientRequest;
import com.carepulse.dto.response.PatientDto;
import com.carepulse.dto.response.PatientListDto;
import com.carepulse.model.clinic.Patient;
import com.carepulse.model.id.PatientId;
import com.carepulse.model.value.EmailAddress;
import com.carepulse.model.value.PhoneNumber;
import com.carepulse.service.PatientService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for patient registration and lookup.
 */
@RestController
@RequestMapping("/api/patients")
@Validated
@Slf4j
public class PatientController {

    private final PatientService patientService;

    public PatientController(PatientService patientService) {
        this.patientService = patientService;
    }

    // ========================================================================
    // Read Operations
    // ========================================================================

    /**
     * List patients with optional filters. Email and phone are normalized before matching.
     */
    @GetMapping
    public ResponseEntity<PatientListDto> getPatients(
            @RequestParam(required = false) String firstName,
            @RequestParam(required = false) String lastName,
            @RequestParam(required = false) String email,
            @RequestParam(required = false) String phone,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset) {

        EmailAddress emailFilter = email != null && !email.isBlank() ? EmailAddress.of(email) : null;
        PhoneNumber phoneFilter = phone != null && !phone.isBlank() ? PhoneNumber.of(phone) : null;

        Page<Patient> page = patientService.search(firstName, lastName, emailFilter, phoneFilter, limit, offset);
        return ResponseEntity.ok(new PatientListDto(
            page.getContent().stream().map(PatientDto::fromEntity).toList(),
            page.getTotalElements(),
            limit,
            offset));
    }

    /**
     * Find the patient registered with a phone number (check-in kiosk lookup).
     */
    @GetMapping("/lookup")
    public ResponseEntity<PatientDto> lookupByPhone(@RequestParam String phone) {
        return patientService.findByPhone(PhoneNumber.of(phone))
            .map(PatientDto::fromEntity)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}")
    public ResponseEntity<PatientDto> getPatient(@PathVariable String id) {
        return patientService.findById(PatientId.create(id))
            .map(PatientDto::fromEntity)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }

    // ========================================================================
    // Write Operations
    // ========================================================================

    @PostMapping
    public ResponseEntity<PatientDto> createPatient(@Valid @RequestBody CreatePatientRequest request) {
        log.info("Registering patient {} {}", request.firstName(), request.lastName());
        Patient saved = patientService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(PatientDto.fromEntity(saved));
    }

    @PutMapping("/{id}")
    public ResponseEntity<PatientDto> updatePatient(
            @PathVariable String id,
            @Valid @RequestBody UpdatePatientRequest request) {
        Patient saved = patientService.update(PatientId.create(id), request);
        return ResponseEntity.ok(PatientDto.fromEntity(saved));
    }

    /**
     * Delete a patient. Refused with 409 while appointments reference the patient.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deletePatient(@PathVariable String id) {
        log.info("Deleting patient {}", id);
        patientService.delete(PatientId.create(id));
        return ResponseEntity.noContent().build();
    }
}
