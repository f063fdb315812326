package com.carepulse.service;

import com.carepulse.dto.request.CreateDoctorRequest;
import com.carepulse.dto.request.UpdateDoctorRequest;
import com.carepulse.exception.ConflictException;
import com.carepulse.model.clinic.Doctor;
import com.carepulse.model.clinic.UserAccount;
import com.carepulse.model.enums.UserRole;
import com.carepulse.model.id.DoctorId;
import com.carepulse.model.id.UserId;
import com.carepulse.model.value.EmailAddress;
import com.carepulse.repository.AppointmentRepository;
import com.carepulse.repository.DoctorRepository;
import com.carepulse.repository.DocumentRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Doctor roster maintenance.
 */
@Service
@Transactional
@Slf4j
public class DoctorService {

    /**
     * Outcome of {@link #delete}: doctors still referenced by appointments or documents
     * are deactivated instead.
     */
    public record RemovalResult(Doctor doctor, boolean deactivated) {}

    private final DoctorRepository doctorRepository;
    private final AppointmentRepository appointmentRepository;
    private final DocumentRepository documentRepository;
    private final UserAccountService userAccountService;

    public DoctorService(
            DoctorRepository doctorRepository,
            AppointmentRepository appointmentRepository,
            DocumentRepository documentRepository,
            UserAccountService userAccountService) {
        this.doctorRepository = doctorRepository;
        this.appointmentRepository = appointmentRepository;
        this.documentRepository = documentRepository;
        this.userAccountService = userAccountService;
    }

    @Transactional(readOnly = true)
    public Optional<Doctor> findById(DoctorId id) {
        return doctorRepository.findById(id.value());
    }

    @Transactional(readOnly = true)
    public Doctor getById(DoctorId id) {
        return findById(id).orElseThrow(() -> new EntityNotFoundException("Doctor not found: " + id));
    }

    @Transactional(readOnly = true)
    public Optional<Doctor> findByUserId(String userId) {
        return doctorRepository.findByUserId(userId);
    }

    @Transactional(readOnly = true)
    public List<Doctor> search(Boolean active, String specialization, String search) {
        return doctorRepository.search(
            active,
            specialization == null || specialization.isBlank() ? null : specialization.trim(),
            search == null || search.isBlank() ? null : search.trim());
    }

    public Doctor create(CreateDoctorRequest request) {
        EmailAddress email = EmailAddress.of(request.email());
        if (doctorRepository.existsByEmail(email)) {
            throw new ConflictException("Doctor with email " + email + " already exists");
        }

        String firstName = request.firstName().trim();
        String lastName = request.lastName().trim();

        UserAccount account;
        if (request.userId() != null && !request.userId().isBlank()) {
            account = userAccountService.requireAccount(UserId.create(request.userId()), UserRole.DOCTOR);
            if (doctorRepository.findByUserId(account.getId()).isPresent()) {
                throw new ConflictException("User " + account.getId() + " already has a doctor record");
            }
        } else {
            account = userAccountService.createAccount(
                UserRole.DOCTOR, email, null, firstName, lastName, request.password());
        }

        Doctor doctor = Doctor.builder()
            .id(DoctorId.create().value())
            .userId(account.getId())
            .firstName(firstName)
            .lastName(lastName)
            .email(email)
            .specialization(request.specialization())
            .active(request.active() == null || request.active())
            .build();

        Doctor saved = doctorRepository.save(doctor);
        log.info("Added doctor {} ({})", saved.getId(), saved.getDisplayName());
        return saved;
    }

    public Doctor update(DoctorId id, UpdateDoctorRequest request) {
        Doctor doctor = getById(id);

        if (request.firstName() != null) {
            doctor.setFirstName(request.firstName().trim());
        }
        if (request.lastName() != null) {
            doctor.setLastName(request.lastName().trim());
        }
        if (request.email() != null) {
            EmailAddress email = EmailAddress.of(request.email());
            if (doctorRepository.existsByEmailAndIdNot(email, doctor.getId())) {
                throw new ConflictException("Doctor with email " + email + " already exists");
            }
            doctor.setEmail(email);
        }
        if (request.specialization() != null) {
            doctor.setSpecialization(request.specialization());
        }
        if (request.active() != null) {
            doctor.setActive(request.active());
        }

        return doctorRepository.save(doctor);
    }

    /**
     * Delete a doctor and its login account, or deactivate one that appointments
     * or documents still reference.
     */
    public RemovalResult delete(DoctorId id) {
        Doctor doctor = getById(id);
        if (appointmentRepository.existsByDoctorId(doctor.getId())
                || documentRepository.existsByDoctorId(doctor.getId())) {
            doctor.setActive(false);
            Doctor saved = doctorRepository.save(doctor);
            log.info("Deactivated doctor {} (referenced by appointments or documents)", id);
            return new RemovalResult(saved, true);
        }
        doctorRepository.delete(doctor);
        userAccountService.deleteAccount(doctor.getUserId());
        log.info("Deleted doctor {}", id);
        return new RemovalResult(doctor, false);
    }
}
