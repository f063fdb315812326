package com.carepulse.service;

import com.carepulse.dto.request.CreatePatientRequest;
import com.carepulse.dto.request.UpdatePatientRequest;
import com.carepulse.exception.ConflictException;
import com.carepulse.model.clinic.Patient;
import com.carepulse.model.clinic.UserAccount;
import com.carepulse.model.enums.UserRole;
import com.carepulse.model.id.PatientId;
import com.carepulse.model.id.UserId;
import com.carepulse.model.value.EmailAddress;
import com.carepulse.model.value.PhoneNumber;
import com.carepulse.repository.AppointmentRepository;
import com.carepulse.repository.DocumentRepository;
import com.carepulse.repository.OffsetLimitPageRequest;
import com.carepulse.repository.PatientRepository;
import com.carepulse.repository.PendingUploadRepository;
import jakarta.persistence.EntityNotFoundException;
import jakarta.persistence.criteria.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Patient registration, lookup and maintenance.
 */
@Service
@Transactional
@Slf4j
public class PatientService {

    private final PatientRepository patientRepository;
    private final AppointmentRepository appointmentRepository;
    private final DocumentRepository documentRepository;
    private final PendingUploadRepository pendingUploadRepository;
    private final UserAccountService userAccountService;

    public PatientService(
            PatientRepository patientRepository,
            AppointmentRepository appointmentRepository,
            DocumentRepository documentRepository,
            PendingUploadRepository pendingUploadRepository,
            UserAccountService userAccountService) {
        this.patientRepository = patientRepository;
        this.appointmentRepository = appointmentRepository;
        this.documentRepository = documentRepository;
        this.pendingUploadRepository = pendingUploadRepository;
        this.userAccountService = userAccountService;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    @Transactional(readOnly = true)
    public Optional<Patient> findById(PatientId id) {
        return patientRepository.findById(id.value());
    }

    @Transactional(readOnly = true)
    public Patient getById(PatientId id) {
        return findById(id).orElseThrow(() -> new EntityNotFoundException("Patient not found: " + id));
    }

    @Transactional(readOnly = true)
    public Optional<Patient> findByPhone(PhoneNumber phone) {
        return patientRepository.findByPhone(phone);
    }

    @Transactional(readOnly = true)
    public Optional<Patient> findByUserId(String userId) {
        return patientRepository.findByUserId(userId);
    }

    /**
     * Filtered, paged patient list ordered by last name.
     * Name filters are case-insensitive "contains"; email and phone match exactly.
     */
    @Transactional(readOnly = true)
    public Page<Patient> search(String firstName, String lastName, EmailAddress email, PhoneNumber phone,
                                int limit, int offset) {
        Specification<Patient> spec = (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (firstName != null && !firstName.isBlank()) {
                predicates.add(cb.like(cb.lower(root.get("firstName")), "%" + firstName.trim().toLowerCase() + "%"));
            }
            if (lastName != null && !lastName.isBlank()) {
                predicates.add(cb.like(cb.lower(root.get("lastName")), "%" + lastName.trim().toLowerCase() + "%"));
            }
            if (email != null) {
                predicates.add(cb.equal(root.get("email"), email));
            }
            if (phone != null) {
                predicates.add(cb.equal(root.get("phone"), phone));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
        Sort sort = Sort.by("lastName").and(Sort.by("firstName"));
        return patientRepository.findAll(spec, OffsetLimitPageRequest.of(offset, limit, sort));
    }

    // ========================================================================
    // Commands
    // ========================================================================

    /**
     * Register a patient, creating a PATIENT account when no user id is given.
     */
    public Patient create(CreatePatientRequest request) {
        EmailAddress email = EmailAddress.of(request.email());
        PhoneNumber phone = PhoneNumber.of(request.phone());

        if (patientRepository.existsByEmail(email)) {
            throw new ConflictException("Patient with email " + email + " already exists");
        }
        if (patientRepository.existsByPhone(phone)) {
            throw new ConflictException("Patient with phone " + phone.formatForDisplay() + " already exists");
        }

        String firstName = request.firstName().trim();
        String lastName = request.lastName().trim();

        UserAccount account;
        if (request.userId() != null && !request.userId().isBlank()) {
            account = userAccountService.requireAccount(UserId.create(request.userId()), UserRole.PATIENT);
            if (patientRepository.findByUserId(account.getId()).isPresent()) {
                throw new ConflictException("User " + account.getId() + " already has a patient record");
            }
        } else {
            account = userAccountService.createAccount(
                UserRole.PATIENT, email, phone, firstName, lastName, request.password());
        }

        Patient patient = Patient.builder()
            .id(PatientId.create().value())
            .userId(account.getId())
            .firstName(firstName)
            .lastName(lastName)
            .email(email)
            .phone(phone)
            .dateOfBirth(request.dateOfBirth())
            .address(request.address())
            .build();

        Patient saved = patientRepository.save(patient);
        log.info("Registered patient {} for user {}", saved.getId(), saved.getUserId());
        return saved;
    }

    public Patient update(PatientId id, UpdatePatientRequest request) {
        Patient patient = getById(id);

        if (request.firstName() != null) {
            patient.setFirstName(request.firstName().trim());
        }
        if (request.lastName() != null) {
            patient.setLastName(request.lastName().trim());
        }
        if (request.email() != null) {
            EmailAddress email = EmailAddress.of(request.email());
            if (patientRepository.existsByEmailAndIdNot(email, patient.getId())) {
                throw new ConflictException("Patient with email " + email + " already exists");
            }
            patient.setEmail(email);
        }
        if (request.phone() != null) {
            PhoneNumber phone = PhoneNumber.of(request.phone());
            if (patientRepository.existsByPhoneAndIdNot(phone, patient.getId())) {
                throw new ConflictException("Patient with phone " + phone.formatForDisplay() + " already exists");
            }
            patient.setPhone(phone);
        }
        if (request.dateOfBirth() != null) {
            patient.setDateOfBirth(request.dateOfBirth());
        }
        if (request.address() != null) {
            patient.setAddress(request.address());
        }

        return patientRepository.save(patient);
    }

    /**
     * Delete a patient that has no appointments or documents, together with
     * its unconfirmed uploads and its login account.
     */
    public void delete(PatientId id) {
        Patient patient = getById(id);
        if (appointmentRepository.existsByPatientId(patient.getId())) {
            throw new ConflictException("Patient " + id + " has appointments and cannot be deleted");
        }
        if (documentRepository.existsByPatientId(patient.getId())) {
            throw new ConflictException("Patient " + id + " has documents and cannot be deleted");
        }
        int pending = pendingUploadRepository.deleteByPatientId(patient.getId());
        patientRepository.delete(patient);
        userAccountService.deleteAccount(patient.getUserId());
        log.info("Deleted patient {} ({} pending uploads dropped)", id, pending);
    }
}
