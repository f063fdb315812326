package com.carepulse.repository;

import com.carepulse.model.clinic.Patient;
import com.carepulse.model.value.EmailAddress;
import com.carepulse.model.value.PhoneNumber;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for patients. Email, phone and owning user are unique at the
 * table level; violations surface as {@code DataIntegrityViolationException}.
 */
@Repository
public interface PatientRepository extends JpaRepository<Patient, String>, JpaSpecificationExecutor<Patient> {

    Optional<Patient> findByPhone(PhoneNumber phone);

    Optional<Patient> findByUserId(String userId);

    boolean existsByEmail(EmailAddress email);

    boolean existsByPhone(PhoneNumber phone);

    boolean existsByEmailAndIdNot(EmailAddress email, String id);

    boolean existsByPhoneAndIdNot(PhoneNumber phone, String id);
}
