package com.carepulse.repository;

import com.carepulse.model.clinic.Doctor;
import com.carepulse.model.value.EmailAddress;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for doctors.
 */
@Repository
public interface DoctorRepository extends JpaRepository<Doctor, String> {

    List<Doctor> findByActiveTrueOrderByLastNameAsc();

    Optional<Doctor> findByUserId(String userId);

    /**
     * Filter doctors. Null arguments match everything.
     */
    @Query("""
        SELECT d FROM Doctor d
        WHERE (:active IS NULL OR d.active = :active)
          AND (:specialization IS NULL OR LOWER(d.specialization) = LOWER(:specialization))
          AND (:search IS NULL
               OR LOWER(d.firstName) LIKE LOWER(CONCAT('%', :search, '%'))
               OR LOWER(d.lastName) LIKE LOWER(CONCAT('%', :search, '%')))
        ORDER BY d.lastName, d.firstName
        """)
    List<Doctor> search(@Param("active") Boolean active,
                        @Param("specialization") String specialization,
                        @Param("search") String search);

    boolean existsByEmail(EmailAddress email);

    boolean existsByEmailAndIdNot(EmailAddress email, String id);
}
