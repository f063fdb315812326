package com.carepulse.repository;

import com.carepulse.model.enums.AppointmentStatus;
import com.carepulse.model.scheduling.Appointment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for appointments.
 */
@Repository
public interface AppointmentRepository extends JpaRepository<Appointment, String>,
        JpaSpecificationExecutor<Appointment> {

    List<Appointment> findByPatientIdOrderByScheduledAtAsc(String patientId);

    List<Appointment> findByDoctorIdOrderByScheduledAtAsc(String doctorId);

    boolean existsByPatientId(String patientId);

    boolean existsByDoctorId(String doctorId);

    long countByStatus(AppointmentStatus status);

    /**
     * Candidate appointments for an overlap check: same doctor, not cancelled,
     * starting inside {@code [windowStart, windowEnd)}. Callers widen the window by
     * the longest allowed duration and do the exact end-time comparison themselves.
     */
    @Query("""
        SELECT a FROM Appointment a
        WHERE a.doctorId = :doctorId
          AND a.status <> com.carepulse.model.enums.AppointmentStatus.CANCELLED
          AND a.scheduledAt >= :windowStart
          AND a.scheduledAt < :windowEnd
        ORDER BY a.scheduledAt
        """)
    List<Appointment> findActiveForDoctorStartingBetween(@Param("doctorId") String doctorId,
                                                         @Param("windowStart") LocalDateTime windowStart,
                                                         @Param("windowEnd") LocalDateTime windowEnd);
}
