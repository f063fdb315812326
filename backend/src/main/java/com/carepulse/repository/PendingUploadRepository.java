package com.carepulse.repository;

import com.carepulse.model.document.PendingUpload;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Optional;

@Repository
public interface PendingUploadRepository extends JpaRepository<PendingUpload, String> {

    Optional<PendingUpload> findByStorageKey(String storageKey);

    @Modifying
    @Query("DELETE FROM PendingUpload p WHERE p.expiresAt <= :now")
    int deleteExpired(@Param("now") Instant now);

    @Modifying
    @Query("DELETE FROM PendingUpload p WHERE p.patientId = :patientId")
    int deleteByPatientId(@Param("patientId") String patientId);
}
