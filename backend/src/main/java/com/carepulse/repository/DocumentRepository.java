package com.carepulse.repository;

import com.carepulse.model.document.Document;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for document metadata.
 */
@Repository
public interface DocumentRepository extends JpaRepository<Document, String>, JpaSpecificationExecutor<Document> {

    List<Document> findByPatientIdOrderByCreatedAtDesc(String patientId);

    List<Document> findByPatientIdAndSharedWithPatientTrueOrderByCreatedAtDesc(String patientId);

    List<Document> findTop5ByPatientIdOrderByCreatedAtDesc(String patientId);

    long countByPatientId(String patientId);

    boolean existsByPatientId(String patientId);

    boolean existsByDoctorId(String doctorId);

    @Query("SELECT COALESCE(SUM(d.fileSize), 0) FROM Document d WHERE d.patientId = :patientId")
    long sumFileSizeByPatientId(@Param("patientId") String patientId);

    /**
     * Document counts per category for a patient, as {@code [category, count]} rows.
     */
    @Query("SELECT d.category, COUNT(d) FROM Document d WHERE d.patientId = :patientId GROUP BY d.category")
    List<Object[]> countByCategoryForPatient(@Param("patientId") String patientId);
}
