package com.carepulse.service.document;

import com.carepulse.model.clinic.Doctor;
import com.carepulse.model.clinic.Patient;
import com.carepulse.model.document.Document;
import com.carepulse.repository.DoctorRepository;
import com.carepulse.repository.PatientRepository;
import com.carepulse.security.ClinicPrincipal;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.Set;

/**
 * Who may do what with a document.
 *
 * <ul>
 *   <li>STAFF: everything.</li>
 *   <li>PATIENT: view and download documents of their own patient record that are shared with them.</li>
 *   <li>DOCTOR: everything on documents they uploaded or that are assigned to them.</li>
 * </ul>
 * Patients can never change sharing.
 */
@Component
public class DocumentAccessPolicy {

    private static final Set<DocumentAction> PATIENT_ACTIONS = EnumSet.of(DocumentAction.VIEW, DocumentAction.DOWNLOAD);

    private final PatientRepository patientRepository;
    private final DoctorRepository doctorRepository;

    public DocumentAccessPolicy(PatientRepository patientRepository, DoctorRepository doctorRepository) {
        this.patientRepository = patientRepository;
        this.doctorRepository = doctorRepository;
    }

    public boolean isAllowed(ClinicPrincipal principal, Document document, DocumentAction action) {
        if (principal == null || principal.role() == null || document == null || action == null) {
            return false;
        }
        return switch (principal.role()) {
            case STAFF -> true;
            case PATIENT -> PATIENT_ACTIONS.contains(action)
                && document.isSharedWithPatient()
                && isOwnPatientRecord(principal, document.getPatientId());
            case DOCTOR -> principal.id().equals(document.getUploadedBy())
                || isAssignedDoctor(principal, document.getDoctorId());
        };
    }

    /**
     * Whether {@code patientId} is the patient record owned by the principal.
     */
    public boolean isOwnPatientRecord(ClinicPrincipal principal, String patientId) {
        return patientRepository.findById(patientId)
            .map(Patient::getUserId)
            .map(principal.id()::equals)
            .orElse(false);
    }

    private boolean isAssignedDoctor(ClinicPrincipal principal, String doctorId) {
        if (doctorId == null) {
            return false;
        }
        return doctorRepository.findById(doctorId)
            .map(Doctor::getUserId)
            .map(principal.id()::equals)
            .orElse(false);
    }
}
