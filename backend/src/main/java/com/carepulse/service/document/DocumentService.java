package com.carepulse.service.document;

import com.carepulse.config.ClinicProperties;
import com.carepulse.dto.request.ConfirmUploadRequest;
import com.carepulse.dto.request.UpdateDocumentRequest;
import com.carepulse.dto.request.UploadUrlRequest;
import com.carepulse.exception.ConflictException;
import com.carepulse.exception.InvalidFormatException;
import com.carepulse.exception.RangeException;
import com.carepulse.model.clinic.Doctor;
import com.carepulse.model.document.Document;
import com.carepulse.model.document.PendingUpload;
import com.carepulse.model.enums.DocumentCategory;
import com.carepulse.model.id.AppointmentId;
import com.carepulse.model.id.DocumentId;
import com.carepulse.model.id.PatientId;
import com.carepulse.model.scheduling.Appointment;
import com.carepulse.repository.DoctorRepository;
import com.carepulse.repository.DocumentRepository;
import com.carepulse.repository.OffsetLimitPageRequest;
import com.carepulse.repository.PatientRepository;
import com.carepulse.repository.PendingUploadRepository;
import com.carepulse.security.ClinicPrincipal;
import com.carepulse.service.AppointmentService;
import com.carepulse.service.storage.PresignedUrl;
import com.carepulse.service.storage.StorageGateway;
import com.carepulse.service.storage.StorageKeys;
import jakarta.persistence.EntityNotFoundException;
import jakarta.persistence.criteria.Predicate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Patient documents: two-phase upload, listing, sharing and download links.
 * File bytes never pass through this service; the {@link StorageGateway} issues
 * direct upload and download URLs.
 */
@Service
@Transactional
@Slf4j
public class DocumentService {

    public static final Set<String> ALLOWED_FILE_TYPES = Set.of(
        "image/jpeg",
        "image/png",
        "image/gif",
        "application/pdf",
        "application/msword",
        "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
        "text/plain"
    );

    public static final Set<String> SORT_FIELDS = Set.of("createdAt", "fileName", "category", "fileSize");

    private static final int RECENT_DOCUMENTS = 5;

    private final DocumentRepository documentRepository;
    private final PendingUploadRepository pendingUploadRepository;
    private final PatientRepository patientRepository;
    private final DoctorRepository doctorRepository;
    private final AppointmentService appointmentService;
    private final StorageGateway storageGateway;
    private final DocumentAccessPolicy accessPolicy;
    private final ClinicProperties properties;
    private final Clock clock;

    public DocumentService(
            DocumentRepository documentRepository,
            PendingUploadRepository pendingUploadRepository,
            PatientRepository patientRepository,
            DoctorRepository doctorRepository,
            AppointmentService appointmentService,
            StorageGateway storageGateway,
            DocumentAccessPolicy accessPolicy,
            ClinicProperties properties,
            Clock clock) {
        this.documentRepository = documentRepository;
        this.pendingUploadRepository = pendingUploadRepository;
        this.patientRepository = patientRepository;
        this.doctorRepository = doctorRepository;
        this.appointmentService = appointmentService;
        this.storageGateway = storageGateway;
        this.accessPolicy = accessPolicy;
        this.properties = properties;
        this.clock = clock;
    }

    // ========================================================================
    // Upload
    // ========================================================================

    /**
     * First phase: validate the file metadata and hand out an upload URL.
     * The request is remembered as a {@link PendingUpload} until confirmed or expired.
     */
    public UploadTicket requestUpload(ClinicPrincipal principal, UploadUrlRequest request) {
        if (!ALLOWED_FILE_TYPES.contains(request.fileType())) {
            throw new InvalidFormatException("Invalid file type: " + request.fileType()
                + ". Allowed types: " + String.join(", ", ALLOWED_FILE_TYPES));
        }
        long maxSize = properties.getStorage().getMaxFileSizeBytes();
        if (request.fileSize() > maxSize) {
            throw new RangeException("File too large: " + request.fileSize() + " bytes (max " + maxSize + ")");
        }

        PatientId patientId = PatientId.create(request.patientId());
        if (!patientRepository.existsById(patientId.value())) {
            throw new EntityNotFoundException("Patient not found: " + patientId);
        }
        if (principal.isPatient() && !accessPolicy.isOwnPatientRecord(principal, patientId.value())) {
            throw new AccessDeniedException("Patients can only upload their own documents");
        }
        String appointmentId = resolveAppointment(request.appointmentId(), patientId);

        Instant now = Instant.now(clock);
        String fileId = DocumentId.create().value();
        LocalDate today = LocalDate.now(clock);
        String storageKey = StorageKeys.forDocument(patientId.value(), today, fileId, request.fileName());

        PresignedUrl uploadUrl = storageGateway.createUploadUrl(
            storageKey, fileId, request.fileType(), properties.getStorage().getPendingUploadTtl());

        PendingUpload pending = PendingUpload.builder()
            .fileId(fileId)
            .storageKey(storageKey)
            .fileName(request.fileName())
            .fileType(request.fileType())
            .fileSize(request.fileSize())
            .patientId(patientId.value())
            .appointmentId(appointmentId)
            .category(request.category())
            .description(request.description())
            .requestedBy(principal.id())
            .createdAt(now)
            .expiresAt(now.plus(properties.getStorage().getPendingUploadTtl()))
            .build();
        pendingUploadRepository.save(pending);

        log.info("Upload URL issued for {} ({}, {} bytes) by {}", storageKey, request.fileType(),
            request.fileSize(), principal.id());
        return new UploadTicket(uploadUrl.url(), storageKey, fileId, pending.getExpiresAt());
    }

    /**
     * Second phase: turn a pending upload into a document.
     *
     * @throws EntityNotFoundException if no pending upload has this file id
     * @throws ConflictException       if the storage key does not match or the upload expired
     */
    @Transactional(noRollbackFor = ConflictException.class)
    public Document confirmUpload(ClinicPrincipal principal, ConfirmUploadRequest request) {
        PendingUpload pending = pendingUploadRepository.findById(request.fileId())
            .orElseThrow(() -> new EntityNotFoundException("No pending upload for file " + request.fileId()));

        if (!pending.getStorageKey().equals(request.storageKey())) {
            throw new ConflictException("Storage key does not match pending upload " + request.fileId());
        }
        if (!principal.isStaff() && !principal.id().equals(pending.getRequestedBy())) {
            throw new AccessDeniedException("Upload was requested by another user");
        }
        if (pending.isExpired(Instant.now(clock))) {
            pendingUploadRepository.delete(pending);
            throw new ConflictException("Upload " + request.fileId() + " expired at " + pending.getExpiresAt());
        }

        String doctorId = principal.isDoctor()
            ? doctorRepository.findByUserId(principal.id()).map(Doctor::getId).orElse(null)
            : null;

        Document document = Document.builder()
            .id(pending.getFileId())
            .fileName(pending.getFileName())
            .fileType(pending.getFileType())
            .fileSize(pending.getFileSize())
            .storageKey(pending.getStorageKey())
            .uploadedBy(pending.getRequestedBy())
            .patientId(pending.getPatientId())
            .doctorId(doctorId)
            .appointmentId(pending.getAppointmentId())
            .category(pending.getCategory())
            .description(request.description() != null ? request.description() : pending.getDescription())
            .sharedWithPatient(Boolean.TRUE.equals(request.sharedWithPatient()))
            .build();

        Document saved = documentRepository.save(document);
        pendingUploadRepository.delete(pending);
        log.info("Confirmed upload {} for patient {}", saved.getId(), saved.getPatientId());
        return saved;
    }

    // ========================================================================
    // Queries
    // ========================================================================

    /**
     * Documents visible to the principal. Patients get their own shared documents
     * and the filter is ignored for them.
     */
    @Transactional(readOnly = true)
    public Page<Document> list(ClinicPrincipal principal, DocumentFilter filter,
                               String sortField, String sortOrder, int limit, int offset) {
        if (principal.isPatient()) {
            List<Document> own = patientRepository.findByUserId(principal.id())
                .map(p -> documentRepository.findByPatientIdAndSharedWithPatientTrueOrderByCreatedAtDesc(p.getId()))
                .orElse(List.of());
            return new PageImpl<>(own);
        }

        Sort sort = toSort(sortField, sortOrder);
        return documentRepository.findAll(toSpecification(filter), OffsetLimitPageRequest.of(offset, limit, sort));
    }

    @Transactional(readOnly = true)
    public Document get(ClinicPrincipal principal, DocumentId id) {
        return requireAccess(principal, id, DocumentAction.VIEW);
    }

    @Transactional(readOnly = true)
    public DownloadLink createDownloadLink(ClinicPrincipal principal, DocumentId id) {
        Document document = requireAccess(principal, id, DocumentAction.DOWNLOAD);
        PresignedUrl url = storageGateway.createDownloadUrl(
            document.getStorageKey(), document.getFileName(), properties.getStorage().getDownloadUrlTtl());
        return new DownloadLink(url.url(), document.getFileName(), url.expiresAt());
    }

    /**
     * Summary of one patient's documents. Patients may only ask about themselves.
     */
    @Transactional(readOnly = true)
    public DocumentStats getPatientStats(ClinicPrincipal principal, PatientId patientId) {
        if (!patientRepository.existsById(patientId.value())) {
            throw new EntityNotFoundException("Patient not found: " + patientId);
        }
        if (principal.isPatient() && !accessPolicy.isOwnPatientRecord(principal, patientId.value())) {
            throw new AccessDeniedException("Access denied");
        }

        Map<DocumentCategory, Long> byCategory = new EnumMap<>(DocumentCategory.class);
        for (Object[] row : documentRepository.countByCategoryForPatient(patientId.value())) {
            byCategory.put((DocumentCategory) row[0], ((Number) row[1]).longValue());
        }

        return new DocumentStats(
            documentRepository.countByPatientId(patientId.value()),
            byCategory,
            documentRepository.sumFileSizeByPatientId(patientId.value()),
            documentRepository.findTop5ByPatientIdOrderByCreatedAtDesc(patientId.value())
                .stream().limit(RECENT_DOCUMENTS).toList());
    }

    // ========================================================================
    // Changes
    // ========================================================================

    public Document update(ClinicPrincipal principal, DocumentId id, UpdateDocumentRequest request) {
        Document document = requireAccess(principal, id, DocumentAction.UPDATE);
        if (request.sharedWithPatient() != null) {
            requireAllowed(principal, document, DocumentAction.SHARE);
            document.setSharedWithPatient(request.sharedWithPatient());
        }
        if (request.description() != null) {
            document.setDescription(request.description());
        }
        if (request.category() != null) {
            document.setCategory(request.category());
        }
        return documentRepository.save(document);
    }

    public Document setSharing(ClinicPrincipal principal, DocumentId id, boolean shared) {
        if (principal.isPatient()) {
            throw new AccessDeniedException("Patients cannot modify document sharing");
        }
        Document document = requireAccess(principal, id, DocumentAction.SHARE);
        document.setSharedWithPatient(shared);
        Document saved = documentRepository.save(document);
        log.info("Document {} sharedWithPatient={} (by {})", id, shared, principal.id());
        return saved;
    }

    public void delete(ClinicPrincipal principal, DocumentId id) {
        Document document = requireAccess(principal, id, DocumentAction.DELETE);
        documentRepository.delete(document);
        storageGateway.delete(document.getStorageKey());
        log.info("Deleted document {} ({})", id, document.getStorageKey());
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private Document requireAccess(ClinicPrincipal principal, DocumentId id, DocumentAction action) {
        Document document = documentRepository.findById(id.value())
            .orElseThrow(() -> new EntityNotFoundException("Document not found: " + id));
        requireAllowed(principal, document, action);
        return document;
    }

    private void requireAllowed(ClinicPrincipal principal, Document document, DocumentAction action) {
        if (!accessPolicy.isAllowed(principal, document, action)) {
            log.warn("{} {} denied {} on document {}", principal.role(), principal.id(), action, document.getId());
            throw new AccessDeniedException("Access denied");
        }
    }

    private String resolveAppointment(String rawAppointmentId, PatientId patientId) {
        if (rawAppointmentId == null || rawAppointmentId.isBlank()) {
            return null;
        }
        Appointment appointment = appointmentService.getById(AppointmentId.create(rawAppointmentId));
        if (!appointment.getPatientId().equals(patientId.value())) {
            throw new ConflictException("Appointment " + rawAppointmentId + " belongs to another patient");
        }
        return appointment.getId();
    }

    static Sort toSort(String field, String order) {
        String sortField = field == null || field.isBlank() ? "createdAt" : field;
        if (!SORT_FIELDS.contains(sortField)) {
            throw new InvalidFormatException("Cannot sort documents by " + sortField
                + " (expected one of " + String.join(", ", SORT_FIELDS) + ")");
        }
        String sortOrder = order == null || order.isBlank() ? "desc" : order.toLowerCase();
        return switch (sortOrder) {
            case "asc" -> Sort.by(Sort.Direction.ASC, sortField);
            case "desc" -> Sort.by(Sort.Direction.DESC, sortField);
            default -> throw new InvalidFormatException("Sort order must be asc or desc, got " + order);
        };
    }

    private static Specification<Document> toSpecification(DocumentFilter filter) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            if (filter.patientId() != null) {
                predicates.add(cb.equal(root.get("patientId"), filter.patientId()));
            }
            if (filter.doctorId() != null) {
                predicates.add(cb.equal(root.get("doctorId"), filter.doctorId()));
            }
            if (filter.appointmentId() != null) {
                predicates.add(cb.equal(root.get("appointmentId"), filter.appointmentId()));
            }
            if (filter.category() != null) {
                predicates.add(cb.equal(root.get("category"), filter.category()));
            }
            if (filter.shared() != null) {
                predicates.add(cb.equal(root.get("sharedWithPatient"), filter.shared()));
            }
            if (filter.uploadedBy() != null) {
                predicates.add(cb.equal(root.get("uploadedBy"), filter.uploadedBy()));
            }
            return cb.and(predicates.toArray(new Predicate[0]));
        };
    }
}
