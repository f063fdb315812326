package com.carepulse.controller;

import com.carepulse.dto.request.ConfirmUploadRequest;
import com.carepulse.dto.request.ShareDocumentRequest;
import com.carepulse.dto.request.UpdateDocumentRequest;
import com.carepulse.dto.request.UploadUrlRequest;
import com.carepulse.dto.response.DocumentDto;
import com.carepulse.dto.response.DocumentListDto;
import com.carepulse.dto.response.DocumentStatsDto;
import com.carepulse.model.document.Document;
import com.carepulse.model.enums.DocumentCategory;
import com.carepulse.model.id.DocumentId;
import com.carepulse.model.id.PatientId;
import com.carepulse.security.ClinicPrincipal;
import com.carepulse.security.PrincipalResolver;
import com.carepulse.service.document.DocumentFilter;
import com.carepulse.service.document.DocumentService;
import com.carepulse.service.document.DownloadLink;
import com.carepulse.service.document.UploadTicket;
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
 * REST controller for patient documents. Every operation is checked against the
 * calling principal.
 */
@RestController
@RequestMapping("/api/documents")
@Validated
@Slf4j
public class DocumentController {

    private final DocumentService documentService;
    private final PrincipalResolver principalResolver;

    public DocumentController(DocumentService documentService, PrincipalResolver principalResolver) {
        this.documentService = documentService;
        this.principalResolver = principalResolver;
    }

    // ========================================================================
    // Upload
    // ========================================================================

    /**
     * Issue a direct upload URL and remember the pending upload.
     */
    @PostMapping("/upload-url")
    public ResponseEntity<UploadTicket> requestUploadUrl(@Valid @RequestBody UploadUrlRequest request) {
        ClinicPrincipal principal = principalResolver.current();
        log.info("Upload URL requested by {} for patient {}: {}", principal.id(), request.patientId(),
            request.fileName());
        return ResponseEntity.ok(documentService.requestUpload(principal, request));
    }

    @PostMapping("/confirm")
    public ResponseEntity<DocumentDto> confirmUpload(@Valid @RequestBody ConfirmUploadRequest request) {
        Document saved = documentService.confirmUpload(principalResolver.current(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(DocumentDto.fromEntity(saved));
    }

    // ========================================================================
    // Read Operations
    // ========================================================================

    @GetMapping
    public ResponseEntity<DocumentListDto> getDocuments(
            @RequestParam(required = false) String patientId,
            @RequestParam(required = false) String doctorId,
            @RequestParam(required = false) String appointmentId,
            @RequestParam(required = false) DocumentCategory category,
            @RequestParam(required = false) Boolean shared,
            @RequestParam(required = false) String uploadedBy,
            @RequestParam(defaultValue = "createdAt") String sortBy,
            @RequestParam(defaultValue = "desc") String sortOrder,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset) {

        DocumentFilter filter = new DocumentFilter(
            blankToNull(patientId), blankToNull(doctorId), blankToNull(appointmentId),
            category, shared, blankToNull(uploadedBy));

        Page<Document> page = documentService.list(principalResolver.current(), filter, sortBy, sortOrder,
            limit, offset);

        return ResponseEntity.ok(new DocumentListDto(
            page.getContent().stream().map(DocumentDto::fromEntity).toList(),
            new DocumentListDto.Pagination(limit, offset, page.getTotalElements())));
    }

    @GetMapping("/{id}")
    public ResponseEntity<DocumentDto> getDocument(@PathVariable String id) {
        Document document = documentService.get(principalResolver.current(), DocumentId.create(id));
        return ResponseEntity.ok(DocumentDto.fromEntity(document));
    }

    @GetMapping("/{id}/download-url")
    public ResponseEntity<DownloadLink> getDownloadUrl(@PathVariable String id) {
        return ResponseEntity.ok(documentService.createDownloadLink(principalResolver.current(), DocumentId.create(id)));
    }

    @GetMapping("/patients/{patientId}/stats")
    public ResponseEntity<DocumentStatsDto> getPatientStats(@PathVariable String patientId) {
        return ResponseEntity.ok(DocumentStatsDto.from(
            documentService.getPatientStats(principalResolver.current(), PatientId.create(patientId))));
    }

    // ========================================================================
    // Write Operations
    // ========================================================================

    @PatchMapping("/{id}")
    public ResponseEntity<DocumentDto> updateDocument(
            @PathVariable String id,
            @RequestBody UpdateDocumentRequest request) {
        Document saved = documentService.update(principalResolver.current(), DocumentId.create(id), request);
        return ResponseEntity.ok(DocumentDto.fromEntity(saved));
    }

    /**
     * Toggle whether the patient can see the document. Not available to patients.
     */
    @PatchMapping("/{id}/share")
    public ResponseEntity<DocumentDto> setSharing(
            @PathVariable String id,
            @Valid @RequestBody ShareDocumentRequest request) {
        Document saved = documentService.setSharing(principalResolver.current(), DocumentId.create(id),
            request.sharedWithPatient());
        return ResponseEntity.ok(DocumentDto.fromEntity(saved));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteDocument(@PathVariable String id) {
        documentService.delete(principalResolver.current(), DocumentId.create(id));
        return ResponseEntity.noContent().build();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
