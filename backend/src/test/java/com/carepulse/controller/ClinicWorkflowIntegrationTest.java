package com.carepulse.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;
import org.springframework.transaction.annotation.Transactional;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Booking, status, check-in, document and SMS flows through the HTTP layer
 * against an in-memory database. Authentication is off in the test profile.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Transactional
class ClinicWorkflowIntegrationTest {

    // Monday
    private static final String MONDAY_10AM = "2030-03-04T10:00:00";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private String patientId;
    private String doctorId;

    @BeforeEach
    void setUp() throws Exception {
        patientId = createPatient("alice.tan@example.com", "+65 9123 4567");
        doctorId = createDoctor("dr.lim@example.com");
    }

    // ========================================================================
    // Patients and doctors
    // ========================================================================

    @Test
    void patientIsStoredWithNormalizedPhone() throws Exception {
        mockMvc.perform(get("/api/patients/{id}", patientId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.phone").value("91234567"))
            .andExpect(jsonPath("$.phoneDisplay").value("+65 9123 4567"))
            .andExpect(jsonPath("$.fullName").value("Alice Tan"))
            .andExpect(jsonPath("$.userId", startsWith("user_")));

        mockMvc.perform(get("/api/patients/lookup").param("phone", "9123-4567"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.id").value(patientId));
    }

    @Test
    void duplicatePatientEmailIsConflict() throws Exception {
        postJson("/api/patients", patientBody("alice.tan@example.com", "+65 8123 4567"))
            .andExpect(status().isConflict());
    }

    @Test
    void invalidPhoneIsRejected() throws Exception {
        postJson("/api/patients", patientBody("bob@example.com", "+65 1234 5678"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_FORMAT"));
    }

    @Test
    void malformedIdIsBadRequestAndUnknownIdIsNotFound() throws Exception {
        mockMvc.perform(get("/api/patients/{id}", "not-an-id"))
            .andExpect(status().isBadRequest());
        mockMvc.perform(get("/api/patients/{id}", "patient_missing1"))
            .andExpect(status().isNotFound());
    }

    @Test
    void patientListIsPaged() throws Exception {
        createPatient("bob.ng@example.com", "+65 8123 4567");

        mockMvc.perform(get("/api/patients").param("limit", "1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(2))
            .andExpect(jsonPath("$.limit").value(1))
            .andExpect(jsonPath("$.patients.length()").value(1));

        mockMvc.perform(get("/api/patients").param("limit", "500"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void doctorWithAppointmentsIsDeactivatedInsteadOfDeleted() throws Exception {
        book(MONDAY_10AM, "CHECK_UP");

        mockMvc.perform(delete("/api/doctors/{id}", doctorId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.active").value(false));

        postJson("/api/appointments", appointmentBody("2030-03-04T14:00:00", "CHECK_UP"))
            .andExpect(status().isConflict());

        mockMvc.perform(get("/api/doctors/{id}/appointments", doctorId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.length()").value(1));
    }

    // ========================================================================
    // Appointments
    // ========================================================================

    @Test
    void followUpDefaultsToThirtyMinutesAndMovesThroughStatuses() throws Exception {
        String appointmentId = book(MONDAY_10AM, "FOLLOW_UP");

        mockMvc.perform(get("/api/appointments/{id}", appointmentId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("SCHEDULED"))
            .andExpect(jsonPath("$.durationMinutes").value(30))
            .andExpect(jsonPath("$.duration").value("PT0H30M"));

        patchStatus(appointmentId, "IN_PROGRESS").andExpect(status().isOk());
        patchStatus(appointmentId, "COMPLETED")
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"));

        patchStatus(appointmentId, "IN_PROGRESS")
            .andExpect(status().isConflict())
            .andExpect(jsonPath("$.error").value("INVALID_STATUS_TRANSITION"));
    }

    @Test
    void overlappingBookingForSameDoctorIsConflict() throws Exception {
        book(MONDAY_10AM, "CHECK_UP");

        postJson("/api/appointments", appointmentBody("2030-03-04T10:15:00", "FOLLOW_UP"))
            .andExpect(status().isConflict());

        postJson("/api/appointments", appointmentBody("2030-03-04T10:30:00", "FOLLOW_UP"))
            .andExpect(status().isCreated());
    }

    @Test
    void cancelledAppointmentFreesTheSlot() throws Exception {
        String first = book(MONDAY_10AM, "CHECK_UP");
        patchStatus(first, "CANCELLED").andExpect(status().isOk());

        postJson("/api/appointments", appointmentBody(MONDAY_10AM, "CHECK_UP"))
            .andExpect(status().isCreated());
    }

    @Test
    void bookingOutsideOperatingHoursIsRejected() throws Exception {
        postJson("/api/appointments", appointmentBody("2030-03-04T07:00:00", "CHECK_UP"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("OUT_OF_RANGE"));
    }

    @Test
    void patientWithAppointmentsCannotBeDeleted() throws Exception {
        book(MONDAY_10AM, "CHECK_UP");

        mockMvc.perform(delete("/api/patients/{id}", patientId))
            .andExpect(status().isConflict());
    }

    @Test
    void patientWithDocumentsCannotBeDeletedAndDocumentSurvives() throws Exception {
        String fileId = uploadLabResult(patientId);

        mockMvc.perform(delete("/api/patients/{id}", patientId))
            .andExpect(status().isConflict());

        mockMvc.perform(get("/api/patients/{id}", patientId))
            .andExpect(status().isOk());
        mockMvc.perform(get("/api/documents/{id}", fileId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.patientId").value(patientId));
    }

    @Test
    void deletedPatientCanRegisterAgainWithSameEmail() throws Exception {
        String bobId = createPatient("bob.ng@example.com", "+65 8123 4567");

        mockMvc.perform(delete("/api/patients/{id}", bobId))
            .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/patients/{id}", bobId))
            .andExpect(status().isNotFound());

        postJson("/api/patients", patientBody("bob.ng@example.com", "+65 8123 4567"))
            .andExpect(status().isCreated());
    }

    @Test
    void statsCountEveryStatus() throws Exception {
        book(MONDAY_10AM, "CHECK_UP");

        mockMvc.perform(get("/api/appointments/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalAppointments").value(1))
            .andExpect(jsonPath("$.byStatus.SCHEDULED").value(1))
            .andExpect(jsonPath("$.byStatus.NO_SHOW").value(0));
    }

    // ========================================================================
    // Check-in
    // ========================================================================

    @Test
    void checkInAssignsQueueNumberOnce() throws Exception {
        String appointmentId = book(MONDAY_10AM, "CHECK_UP");

        mockMvc.perform(post("/api/appointments/{id}/check-in", appointmentId))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.queueNumber").value(1))
            .andExpect(jsonPath("$.status").value("CHECKED_IN"));

        mockMvc.perform(post("/api/appointments/{id}/check-in", appointmentId))
            .andExpect(status().isConflict());

        mockMvc.perform(get("/api/appointments/{id}/queue-position", appointmentId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.queueNumber").value(1))
            .andExpect(jsonPath("$.patientsAhead").value(0));
    }

    // ========================================================================
    // Documents
    // ========================================================================

    @Test
    void twoPhaseUploadCreatesDocument() throws Exception {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("fileName", "blood-panel.pdf");
        request.put("fileType", "application/pdf");
        request.put("fileSize", 2048);
        request.put("patientId", patientId);
        request.put("category", "LAB_RESULTS");
        request.put("description", "Blood panel");

        JsonNode ticket = readJson(postJson("/api/documents/upload-url", request)
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.uploadUrl", startsWith("http://localhost:8080/mock-upload/doc_"))));
        String fileId = ticket.get("fileId").asText();
        String storageKey = ticket.get("storageKey").asText();
        assertThat(storageKey).startsWith("documents/" + patientId + "/").endsWith(fileId + ".pdf");

        postJson("/api/documents/confirm", Map.of("storageKey", storageKey, "fileId", fileId))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.id").value(fileId))
            .andExpect(jsonPath("$.categoryLabel").value("Lab Results"))
            .andExpect(jsonPath("$.sharedWithPatient").value(false));

        mockMvc.perform(get("/api/documents").param("patientId", patientId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.pagination.total").value(1))
            .andExpect(jsonPath("$.documents[0].fileName").value("blood-panel.pdf"));

        mockMvc.perform(get("/api/documents/{id}/download-url", fileId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.downloadUrl").value("http://localhost:8080/mock-download/" + fileId));

        mockMvc.perform(patch("/api/documents/{id}/share", fileId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"sharedWithPatient\":true}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.sharedWithPatient").value(true));

        mockMvc.perform(get("/api/documents/patients/{patientId}/stats", patientId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalDocuments").value(1))
            .andExpect(jsonPath("$.totalFileSize").value(2048));

        mockMvc.perform(delete("/api/documents/{id}", fileId))
            .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/documents/{id}", fileId))
            .andExpect(status().isNotFound());
    }

    @Test
    void disallowedFileTypeIsRejected() throws Exception {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("fileName", "setup.exe");
        request.put("fileType", "application/x-msdownload");
        request.put("fileSize", 2048);
        request.put("patientId", patientId);
        request.put("category", "OTHER");

        postJson("/api/documents/upload-url", request)
            .andExpect(status().isBadRequest());
    }

    @Test
    void confirmWithoutUploadRequestIsNotFound() throws Exception {
        postJson("/api/documents/confirm", Map.of("storageKey", "documents/x/y/doc_nope.pdf", "fileId", "doc_nope"))
            .andExpect(status().isNotFound());
    }

    // ========================================================================
    // SMS
    // ========================================================================

    @Test
    void smsIsSentToNormalizedNumber() throws Exception {
        postJson("/api/sms/send", Map.of("to", "9123 4567", "body", "Your results are ready"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.success").value(true))
            .andExpect(jsonPath("$.to").value("+6591234567"))
            .andExpect(jsonPath("$.messageSid", startsWith("SM")));
    }

    @Test
    void smsToInvalidNumberReportsFailure() throws Exception {
        postJson("/api/sms/send", Map.of("to", "12345678", "body", "hello"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.success").value(false))
            .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void reminderUsesClinicTemplate() throws Exception {
        postJson("/api/sms/appointment/reminder", Map.of(
                "phoneNumber", "+6591234567",
                "patientName", "Alice Tan",
                "appointmentDate", "2030-03-04T10:00:00+08:00",
                "doctorName", "Dr. Lim"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.body", startsWith("Hi Alice Tan, this is a reminder for your appointment at CarePulse Clinic on Monday, 4 March 2030")));
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private String uploadLabResult(String forPatient) throws Exception {
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("fileName", "blood-panel.pdf");
        request.put("fileType", "application/pdf");
        request.put("fileSize", 2048);
        request.put("patientId", forPatient);
        request.put("category", "LAB_RESULTS");

        JsonNode ticket = readJson(postJson("/api/documents/upload-url", request).andExpect(status().isOk()));
        String fileId = ticket.get("fileId").asText();
        postJson("/api/documents/confirm", Map.of("storageKey", ticket.get("storageKey").asText(), "fileId", fileId))
            .andExpect(status().isCreated());
        return fileId;
    }

    private String createPatient(String email, String phone) throws Exception {
        return readJson(postJson("/api/patients", patientBody(email, phone)).andExpect(status().isCreated()))
            .get("id").asText();
    }

    private String createDoctor(String email) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("firstName", "Wei");
        body.put("lastName", "Lim");
        body.put("email", email);
        body.put("specialization", "General Practice");
        return readJson(postJson("/api/doctors", body).andExpect(status().isCreated())).get("id").asText();
    }

    private String book(String scheduledDateTime, String type) throws Exception {
        return readJson(postJson("/api/appointments", appointmentBody(scheduledDateTime, type))
            .andExpect(status().isCreated())).get("id").asText();
    }

    private ResultActions patchStatus(String appointmentId, String status) throws Exception {
        return mockMvc.perform(patch("/api/appointments/{id}/status", appointmentId)
            .contentType(MediaType.APPLICATION_JSON)
            .content(objectMapper.writeValueAsString(Map.of("status", status))));
    }

    private Map<String, Object> patientBody(String email, String phone) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("firstName", "Alice");
        body.put("lastName", "Tan");
        body.put("email", email);
        body.put("phone", phone);
        body.put("dateOfBirth", "1985-06-15");
        return body;
    }

    private Map<String, Object> appointmentBody(String scheduledDateTime, String type) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("patientId", patientId);
        body.put("doctorId", doctorId);
        body.put("type", type);
        body.put("scheduledDateTime", scheduledDateTime);
        return body;
    }

    private ResultActions postJson(String url, Object body) throws Exception {
        return mockMvc.perform(post(url)
            .contentType(MediaType.APPLICATION_JSON)
            .content(objectMapper.writeValueAsString(body)));
    }

    private JsonNode readJson(ResultActions result) throws Exception {
        return objectMapper.readTree(result.andReturn().getResponse().getContentAsString());
    }
}
