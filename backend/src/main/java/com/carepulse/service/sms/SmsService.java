package com.carepulse.service.sms;

import com.carepulse.config.ClinicProperties;
import com.carepulse.exception.InvalidFormatException;
import com.carepulse.model.value.PhoneNumber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Builds patient notifications and hands them to the {@link SmsGateway}.
 * Never throws for delivery problems; failures come back as an unsuccessful {@link SmsResult}.
 */
@Service
@Slf4j
public class SmsService {

    static final Locale SINGAPORE = Locale.forLanguageTag("en-SG");
    static final DateTimeFormatter APPOINTMENT_DATE =
        DateTimeFormatter.ofPattern("EEEE, d MMMM yyyy, hh:mm a", SINGAPORE);

    private static final String DEFAULT_CANCELLATION_REASON = "unforeseen circumstances";

    private final SmsGateway gateway;
    private final ClinicProperties properties;
    private final Clock clock;

    public SmsService(SmsGateway gateway, ClinicProperties properties, Clock clock) {
        this.gateway = gateway;
        this.properties = properties;
        this.clock = clock;
    }

    // ========================================================================
    // Sending
    // ========================================================================

    /**
     * Normalize the destination and send.
     */
    public SmsResult send(String to, String body) {
        PhoneNumber phone;
        try {
            phone = PhoneNumber.of(to);
        } catch (InvalidFormatException e) {
            log.warn("SMS not sent, invalid destination {}", to);
            return SmsResult.failed(e.getMessage(), to, body);
        }

        String destination = phone.formatForSms();
        try {
            String sid = gateway.send(destination, properties.getSms().getFromNumber(), body);
            log.info("SMS {} sent to {}", sid, destination);
            return SmsResult.sent(sid, destination, body);
        } catch (SmsDeliveryException e) {
            log.error("Failed to send SMS to {}", destination, e);
            return SmsResult.failed(e.getMessage(), destination, body);
        }
    }

    public SmsResult sendAppointmentReminder(String phoneNumber, String patientName,
                                             OffsetDateTime appointmentDate, String doctorName,
                                             String clinicName) {
        String body = String.format(
            "Hi %s, this is a reminder for your appointment at %s on %s with %s. "
                + "Please arrive 15 minutes early. Reply STOP to opt out.",
            patientName, clinicOrDefault(clinicName), formatAppointmentDate(appointmentDate), doctorName);
        return send(phoneNumber, body);
    }

    public SmsResult sendAppointmentConfirmation(String phoneNumber, String patientName,
                                                 OffsetDateTime appointmentDate, String doctorName,
                                                 String clinicName) {
        String body = String.format(
            "Hi %s, your appointment at %s has been confirmed for %s with %s. "
                + "We look forward to seeing you! Reply STOP to opt out.",
            patientName, clinicOrDefault(clinicName), formatAppointmentDate(appointmentDate), doctorName);
        return send(phoneNumber, body);
    }

    public SmsResult sendAppointmentCancellation(String phoneNumber, String patientName,
                                                 OffsetDateTime appointmentDate, String reason,
                                                 String clinicName) {
        String body = String.format(
            "Hi %s, we regret to inform you that your appointment at %s on %s has been cancelled due to %s. "
                + "Please call us to reschedule. Reply STOP to opt out.",
            patientName, clinicOrDefault(clinicName), formatAppointmentDate(appointmentDate),
            reason == null || reason.isBlank() ? DEFAULT_CANCELLATION_REASON : reason);
        return send(phoneNumber, body);
    }

    public SmsResult sendCustomMessage(String phoneNumber, String message) {
        return send(phoneNumber, message);
    }

    public SmsResult sendTestMessage(String phoneNumber) {
        String now = OffsetDateTime.now(clock).atZoneSameInstant(clinicZone()).format(APPOINTMENT_DATE);
        return send(phoneNumber,
            "Hello from CarePulse! This is a test message to verify SMS functionality. Time: " + now);
    }

    // ========================================================================
    // Formatting
    // ========================================================================

    /**
     * Render an instant in clinic-local time, e.g. {@code Monday, 1 December 2025, 02:30 pm}.
     */
    public String formatAppointmentDate(OffsetDateTime appointmentDate) {
        return appointmentDate.atZoneSameInstant(clinicZone()).format(APPOINTMENT_DATE);
    }

    private String clinicOrDefault(String clinicName) {
        return clinicName == null || clinicName.isBlank() ? properties.getClinicName() : clinicName;
    }

    private ZoneId clinicZone() {
        return ZoneId.of(properties.getSms().getTimeZone());
    }
}
