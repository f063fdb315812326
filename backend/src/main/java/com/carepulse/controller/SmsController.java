package com.carepulse.controller;

import com.carepulse.dto.request.SendSmsRequest;
import com.carepulse.service.sms.SmsResult;
import com.carepulse.service.sms.SmsService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for patient SMS notifications.
 * A send that the gateway does not accept is answered with 400 and the failed {@link SmsResult}.
 */
@RestController
@RequestMapping("/api/sms")
@Slf4j
public class SmsController {

    private final SmsService smsService;

    public SmsController(SmsService smsService) {
        this.smsService = smsService;
    }

    @PostMapping("/send")
    public ResponseEntity<SmsResult> send(@Valid @RequestBody SendSmsRequest.Raw request) {
        log.info("Sending SMS to {}: {}", request.to(), abbreviate(request.body()));
        return toResponse(smsService.send(request.to(), request.body()));
    }

    @PostMapping("/appointment/reminder")
    public ResponseEntity<SmsResult> sendReminder(@Valid @RequestBody SendSmsRequest.AppointmentNotice request) {
        log.info("Sending appointment reminder to {}", request.phoneNumber());
        return toResponse(smsService.sendAppointmentReminder(request.phoneNumber(), request.patientName(),
            request.appointmentDate(), request.doctorName(), request.clinicName()));
    }

    @PostMapping("/appointment/confirmation")
    public ResponseEntity<SmsResult> sendConfirmation(@Valid @RequestBody SendSmsRequest.AppointmentNotice request) {
        log.info("Sending appointment confirmation to {}", request.phoneNumber());
        return toResponse(smsService.sendAppointmentConfirmation(request.phoneNumber(), request.patientName(),
            request.appointmentDate(), request.doctorName(), request.clinicName()));
    }

    @PostMapping("/appointment/cancellation")
    public ResponseEntity<SmsResult> sendCancellation(@Valid @RequestBody SendSmsRequest.Cancellation request) {
        log.info("Sending appointment cancellation to {}", request.phoneNumber());
        return toResponse(smsService.sendAppointmentCancellation(request.phoneNumber(), request.patientName(),
            request.appointmentDate(), request.reason(), request.clinicName()));
    }

    @PostMapping("/custom")
    public ResponseEntity<SmsResult> sendCustom(@Valid @RequestBody SendSmsRequest.Custom request) {
        log.info("Sending custom SMS to {}", request.phoneNumber());
        return toResponse(smsService.sendCustomMessage(request.phoneNumber(), request.message()));
    }

    @PostMapping("/test")
    public ResponseEntity<SmsResult> sendTest(@Valid @RequestBody SendSmsRequest.Test request) {
        log.info("Sending test SMS to {}", request.phoneNumber());
        return toResponse(smsService.sendTestMessage(request.phoneNumber()));
    }

    private static ResponseEntity<SmsResult> toResponse(SmsResult result) {
        return result.success()
            ? ResponseEntity.ok(result)
            : ResponseEntity.badRequest().body(result);
    }

    private static String abbreviate(String body) {
        return body.length() <= 50 ? body : body.substring(0, 50) + "...";
    }
}
