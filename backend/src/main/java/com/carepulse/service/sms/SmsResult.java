package com.carepulse.service.sms;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Outcome of a send attempt. {@code to} is the E.164 number when the input
 * could be normalized, otherwise the raw input.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SmsResult(boolean success, String messageSid, String error, String to, String body) {

    public static SmsResult sent(String messageSid, String to, String body) {
        return new SmsResult(true, messageSid, null, to, body);
    }

    public static SmsResult failed(String error, String to, String body) {
        return new SmsResult(false, null, error, to, body);
    }
}
