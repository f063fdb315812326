package com.carepulse.service.sms;

/**
 * Raised by an {@link SmsGateway} when the provider rejects or fails a message.
 */
public class SmsDeliveryException extends RuntimeException {

    public SmsDeliveryException(String message) {
        super(message);
    }

    public SmsDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
