package com.carepulse.service.sms;

/**
 * Outbound SMS provider seam.
 */
public interface SmsGateway {

    /**
     * Send a message and return the provider's message id.
     *
     * @param to   destination in E.164 form, e.g. {@code +6591234567}
     * @param from sender number
     * @param body message text
     * @throws SmsDeliveryException if the provider does not accept the message
     */
    String send(String to, String from, String body);
}
