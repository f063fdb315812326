package com.carepulse.service.sms;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Development gateway: logs the message and returns a synthetic message id.
 */
@Component
@Slf4j
public class LoggingSmsGateway implements SmsGateway {

    @Override
    public String send(String to, String from, String body) {
        String sid = "SM" + UUID.randomUUID().toString().replace("-", "");
        log.info("SMS {} from {} to {}: {}", sid, from, to, body);
        return sid;
    }
}
