package com.carepulse.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Clinic settings bound from the {@code carepulse.*} keys.
 */
@ConfigurationProperties(prefix = "carepulse")
@Getter
@Setter
public class ClinicProperties {

    /**
     * Name used in SMS templates.
     */
    private String clinicName = "CarePulse Clinic";

    /**
     * Create demo staff, doctors, patients and appointments on startup.
     */
    private boolean seedDemoData = false;

    private Scheduling scheduling = new Scheduling();

    private Storage storage = new Storage();

    private Sms sms = new Sms();

    @Getter
    @Setter
    public static class Scheduling {

        /**
         * Reject bookings that start before opening or end after closing.
         */
        private boolean enforceOperatingHours = true;

        /**
         * Estimated consultation time per patient ahead in the queue.
         */
        private int minutesPerQueuedPatient = 15;
    }

    @Getter
    @Setter
    public static class Storage {

        private String baseUrl = "http://localhost:8080";

        private Duration pendingUploadTtl = Duration.ofMinutes(15);

        /**
         * Delay between runs of the expired pending upload cleanup.
         */
        private Duration reaperInterval = Duration.ofMinutes(5);

        private Duration downloadUrlTtl = Duration.ofHours(1);

        private long maxFileSizeBytes = 10L * 1024 * 1024;
    }

    @Getter
    @Setter
    public static class Sms {

        /**
         * Sender number shown on outgoing messages.
         */
        private String fromNumber = "+6560000000";

        private String timeZone = "Asia/Singapore";
    }
}
