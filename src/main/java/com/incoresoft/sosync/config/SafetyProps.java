package com.incoresoft.sosync.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Coordination settings. Read from the `safety` block of application.yml.
 */
@Data
@ConfigurationProperties(prefix = "safety")
public class SafetyProps {
    /**
     * Wait before a completion evaluation, so that responses arriving in a burst are seen together.
     */
    private Duration settleDelay = Duration.ofMillis(500);
    /**
     * How many times a completion evaluation is attempted when the store fails.
     */
    private int evaluationAttempts = 3;
    /**
     * How long a group stays AllSafe before it drops back to Normal.
     */
    private Duration resetDelay = Duration.ofMinutes(60);
    /**
     * Age an SOS alert must reach before the group admin may cancel someone else's alert.
     */
    private Duration adminCancelAfter = Duration.ofHours(24);
    private int defaultSafetyCheckIntervalMinutes = 30;
    private int defaultSosIntervalMinutes = 5;
    /** Address put on an alert raised from a check response that carried no location. */
    private String checkResponseAddress = "Safety check response location";
}
