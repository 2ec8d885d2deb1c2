package com.phillippitts.routineengine.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Polling settings for state-change and vision-detection triggers.
 */
@ConfigurationProperties(prefix = "routines.trigger")
@Validated
public class TriggerProperties {

    /** Interval between state polls of a monitored entity. */
    @NotNull
    private Duration statePollInterval = Duration.ofSeconds(30);

    /** Vision poll interval used when a trigger does not set checkInterval. */
    @NotNull
    private Duration visionDefaultCheckInterval = Duration.ofSeconds(10);

    /** Minimum detection confidence used when a trigger does not set minConfidence. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double visionDefaultMinConfidence = 0.5;

    public Duration getStatePollInterval() {
        return statePollInterval;
    }

    public void setStatePollInterval(Duration statePollInterval) {
        this.statePollInterval = statePollInterval;
    }

    public Duration getVisionDefaultCheckInterval() {
        return visionDefaultCheckInterval;
    }

    public void setVisionDefaultCheckInterval(Duration visionDefaultCheckInterval) {
        this.visionDefaultCheckInterval = visionDefaultCheckInterval;
    }

    public double getVisionDefaultMinConfidence() {
        return visionDefaultMinConfidence;
    }

    public void setVisionDefaultMinConfidence(double visionDefaultMinConfidence) {
        this.visionDefaultMinConfidence = visionDefaultMinConfidence;
    }
}
