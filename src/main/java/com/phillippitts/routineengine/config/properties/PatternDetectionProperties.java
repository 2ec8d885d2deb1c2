package com.phillippitts.routineengine.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Settings for detecting recurring task patterns that could become routines.
 */
@ConfigurationProperties(prefix = "routines.patterns")
@Validated
public class PatternDetectionProperties {

    private boolean enabled = true;

    /** Minimum repetitions before a pattern is considered. */
    @Positive
    private int minOccurrences = 3;

    /** Minimum confidence for a pattern to be published. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double confidenceThreshold = 0.7;

    /** Confidence floor for sequential pairs. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double sequentialConfidenceFloor = 0.3;

    @NotNull
    private Duration checkInterval = Duration.ofHours(1);

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getMinOccurrences() {
        return minOccurrences;
    }

    public void setMinOccurrences(int minOccurrences) {
        this.minOccurrences = minOccurrences;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public void setConfidenceThreshold(double confidenceThreshold) {
        this.confidenceThreshold = confidenceThreshold;
    }

    public double getSequentialConfidenceFloor() {
        return sequentialConfidenceFloor;
    }

    public void setSequentialConfidenceFloor(double sequentialConfidenceFloor) {
        this.sequentialConfidenceFloor = sequentialConfidenceFloor;
    }

    public Duration getCheckInterval() {
        return checkInterval;
    }

    public void setCheckInterval(Duration checkInterval) {
        this.checkInterval = checkInterval;
    }
}
